/*
 * どこで: Karma API レスポンス DTO
 * 何を: 注文の表示用フィールドを定義する
 * なぜ: チャット側の表示処理が必要とする項目を固定するため
 */
package com.example.karma.api.response;

import com.example.karma.model.OrderRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderResponse(
    String orderId,
    String status,
    String initiatedBy,
    String offerId,
    String requesterId,
    String recipientId,
    String runnerId,
    String category,
    int karmaCost,
    String dropLocation,
    String createdAt,
    String expiryAt,
    String claimedAt,
    String claimedExpiryAt,
    String deliveredAt,
    int bonusMultiplier,
    String externalMessageRef) {

  public static OrderResponse from(OrderRecord order) {
    return new OrderResponse(
        order.orderId().toString(),
        order.status().name(),
        order.initiatedBy().name(),
        order.offerId() == null ? null : order.offerId().toString(),
        order.requesterId(),
        order.recipientId(),
        order.runnerId(),
        order.category(),
        order.karmaCost(),
        order.dropLocation(),
        format(order.createdAt()),
        format(order.expiryAt()),
        format(order.claimedAt()),
        format(order.claimedExpiryAt()),
        format(order.deliveredAt()),
        order.bonusMultiplier(),
        order.externalMessageRef());
  }

  static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
