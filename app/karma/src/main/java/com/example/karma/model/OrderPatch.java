/*
 * どこで: Karma ドメインモデル
 * 何を: 条件付き更新で書き換える注文の列を表す
 * なぜ: null の列は現在値を維持し、遷移ごとに必要な列だけを更新するため
 */
package com.example.karma.model;

import java.time.Instant;

public record OrderPatch(
    OrderStatus status,
    String runnerId,
    Instant claimedAt,
    Instant claimedExpiryAt,
    Instant deliveredAt,
    Integer bonusMultiplier) {

  public static OrderPatch status(OrderStatus status) {
    return new OrderPatch(status, null, null, null, null, null);
  }
}
