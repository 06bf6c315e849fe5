/*
 * どこで: common のイベント payload 定義
 * 何を: 注文/オファーの状態遷移イベントを共通レコードとして提供する
 * なぜ: 通知層(チャット描画側)と同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 注文/オファーの遷移イベント。
 *
 * <p>オファーのイベントでは requester/category/karma_cost/bonus_multiplier を持たず、
 * 代わりに capabilities を載せる。値の無い項目は JSON から省く。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String recordKind,
    String recordId,
    String status,
    String requesterId,
    String recipientId,
    String runnerId,
    String category,
    List<String> capabilities,
    Integer karmaCost,
    Integer bonusMultiplier,
    String externalMessageRef,
    String traceId) {}
