/*
 * どこで: Karma ドメインモデル
 * 何を: orders テーブルの 1 行を表す
 * なぜ: 状態遷移の判定と API 応答で同じ形を使うため
 */
package com.example.karma.model;

import java.time.Instant;
import java.util.UUID;

public record OrderRecord(
    UUID orderId,
    OrderStatus status,
    InitiatedBy initiatedBy,
    UUID offerId,
    String requesterId,
    String recipientId,
    String runnerId,
    String category,
    int karmaCost,
    String dropLocation,
    Instant createdAt,
    Instant expiryAt,
    Instant claimedAt,
    Instant claimedExpiryAt,
    Instant deliveredAt,
    int bonusMultiplier,
    String externalMessageRef,
    Instant updatedAt) {}
