package com.example.karma.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 注文作成時の入力。REQUESTER 起点は ORDERED、RUNNER 起点(オファー受注)は CLAIMED で作られる。
 */
public record NewOrder(
    OrderStatus status,
    InitiatedBy initiatedBy,
    UUID offerId,
    String requesterId,
    String recipientId,
    String runnerId,
    String category,
    int karmaCost,
    String dropLocation,
    Instant expiryAt,
    Instant claimedAt,
    Instant claimedExpiryAt) {}
