package com.example.karma.model;

import java.time.Instant;

public record RedemptionCodeRecord(
    String code,
    int karmaValue,
    int maxRedemptions,
    int perUserLimit,
    int redemptionCount,
    Instant activeFrom,
    Instant expiresAt,
    Instant createdAt) {

  public boolean isActiveAt(Instant now) {
    if (activeFrom != null && now.isBefore(activeFrom)) {
      return false;
    }
    return expiresAt == null || now.isBefore(expiresAt);
  }
}
