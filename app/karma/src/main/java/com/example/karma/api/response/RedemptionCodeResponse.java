package com.example.karma.api.response;

import com.example.karma.model.RedemptionCodeRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RedemptionCodeResponse(
    String code,
    int karmaValue,
    int maxRedemptions,
    int perUserLimit,
    int redemptionCount,
    String activeFrom,
    String expiresAt) {

  public static RedemptionCodeResponse from(RedemptionCodeRecord record) {
    return new RedemptionCodeResponse(
        record.code(),
        record.karmaValue(),
        record.maxRedemptions(),
        record.perUserLimit(),
        record.redemptionCount(),
        OrderResponse.format(record.activeFrom()),
        OrderResponse.format(record.expiresAt()));
  }
}
