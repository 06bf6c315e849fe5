package com.example.karma.api.response;

import com.example.karma.model.RedemptionReceipt;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RedemptionResponse(String code, String playerId, int karmaValue, long karmaBalance) {

  public static RedemptionResponse from(RedemptionReceipt receipt) {
    return new RedemptionResponse(
        receipt.code(), receipt.playerId(), receipt.karmaValue(), receipt.karmaBalance());
  }
}
