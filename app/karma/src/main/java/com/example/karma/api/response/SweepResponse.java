/*
 * どこで: Karma 内部 API レスポンス DTO
 * 何を: 手動 tick の集計結果を返す
 */
package com.example.karma.api.response;

import com.example.karma.service.SweepReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SweepResponse(
    int expiredOrders, int expiredClaims, int expiredOffers, int skipped, int failed) {

  public static SweepResponse from(SweepReport report) {
    return new SweepResponse(
        report.expiredOrders(),
        report.expiredClaims(),
        report.expiredOffers(),
        report.skipped(),
        report.failed());
  }
}
