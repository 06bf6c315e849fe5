/*
 * どこで: Karma サービス層
 * 何を: 1 回のスイープで期限切れにした件数と失敗件数を保持する
 * なぜ: tick の結果をログ/API で確認できるようにするため
 */
package com.example.karma.service;

public record SweepReport(
    int expiredOrders, int expiredClaims, int expiredOffers, int skipped, int failed) {

  public static SweepReport empty() {
    return new SweepReport(0, 0, 0, 0, 0);
  }

  public int totalExpired() {
    return expiredOrders + expiredClaims + expiredOffers;
  }
}
