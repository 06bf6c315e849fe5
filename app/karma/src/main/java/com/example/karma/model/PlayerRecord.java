/*
 * どこで: Karma ドメインモデル
 * 何を: players テーブルの残高/評判/称号を表す
 * なぜ: 台帳操作の結果をまとめて返すため
 */
package com.example.karma.model;

import java.time.Instant;
import java.util.List;

public record PlayerRecord(
    String playerId,
    long karmaBalance,
    long reputationScore,
    String title,
    List<String> capabilities,
    int ordersRequestedCount,
    int deliveriesCompletedCount,
    Instant createdAt,
    Instant updatedAt) {

  public PlayerRecord {
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
  }
}
