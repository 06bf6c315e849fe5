/*
 * どこで: Karma ドメインモデル
 * 何を: offers テーブルの 1 行を表す
 * なぜ: ランナー起点のオファーを注文と別エンティティで扱うため
 */
package com.example.karma.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record OfferRecord(
    UUID offerId,
    OfferStatus status,
    String runnerId,
    List<String> capabilities,
    Instant createdAt,
    Instant expiryAt,
    Instant claimedAt,
    String externalMessageRef,
    Instant updatedAt) {

  public OfferRecord {
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
  }
}
