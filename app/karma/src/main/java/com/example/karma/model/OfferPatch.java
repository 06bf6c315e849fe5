package com.example.karma.model;

import java.time.Instant;

/** オファーの条件付き更新で書き換える列。claimedAt が null なら現在値を維持する。 */
public record OfferPatch(OfferStatus status, Instant claimedAt) {

  public static OfferPatch status(OfferStatus status) {
    return new OfferPatch(status, null);
  }
}
