/*
 * どこで: Karma ドメインモデル
 * 何を: offers.status の有効値と拒否理由の判定を表現する
 * なぜ: 受注済みオファーへの要求を競合、取り下げ済みへの要求を終端として返し分けるため
 */
package com.example.karma.model;

public enum OfferStatus {
  OFFERED,
  CLAIMED,
  CANCELLED,
  EXPIRED_OFFER;

  /**
   * 受注されずに閉じたか。
   *
   * <p>CLAIMED は注文側へ引き渡し済みだが、別の依頼者に先を越されただけなので拒否理由は競合になる。
   */
  public boolean isWithdrawn() {
    return this == CANCELLED || this == EXPIRED_OFFER;
  }
}
