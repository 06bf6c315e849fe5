/*
 * どこで: Karma 通知イベント
 * 何を: 状態遷移ごとの通知イベント種別を定義する
 * なぜ: チャット側が種別だけで描画を切り替えられるようにするため
 */
package com.example.karma.model;

public enum OrderEventType {
  ORDER_PLACED("OrderPlaced"),
  ORDER_CLAIMED("OrderClaimed"),
  ORDER_CANCELLED("OrderCancelled"),
  ORDER_RELEASED("OrderReleased"),
  ORDER_DELIVERED("OrderDelivered"),
  ORDER_EXPIRED("OrderExpired"),
  ORDER_CLAIM_EXPIRED("OrderClaimExpired"),
  OFFER_POSTED("OfferPosted"),
  OFFER_CLAIMED("OfferClaimed"),
  OFFER_CANCELLED("OfferCancelled"),
  OFFER_EXPIRED("OfferExpired");

  private final String value;

  OrderEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
