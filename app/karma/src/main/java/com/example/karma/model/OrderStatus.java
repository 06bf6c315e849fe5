/*
 * どこで: Karma ドメインモデル
 * 何を: orders.status の有効値と終端判定を表現する
 * なぜ: 終端状態への遷移要求を TERMINAL_STATE として区別するため
 */
package com.example.karma.model;

// DBのCHECK制約と値を一致させる。
public enum OrderStatus {
  ORDERED,
  CLAIMED,
  DELIVERED,
  CANCELLED,
  CANCELLED_BY_RUNNER,
  EXPIRED,
  EXPIRED_CLAIMED;

  public boolean isTerminal() {
    return this != ORDERED && this != CLAIMED;
  }
}
