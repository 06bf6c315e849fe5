/*
 * どこで: Karma outbox の状態管理
 * 何を: outbox_events.status の有効値を enum で表現する
 * なぜ: レイヤ内で不正な状態値を防ぐため
 */
package com.example.karma.model;

public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  DISPATCHED,
  FAILED
}
