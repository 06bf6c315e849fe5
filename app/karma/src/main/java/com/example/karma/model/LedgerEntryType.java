/*
 * どこで: Karma 台帳
 * 何を: ledger_entries.entry_type の有効値を定義する
 * なぜ: (reference_id, player_id, entry_type) 一意制約で二重計上を防ぐ単位にするため
 */
package com.example.karma.model;

public enum LedgerEntryType {
  ORDER_DEBIT,
  ORDER_REFUND,
  DELIVERY_REWARD,
  DELIVERY_REPUTATION,
  REDEMPTION
}
