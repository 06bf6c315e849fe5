package com.example.karma.model;

/** 期限判定に使う orders の列。列名は SQL へ直接埋め込むため enum で固定する。 */
public enum ExpiryField {
  EXPIRY_AT("expiry_at"),
  CLAIMED_EXPIRY_AT("claimed_expiry_at");

  private final String column;

  ExpiryField(String column) {
    this.column = column;
  }

  public String column() {
    return column;
  }
}
