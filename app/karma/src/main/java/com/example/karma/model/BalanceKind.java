package com.example.karma.model;

public enum BalanceKind {
  KARMA,
  REPUTATION
}
