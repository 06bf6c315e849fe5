package com.example.karma.model;

public enum UpdateOutcome {
  OK,
  CONFLICT,
  NOT_FOUND,
  TERMINAL_STATE
}
