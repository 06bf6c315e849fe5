package com.example.karma.model;

import java.time.Instant;
import java.util.List;

public record NewOffer(String runnerId, List<String> capabilities, Instant expiryAt) {

  public NewOffer {
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
  }
}
