package com.example.karma.model;

import java.time.Instant;
import java.util.UUID;

public record LedgerEntryRecord(
    UUID entryId,
    String playerId,
    String referenceId,
    LedgerEntryType entryType,
    long karmaDelta,
    long reputationDelta,
    Instant createdAt) {}
