/*
 * どこで: Karma ドメインモデル
 * 何を: claim 済みの通知 outbox 行を表す
 * なぜ: Dispatcher が DB 行から必要情報だけを扱えるようにするため
 */
package com.example.karma.model;

import java.time.Instant;
import java.util.UUID;

public record OutboxEventRecord(
    UUID eventId,
    String eventType,
    String aggregateKey,
    String payloadJson,
    int attemptCount,
    Instant createdAt) {}
