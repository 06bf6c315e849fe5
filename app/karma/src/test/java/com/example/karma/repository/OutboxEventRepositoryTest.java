/*
 * どこで: Karma テスト
 * 何を: outbox の claim/lease/配信済み削除を Postgres で検証する
 * なぜ: FOR UPDATE SKIP LOCKED とリース回収の方言差異を実 DB で確認するため
 */
package com.example.karma.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.karma.AbstractPostgresContainerTest;
import com.example.karma.model.OutboxEventRecord;
import com.example.karma.model.OutboxStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OutboxEventRepositoryTest extends AbstractPostgresContainerTest {

  private static final String PAYLOAD = "{\"event_id\":\"e\"}";

  @Autowired private OutboxEventRepository outboxEventRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
  }

  @Test
  void claimMovesPendingToInFlightOnce() {
    final Instant now = Instant.now();
    final UUID eventId = UUID.randomUUID();
    outboxEventRepository.insert(eventId, "OrderPlaced", "order:1", PAYLOAD, now);

    final List<OutboxEventRecord> first =
        outboxEventRepository.claimPending(10, now, now.plusSeconds(30), "worker-a");
    final List<OutboxEventRecord> second =
        outboxEventRepository.claimPending(10, now, now.plusSeconds(30), "worker-b");

    assertThat(first).extracting(OutboxEventRecord::eventId).containsExactly(eventId);
    assertThat(first.get(0).payloadJson()).contains("event_id");
    assertThat(second).isEmpty();
    assertThat(status(eventId)).isEqualTo("IN_FLIGHT");
  }

  @Test
  void expiredLeaseIsReclaimedByAnotherWorker() {
    final Instant now = Instant.now();
    final UUID eventId = UUID.randomUUID();
    outboxEventRepository.insert(eventId, "OrderPlaced", "order:1", PAYLOAD, now);
    outboxEventRepository.claimPending(10, now, now.plusSeconds(30), "worker-a");

    final List<OutboxEventRecord> reclaimed =
        outboxEventRepository.claimPending(10, now.plusSeconds(31), now.plusSeconds(61), "worker-b");

    assertThat(reclaimed).hasSize(1);
    // 元のワーカーはロックを失っているので結果を書き込めない
    assertThat(outboxEventRepository.markDispatched(eventId, "worker-a", now)).isZero();
    assertThat(outboxEventRepository.markDispatched(eventId, "worker-b", now)).isEqualTo(1);
  }

  @Test
  void retryIsNotClaimedBeforeNextRetryAt() {
    final Instant now = Instant.now();
    final UUID eventId = UUID.randomUUID();
    outboxEventRepository.insert(eventId, "OrderPlaced", "order:1", PAYLOAD, now);
    outboxEventRepository.claimPending(10, now, now.plusSeconds(30), "worker-a");
    outboxEventRepository.markFailure(
        eventId, "worker-a", 1, OutboxStatus.PENDING, now.plusSeconds(5), "boom");

    assertThat(outboxEventRepository.claimPending(10, now, now.plusSeconds(30), "worker-a"))
        .isEmpty();
    assertThat(
            outboxEventRepository.claimPending(
                10, now.plusSeconds(5), now.plusSeconds(35), "worker-a"))
        .singleElement()
        .satisfies(record -> assertThat(record.attemptCount()).isEqualTo(1));
  }

  @Test
  void retentionDeletesOnlyOldDispatchedRows() {
    final Instant now = Instant.now();
    final UUID dispatched = UUID.randomUUID();
    final UUID failed = UUID.randomUUID();
    outboxEventRepository.insert(dispatched, "OrderPlaced", "order:1", PAYLOAD, now);
    outboxEventRepository.insert(failed, "OrderPlaced", "order:2", PAYLOAD, now);
    outboxEventRepository.claimPending(10, now, now.plusSeconds(30), "worker-a");
    outboxEventRepository.markDispatched(dispatched, "worker-a", now.minus(Duration.ofDays(8)));
    outboxEventRepository.markFailure(failed, "worker-a", 10, OutboxStatus.FAILED, null, "boom");

    final int deleted = outboxEventRepository.deleteDispatchedOlderThan(now.minus(Duration.ofDays(7)));

    assertThat(deleted).isEqualTo(1);
    assertThat(outboxEventRepository.countByStatus(OutboxStatus.FAILED)).isEqualTo(1);
    assertThat(outboxEventRepository.countByStatus(OutboxStatus.DISPATCHED)).isZero();
  }

  private String status(UUID eventId) {
    return jdbcTemplate.queryForObject(
        "SELECT status FROM outbox_events WHERE event_id = :eventId",
        new MapSqlParameterSource().addValue("eventId", eventId),
        String.class);
  }
}
