/*
 * どこで: Karma データアクセス
 * 何を: 通知用 outbox_events の登録/claim/配信結果の反映を担う
 * なぜ: 状態遷移のコミット後にだけ通知を送り出すため
 */
package com.example.karma.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.karma.model.OutboxEventRecord;
import com.example.karma.model.OutboxStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class OutboxEventRepository {

  // 配信結果を書き戻すときは必ずリースを手放す
  private static final String RELEASE_LEASE =
      "locked_by = NULL, locked_at = NULL, lease_until = NULL";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OutboxEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  /** 遷移と同じトランザクションで呼ばれる。 */
  public int insert(
      UUID eventId, String eventType, String aggregateKey, String payloadJson, Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (event_id, event_type, aggregate_key, payload, status, created_at)
        VALUES (:eventId, :eventType, :aggregateKey, CAST(:payload AS jsonb), 'PENDING', :createdAt)
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("aggregateKey", aggregateKey)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt)));
  }

  /**
   * 配信可能な行を古い順に最大 limit 件 IN_FLIGHT へ移して返す。
   *
   * <p>再送時刻に達した PENDING と、リースが切れた IN_FLIGHT が対象。他ワーカーがロック中の行は飛ばす。
   */
  public List<OutboxEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil,
            last_error = NULL
        WHERE event_id IN (
          SELECT event_id
          FROM outbox_events
          WHERE status IN ('PENDING', 'IN_FLIGHT')
            AND COALESCE(
                  CASE WHEN status = 'PENDING' THEN next_retry_at ELSE lease_until END,
                  :now) <= :now
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        RETURNING event_id, event_type, aggregate_key, payload::text AS payload_text,
                  attempt_count, created_at
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource()
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("limit", limit),
        this::mapRow);
  }

  /** @return 0 の場合はリースを失っている */
  public int markDispatched(UUID eventId, String lockedBy, Instant dispatchedAt) {
    return releaseLease(
        eventId,
        lockedBy,
        "status = 'DISPATCHED', dispatched_at = :dispatchedAt",
        new MapSqlParameterSource().addValue("dispatchedAt", toTimestamp(dispatchedAt)));
  }

  /** status は PENDING(再送待ち) か FAILED(打ち切り)。 */
  public int markFailure(
      UUID eventId,
      String lockedBy,
      int attemptCount,
      OutboxStatus status,
      Instant nextRetryAt,
      String lastError) {
    return releaseLease(
        eventId,
        lockedBy,
        """
        status = :status,
        attempt_count = :attemptCount,
        next_retry_at = :nextRetryAt,
        last_error = :lastError""",
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt), Types.TIMESTAMP)
            .addValue("lastError", lastError, Types.VARCHAR));
  }

  /** 配信済みだけを消す。PENDING/FAILED は調査用に残す。 */
  public int deleteDispatchedOlderThan(Instant threshold) {
    return jdbcTemplate.update(
        "DELETE FROM outbox_events WHERE status = 'DISPATCHED' AND dispatched_at <= :threshold",
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  public int countByStatus(OutboxStatus status) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.name()),
            Integer.class);
    return count == null ? 0 : count;
  }

  /** 集約キーに紐づくイベント種別を作成順に返す。 */
  public List<String> findEventTypesByAggregateKey(String aggregateKey) {
    final String sql =
        """
        SELECT event_type
        FROM outbox_events
        WHERE aggregate_key = :aggregateKey
        ORDER BY created_at, event_type
        """;
    return jdbcTemplate.queryForList(
        sql, new MapSqlParameterSource().addValue("aggregateKey", aggregateKey), String.class);
  }

  private int releaseLease(
      UUID eventId, String lockedBy, String assignments, MapSqlParameterSource params) {
    final String sql =
        "UPDATE outbox_events SET "
            + assignments
            + ", "
            + RELEASE_LEASE
            + " WHERE event_id = :eventId AND locked_by = :lockedBy";
    return jdbcTemplate.update(
        sql, params.addValue("eventId", eventId).addValue("lockedBy", lockedBy));
  }

  private OutboxEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OutboxEventRecord(
        rs.getObject("event_id", UUID.class),
        rs.getString("event_type"),
        rs.getString("aggregate_key"),
        rs.getString("payload_text"),
        rs.getInt("attempt_count"),
        getInstant(rs, "created_at"));
  }
}
