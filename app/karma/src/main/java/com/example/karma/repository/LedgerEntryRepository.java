/*
 * どこで: Karma データアクセス
 * 何を: ledger_entries(残高変動の仕訳)の登録と参照を行う
 * なぜ: 同一注文への二重引落し/二重返金を一意制約で検出するため
 */
package com.example.karma.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.karma.model.LedgerEntryRecord;
import com.example.karma.model.LedgerEntryType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class LedgerEntryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 仕訳を 1 行追加する。
   *
   * @return 追加できた場合 1、同一キーが既に存在する場合 0
   */
  public int insert(
      String playerId,
      String referenceId,
      LedgerEntryType entryType,
      long karmaDelta,
      long reputationDelta,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO ledger_entries (
          entry_id,
          player_id,
          reference_id,
          entry_type,
          karma_delta,
          reputation_delta,
          created_at
        ) VALUES (
          :entryId,
          :playerId,
          :referenceId,
          :entryType,
          :karmaDelta,
          :reputationDelta,
          :createdAt
        )
        ON CONFLICT ON CONSTRAINT uq_ledger_entries_reference DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entryId", UUID.randomUUID())
            .addValue("playerId", playerId)
            .addValue("referenceId", referenceId)
            .addValue("entryType", entryType.name())
            .addValue("karmaDelta", karmaDelta)
            .addValue("reputationDelta", reputationDelta)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public List<LedgerEntryRecord> findByReference(String referenceId) {
    final String sql =
        """
        SELECT entry_id, player_id, reference_id, entry_type, karma_delta, reputation_delta,
               created_at
        FROM ledger_entries
        WHERE reference_id = :referenceId
        ORDER BY created_at, entry_type
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("referenceId", referenceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long sumKarmaDelta(String playerId) {
    final String sql =
        "SELECT COALESCE(SUM(karma_delta), 0) FROM ledger_entries WHERE player_id = :playerId";
    final Long sum =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("playerId", playerId), Long.class);
    return sum == null ? 0L : sum;
  }

  private LedgerEntryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LedgerEntryRecord(
        UUID.fromString(rs.getString("entry_id")),
        rs.getString("player_id"),
        rs.getString("reference_id"),
        LedgerEntryType.valueOf(rs.getString("entry_type")),
        rs.getLong("karma_delta"),
        rs.getLong("reputation_delta"),
        getInstant(rs, "created_at"));
  }
}
