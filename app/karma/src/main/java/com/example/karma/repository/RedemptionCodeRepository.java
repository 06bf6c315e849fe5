/*
 * どこで: Karma データアクセス
 * 何を: redemption_codes / redemption_claims の登録と原子的な消費を行う
 * なぜ: 上限回数・ユーザー別上限を同時実行下でも超えないようにするため
 */
package com.example.karma.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.karma.model.RedemptionCodeRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RedemptionCodeRepository {

  private static final String COLUMNS =
      """
      code, karma_value, max_redemptions, per_user_limit, redemption_count, active_from,
      expires_at, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(
      String code,
      int karmaValue,
      int maxRedemptions,
      int perUserLimit,
      Instant activeFrom,
      Instant expiresAt,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO redemption_codes (
          code,
          karma_value,
          max_redemptions,
          per_user_limit,
          redemption_count,
          active_from,
          expires_at,
          created_at
        ) VALUES (
          :code,
          :karmaValue,
          :maxRedemptions,
          :perUserLimit,
          0,
          :activeFrom,
          :expiresAt,
          :createdAt
        )
        ON CONFLICT (code) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("code", code)
            .addValue("karmaValue", karmaValue)
            .addValue("maxRedemptions", maxRedemptions)
            .addValue("perUserLimit", perUserLimit)
            .addValue("activeFrom", toTimestamp(activeFrom), Types.TIMESTAMP)
            .addValue("expiresAt", toTimestamp(expiresAt), Types.TIMESTAMP)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<RedemptionCodeRecord> findByCode(String code) {
    final String sql = "SELECT " + COLUMNS + " FROM redemption_codes WHERE code = :code";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("code", code);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 有効期間内かつ上限未満の場合だけ消費回数を 1 増やす。 */
  public Optional<RedemptionCodeRecord> incrementIfAvailable(String code, Instant now) {
    final String sql =
        """
        UPDATE redemption_codes
        SET redemption_count = redemption_count + 1
        WHERE code = :code
          AND redemption_count < max_redemptions
          AND (active_from IS NULL OR active_from <= :now)
          AND (expires_at IS NULL OR expires_at > :now)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("code", code).addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countClaims(String code, String playerId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM redemption_claims
        WHERE code = :code
          AND player_id = :playerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("code", code).addValue("playerId", playerId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * 消費記録を追加する。
   *
   * @return 同じ claimSeq が並行して登録済みなら 0
   */
  public int insertClaim(String code, String playerId, int claimSeq, Instant redeemedAt) {
    final String sql =
        """
        INSERT INTO redemption_claims (code, player_id, claim_seq, redeemed_at)
        VALUES (:code, :playerId, :claimSeq, :redeemedAt)
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("code", code)
            .addValue("playerId", playerId)
            .addValue("claimSeq", claimSeq)
            .addValue("redeemedAt", toTimestamp(redeemedAt));
    return jdbcTemplate.update(sql, params);
  }

  private RedemptionCodeRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RedemptionCodeRecord(
        rs.getString("code"),
        rs.getInt("karma_value"),
        rs.getInt("max_redemptions"),
        rs.getInt("per_user_limit"),
        rs.getInt("redemption_count"),
        getInstant(rs, "active_from"),
        getInstant(rs, "expires_at"),
        getInstant(rs, "created_at"));
  }
}
