/*
 * どこで: Karma データアクセス
 * 何を: players の作成/残高の原子的増減/能力宣言/ランキング参照を行う
 * なぜ: 残高の読み取り→書き込みをアプリ側で行わず、DB の単一文で完結させるため
 */
package com.example.karma.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.karma.model.PlayerRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PlayerRepository {

  private static final String COLUMNS =
      """
      player_id, karma_balance, reputation_score, title, capabilities::text AS capabilities_text,
      orders_requested_count, deliveries_completed_count, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final CapabilitiesJsonCodec capabilitiesCodec;

  /** 既存プレイヤーは変更しない。作成した場合のみ 1 を返す。 */
  public int insertIfAbsent(String playerId, long initialKarma, String title, Instant now) {
    final String sql =
        """
        INSERT INTO players (
          player_id,
          karma_balance,
          reputation_score,
          title,
          capabilities,
          orders_requested_count,
          deliveries_completed_count,
          created_at,
          updated_at
        ) VALUES (
          :playerId,
          :initialKarma,
          0,
          :title,
          '[]'::jsonb,
          0,
          0,
          :now,
          :now
        )
        ON CONFLICT (player_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("playerId", playerId)
            .addValue("initialKarma", initialKarma)
            .addValue("title", title)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<PlayerRecord> findById(String playerId) {
    final String sql = "SELECT " + COLUMNS + " FROM players WHERE player_id = :playerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("playerId", playerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 指定プレイヤーの行を player_id 順にロックする。
   *
   * <p>複数プレイヤーを更新する遷移は先にこれを呼び、ロック取得順を揃えてデッドロックを防ぐ。
   *
   * @return ロックした行のプレイヤー ID(player_id 順)
   */
  public List<String> lockInIdOrder(Collection<String> playerIds) {
    if (playerIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT player_id
        FROM players
        WHERE player_id IN (:playerIds)
        ORDER BY player_id
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("playerIds", playerIds);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public boolean exists(String playerId) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM players WHERE player_id = :playerId)";
    final Boolean exists =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("playerId", playerId), Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  /**
   * karma を delta だけ増減する。結果が負になる場合は更新せず空を返す。
   *
   * @return 更新後の残高。プレイヤー不在または残高不足なら空
   */
  public Optional<Long> adjustKarma(String playerId, long delta, Instant now) {
    // 残高チェックと更新を同一文にまとめ、同時引き落としでも負残高にならないようにする
    final String sql =
        """
        UPDATE players
        SET karma_balance = karma_balance + :delta,
            updated_at = :now
        WHERE player_id = :playerId
          AND karma_balance + :delta >= 0
        RETURNING karma_balance
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("playerId", playerId)
            .addValue("delta", delta)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  /** reputation を加算し、更新後の値を返す。負の delta は呼び出し側で弾く前提。 */
  public Optional<Long> addReputation(String playerId, long delta, Instant now) {
    final String sql =
        """
        UPDATE players
        SET reputation_score = reputation_score + :delta,
            updated_at = :now
        WHERE player_id = :playerId
        RETURNING reputation_score
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("playerId", playerId)
            .addValue("delta", delta)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.queryForList(sql, params, Long.class).stream().findFirst();
  }

  public int updateTitle(String playerId, String title, Instant now) {
    final String sql =
        """
        UPDATE players
        SET title = :title,
            updated_at = :now
        WHERE player_id = :playerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("playerId", playerId)
            .addValue("title", title)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int incrementOrdersRequested(String playerId, Instant now) {
    return incrementCounter("orders_requested_count", playerId, now);
  }

  public int incrementDeliveriesCompleted(String playerId, Instant now) {
    return incrementCounter("deliveries_completed_count", playerId, now);
  }

  public Optional<PlayerRecord> updateCapabilities(
      String playerId, List<String> capabilities, Instant now) {
    final String sql =
        """
        UPDATE players
        SET capabilities = :capabilities::jsonb,
            updated_at = :now
        WHERE player_id = :playerId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("playerId", playerId)
            .addValue("capabilities", capabilitiesCodec.write(capabilities))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<PlayerRecord> findTopByReputation(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM players
            ORDER BY reputation_score DESC, karma_balance DESC, player_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private int incrementCounter(String column, String playerId, Instant now) {
    // column は内部定数のみ渡される
    final String sql =
        "UPDATE players SET "
            + column
            + " = "
            + column
            + " + 1, updated_at = :now WHERE player_id = :playerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("playerId", playerId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private PlayerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PlayerRecord(
        rs.getString("player_id"),
        rs.getLong("karma_balance"),
        rs.getLong("reputation_score"),
        rs.getString("title"),
        capabilitiesCodec.read(rs.getString("capabilities_text")),
        rs.getInt("orders_requested_count"),
        rs.getInt("deliveries_completed_count"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
