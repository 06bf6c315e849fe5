/*
 * どこで: Karma データアクセス
 * 何を: offers の作成/参照/条件付き状態更新/期限切れ抽出を行う
 * なぜ: オファーの遷移も注文と同じ compare-and-swap で一意に決めるため
 */
package com.example.karma.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.karma.model.ConditionalUpdateResult;
import com.example.karma.model.NewOffer;
import com.example.karma.model.OfferPatch;
import com.example.karma.model.OfferRecord;
import com.example.karma.model.OfferStatus;
import com.example.karma.model.UpdateOutcome;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OfferRepository {

  private static final String COLUMNS =
      """
      offer_id, status, runner_id, capabilities::text AS capabilities_text, created_at, expiry_at,
      claimed_at, external_message_ref, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final CapabilitiesJsonCodec capabilitiesCodec;

  public OfferRecord create(NewOffer offer, Instant now) {
    final String sql =
        """
        INSERT INTO offers (
          offer_id,
          status,
          runner_id,
          capabilities,
          created_at,
          expiry_at,
          updated_at
        ) VALUES (
          :offerId,
          'OFFERED',
          :runnerId,
          :capabilities::jsonb,
          :now,
          :expiryAt,
          :now
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("offerId", UUID.randomUUID())
            .addValue("runnerId", offer.runnerId())
            .addValue("capabilities", capabilitiesCodec.write(offer.capabilities()))
            .addValue("now", toTimestamp(now))
            .addValue("expiryAt", toTimestamp(offer.expiryAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<OfferRecord> findById(UUID offerId) {
    final String sql = "SELECT " + COLUMNS + " FROM offers WHERE offer_id = :offerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("offerId", offerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public ConditionalUpdateResult<OfferRecord> conditionalUpdate(
      UUID offerId, OfferStatus expected, OfferPatch patch, Instant now) {
    final String sql =
        """
        UPDATE offers
        SET status = :status,
            claimed_at = COALESCE(:claimedAt, claimed_at),
            updated_at = :now
        WHERE offer_id = :offerId
          AND status = :expected
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("offerId", offerId)
            .addValue("expected", expected.name())
            .addValue("status", patch.status().name())
            .addValue("claimedAt", toTimestamp(patch.claimedAt()), Types.TIMESTAMP)
            .addValue("now", toTimestamp(now));
    final Optional<OfferRecord> updated =
        jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    if (updated.isPresent()) {
      return ConditionalUpdateResult.ok(updated.get());
    }
    return ConditionalUpdateResult.of(classifyMiss(offerId));
  }

  public List<OfferRecord> findExpiring(Instant cutoff, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM offers
            WHERE status = 'OFFERED'
              AND expiry_at <= :cutoff
            ORDER BY expiry_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<OfferRecord> findByRunner(String runnerId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM offers
            WHERE runner_id = :runnerId
            ORDER BY created_at DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("runnerId", runnerId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<OfferRecord> updateExternalMessageRef(
      UUID offerId, String externalMessageRef, Instant now) {
    final String sql =
        """
        UPDATE offers
        SET external_message_ref = :externalMessageRef,
            updated_at = :now
        WHERE offer_id = :offerId
          AND status = 'OFFERED'
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("offerId", offerId)
            .addValue("externalMessageRef", externalMessageRef)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private UpdateOutcome classifyMiss(UUID offerId) {
    final String sql = "SELECT status FROM offers WHERE offer_id = :offerId";
    final List<String> statuses =
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("offerId", offerId), String.class);
    if (statuses.isEmpty()) {
      return UpdateOutcome.NOT_FOUND;
    }
    return OfferStatus.valueOf(statuses.get(0)).isWithdrawn()
        ? UpdateOutcome.TERMINAL_STATE
        : UpdateOutcome.CONFLICT;
  }

  private OfferRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OfferRecord(
        UUID.fromString(rs.getString("offer_id")),
        OfferStatus.valueOf(rs.getString("status")),
        rs.getString("runner_id"),
        capabilitiesCodec.read(rs.getString("capabilities_text")),
        getInstant(rs, "created_at"),
        getInstant(rs, "expiry_at"),
        getInstant(rs, "claimed_at"),
        rs.getString("external_message_ref"),
        getInstant(rs, "updated_at"));
  }
}
