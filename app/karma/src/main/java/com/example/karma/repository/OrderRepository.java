/*
 * どこで: Karma データアクセス
 * 何を: orders の作成/参照/条件付き状態更新/期限切れ抽出を行う
 * なぜ: 状態遷移の書き込みを compare-and-swap の 1 経路に限定するため
 */
package com.example.karma.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.karma.model.ConditionalUpdateResult;
import com.example.karma.model.ExpiryField;
import com.example.karma.model.InitiatedBy;
import com.example.karma.model.NewOrder;
import com.example.karma.model.OrderPatch;
import com.example.karma.model.OrderRecord;
import com.example.karma.model.OrderStatus;
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
public class OrderRepository {

  private static final String COLUMNS =
      """
      order_id, status, initiated_by, offer_id, requester_id, recipient_id, runner_id, category,
      karma_cost, drop_location, created_at, expiry_at, claimed_at, claimed_expiry_at,
      delivered_at, bonus_multiplier, external_message_ref, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OrderRecord create(NewOrder order, Instant now) {
    final String sql =
        """
        INSERT INTO orders (
          order_id,
          status,
          initiated_by,
          offer_id,
          requester_id,
          recipient_id,
          runner_id,
          category,
          karma_cost,
          drop_location,
          created_at,
          expiry_at,
          claimed_at,
          claimed_expiry_at,
          bonus_multiplier,
          updated_at
        ) VALUES (
          :orderId,
          :status,
          :initiatedBy,
          :offerId,
          :requesterId,
          :recipientId,
          :runnerId,
          :category,
          :karmaCost,
          :dropLocation,
          :now,
          :expiryAt,
          :claimedAt,
          :claimedExpiryAt,
          1,
          :now
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orderId", UUID.randomUUID())
            .addValue("status", order.status().name())
            .addValue("initiatedBy", order.initiatedBy().name())
            .addValue("offerId", order.offerId(), Types.OTHER)
            .addValue("requesterId", order.requesterId())
            .addValue("recipientId", order.recipientId())
            .addValue("runnerId", order.runnerId(), Types.VARCHAR)
            .addValue("category", order.category())
            .addValue("karmaCost", order.karmaCost())
            .addValue("dropLocation", order.dropLocation(), Types.VARCHAR)
            .addValue("now", toTimestamp(now))
            .addValue("expiryAt", toTimestamp(order.expiryAt()))
            .addValue("claimedAt", toTimestamp(order.claimedAt()), Types.TIMESTAMP)
            .addValue(
                "claimedExpiryAt", toTimestamp(order.claimedExpiryAt()), Types.TIMESTAMP);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<OrderRecord> findById(UUID orderId) {
    final String sql = "SELECT " + COLUMNS + " FROM orders WHERE order_id = :orderId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("orderId", orderId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * status が expected の場合に限り patch を適用する。
   *
   * <p>0 行更新時は現在の status を読み直し、NOT_FOUND / TERMINAL_STATE / CONFLICT を判別する。
   */
  public ConditionalUpdateResult<OrderRecord> conditionalUpdate(
      UUID orderId, OrderStatus expected, OrderPatch patch, Instant now) {
    final String sql =
        """
        UPDATE orders
        SET status = :status,
            runner_id = COALESCE(:runnerId, runner_id),
            claimed_at = COALESCE(:claimedAt, claimed_at),
            claimed_expiry_at = COALESCE(:claimedExpiryAt, claimed_expiry_at),
            delivered_at = COALESCE(:deliveredAt, delivered_at),
            bonus_multiplier = COALESCE(:bonusMultiplier, bonus_multiplier),
            updated_at = :now
        WHERE order_id = :orderId
          AND status = :expected
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orderId", orderId)
            .addValue("expected", expected.name())
            .addValue("status", patch.status().name())
            .addValue("runnerId", patch.runnerId(), Types.VARCHAR)
            .addValue("claimedAt", toTimestamp(patch.claimedAt()), Types.TIMESTAMP)
            .addValue(
                "claimedExpiryAt", toTimestamp(patch.claimedExpiryAt()), Types.TIMESTAMP)
            .addValue("deliveredAt", toTimestamp(patch.deliveredAt()), Types.TIMESTAMP)
            .addValue("bonusMultiplier", patch.bonusMultiplier(), Types.INTEGER)
            .addValue("now", toTimestamp(now));
    final Optional<OrderRecord> updated =
        jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    if (updated.isPresent()) {
      return ConditionalUpdateResult.ok(updated.get());
    }
    return ConditionalUpdateResult.of(classifyMiss(orderId));
  }

  /** 期限列が cutoff 以前の status 該当注文を古い順に返す。 */
  public List<OrderRecord> findExpiring(
      OrderStatus status, ExpiryField field, Instant cutoff, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM orders WHERE status = :status AND "
            + field.column()
            + " <= :cutoff ORDER BY "
            + field.column()
            + " LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<OrderRecord> findByRequester(String requesterId, int limit) {
    return findByParticipant("requester_id", requesterId, limit);
  }

  public List<OrderRecord> findByRunner(String runnerId, int limit) {
    return findByParticipant("runner_id", runnerId, limit);
  }

  /** 終端状態の注文は参照だけを残すため、更新しない。 */
  public Optional<OrderRecord> updateExternalMessageRef(
      UUID orderId, String externalMessageRef, Instant now) {
    final String sql =
        """
        UPDATE orders
        SET external_message_ref = :externalMessageRef,
            updated_at = :now
        WHERE order_id = :orderId
          AND status IN ('ORDERED', 'CLAIMED')
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orderId", orderId)
            .addValue("externalMessageRef", externalMessageRef)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private List<OrderRecord> findByParticipant(String column, String playerId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM orders WHERE "
            + column
            + " = :playerId ORDER BY created_at DESC LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("playerId", playerId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private UpdateOutcome classifyMiss(UUID orderId) {
    final String sql = "SELECT status FROM orders WHERE order_id = :orderId";
    final List<String> statuses =
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("orderId", orderId), String.class);
    if (statuses.isEmpty()) {
      return UpdateOutcome.NOT_FOUND;
    }
    return OrderStatus.valueOf(statuses.get(0)).isTerminal()
        ? UpdateOutcome.TERMINAL_STATE
        : UpdateOutcome.CONFLICT;
  }

  private OrderRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String offerId = rs.getString("offer_id");
    return new OrderRecord(
        UUID.fromString(rs.getString("order_id")),
        OrderStatus.valueOf(rs.getString("status")),
        InitiatedBy.valueOf(rs.getString("initiated_by")),
        offerId == null ? null : UUID.fromString(offerId),
        rs.getString("requester_id"),
        rs.getString("recipient_id"),
        rs.getString("runner_id"),
        rs.getString("category"),
        rs.getInt("karma_cost"),
        rs.getString("drop_location"),
        getInstant(rs, "created_at"),
        getInstant(rs, "expiry_at"),
        getInstant(rs, "claimed_at"),
        getInstant(rs, "claimed_expiry_at"),
        getInstant(rs, "delivered_at"),
        rs.getInt("bonus_multiplier"),
        rs.getString("external_message_ref"),
        getInstant(rs, "updated_at"));
  }
}
