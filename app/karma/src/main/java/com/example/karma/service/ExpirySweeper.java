/*
 * どこで: Karma サービス層
 * 何を: 期限を過ぎた注文/受注/オファーを抽出し、期限切れ遷移を適用する
 * なぜ: 誰も操作しない注文でも karma が必ず返金されるようにするため
 */
package com.example.karma.service;

import com.example.karma.config.KarmaSweepProperties;
import com.example.karma.model.ExpiryField;
import com.example.karma.model.OfferRecord;
import com.example.karma.model.OrderRecord;
import com.example.karma.model.OrderStatus;
import com.example.karma.repository.OfferRepository;
import com.example.karma.repository.OrderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpirySweeper {

  private static final Logger logger = LoggerFactory.getLogger(ExpirySweeper.class);
  static final String KIND_ORDER = "order";
  static final String KIND_CLAIM = "claim";
  static final String KIND_OFFER = "offer";

  private final OrderRepository orderRepository;
  private final OfferRepository offerRepository;
  private final LifecycleEngine lifecycleEngine;
  private final KarmaSweepProperties properties;
  private final KarmaMetrics metrics;
  private final Clock clock;

  /**
   * 期限切れ候補を状態ごとに 1 バッチずつ処理する。
   *
   * <p>1 件の失敗は記録して次へ進む。並行 tick で先に処理された候補は skipped に数える。
   */
  public SweepReport tick() {
    final Instant now = Instant.now(clock);
    final Tally orders = new Tally();
    final Tally claims = new Tally();
    final Tally offers = new Tally();

    final List<OrderRecord> unclaimed =
        findSafely(
            KIND_ORDER,
            () ->
                orderRepository.findExpiring(
                    OrderStatus.ORDERED, ExpiryField.EXPIRY_AT, now, properties.batchSize()));
    for (OrderRecord order : unclaimed) {
      apply(KIND_ORDER, order.orderId(), lifecycleEngine::expireUnclaimed, orders);
    }

    final List<OrderRecord> claimed =
        findSafely(
            KIND_CLAIM,
            () ->
                orderRepository.findExpiring(
                    OrderStatus.CLAIMED,
                    ExpiryField.CLAIMED_EXPIRY_AT,
                    now,
                    properties.batchSize()));
    for (OrderRecord order : claimed) {
      apply(KIND_CLAIM, order.orderId(), lifecycleEngine::expireClaimed, claims);
    }

    final List<OfferRecord> offered =
        findSafely(KIND_OFFER, () -> offerRepository.findExpiring(now, properties.batchSize()));
    for (OfferRecord offer : offered) {
      apply(KIND_OFFER, offer.offerId(), lifecycleEngine::expireOffer, offers);
    }

    metrics.recordSweepExpired(KIND_ORDER, orders.expired);
    metrics.recordSweepExpired(KIND_CLAIM, claims.expired);
    metrics.recordSweepExpired(KIND_OFFER, offers.expired);
    final SweepReport report =
        new SweepReport(
            orders.expired,
            claims.expired,
            offers.expired,
            orders.skipped + claims.skipped + offers.skipped,
            orders.failed + claims.failed + offers.failed);
    if (report.totalExpired() > 0 || report.failed() > 0) {
      logger.info(
          "expiry sweep finished expiredOrders={} expiredClaims={} expiredOffers={} skipped={} failed={}",
          report.expiredOrders(),
          report.expiredClaims(),
          report.expiredOffers(),
          report.skipped(),
          report.failed());
    }
    return report;
  }

  private <T> void apply(
      String kind, UUID id, Function<UUID, TransitionResult<T>> transition, Tally tally) {
    try {
      final TransitionResult<T> result = transition.apply(id);
      if (result.isSuccess()) {
        tally.expired++;
        return;
      }
      switch (result.error()) {
        // 並行 tick や利用者操作が先に遷移させた場合
        case CONFLICT, TERMINAL_STATE -> {
          tally.skipped++;
          logger.debug("expiry skipped kind={} id={} code={}", kind, id, result.error());
        }
        default -> {
          tally.failed++;
          metrics.recordSweepFailure(kind);
          logger.warn(
              "expiry rejected kind={} id={} code={} message={}",
              kind,
              id,
              result.error(),
              result.message());
        }
      }
    } catch (RuntimeException ex) {
      tally.failed++;
      metrics.recordSweepFailure(kind);
      logger.warn("expiry failed kind={} id={}", kind, id, ex);
    }
  }

  private <T> List<T> findSafely(String kind, Supplier<List<T>> query) {
    try {
      return query.get();
    } catch (RuntimeException ex) {
      metrics.recordSweepFailure(kind);
      logger.warn("expiry candidate query failed kind={}", kind, ex);
      return List.of();
    }
  }

  private static final class Tally {
    private int expired;
    private int skipped;
    private int failed;
  }
}
