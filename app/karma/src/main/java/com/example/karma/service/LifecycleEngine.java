/*
 * どこで: Karma サービス層
 * 何を: 注文/オファーの状態遷移と、それに伴う台帳操作・通知イベントを 1 トランザクションで行う
 * なぜ: 利用者操作と期限切れスイープが同じ遷移判定を共有するため
 */
package com.example.karma.service;

import com.example.karma.config.KarmaOrderProperties;
import com.example.karma.model.ConditionalUpdateResult;
import com.example.karma.model.InitiatedBy;
import com.example.karma.model.LedgerEntryType;
import com.example.karma.model.NewOffer;
import com.example.karma.model.NewOrder;
import com.example.karma.model.OfferPatch;
import com.example.karma.model.OfferRecord;
import com.example.karma.model.OfferStatus;
import com.example.karma.model.OrderEventType;
import com.example.karma.model.OrderPatch;
import com.example.karma.model.OrderRecord;
import com.example.karma.model.OrderStatus;
import com.example.karma.repository.OfferRepository;
import com.example.karma.repository.OrderRepository;
import com.example.karma.repository.PlayerRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class LifecycleEngine {

    private static final Logger logger = LoggerFactory.getLogger(LifecycleEngine.class);

    private final OrderRepository orderRepository;
    private final OfferRepository offerRepository;
    private final PlayerRepository playerRepository;
    private final PlayerService playerService;
    private final LedgerService ledgerService;
    private final OrderEventRecorder eventRecorder;
    private final BonusMultiplierRoller bonusRoller;
    private final KarmaOrderProperties properties;
    private final KarmaMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public LifecycleEngine(
            OrderRepository orderRepository,
            OfferRepository offerRepository,
            PlayerRepository playerRepository,
            PlayerService playerService,
            LedgerService ledgerService,
            OrderEventRecorder eventRecorder,
            BonusMultiplierRoller bonusRoller,
            KarmaOrderProperties properties,
            KarmaMetrics metrics,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.orderRepository = orderRepository;
        this.offerRepository = offerRepository;
        this.playerRepository = playerRepository;
        this.playerService = playerService;
        this.ledgerService = ledgerService;
        this.eventRecorder = eventRecorder;
        this.bonusRoller = bonusRoller;
        this.properties = properties;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * 依頼者起点の注文を作成し、コストを引き落とす。
     *
     * @param cost null の場合はカテゴリ別コスト
     * @param recipientId null/空の場合は依頼者本人
     */
    public TransitionResult<OrderRecord> place(
            String requesterId,
            String recipientId,
            String category,
            Integer cost,
            String dropLocation) {
        return execute("place", now -> {
            requireText(requesterId, "requester id");
            requireText(category, "category");
            final String normalizedCategory = normalizeCategory(category);
            final int karmaCost = cost == null ? properties.costFor(normalizedCategory) : cost;
            if (karmaCost <= 0) {
                throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "cost must be positive");
            }
            playerService.ensureExists(requesterId, now);
            requireAdvisoryBalance(requesterId, karmaCost);
            final OrderRecord order = orderRepository.create(
                    new NewOrder(
                            OrderStatus.ORDERED,
                            InitiatedBy.REQUESTER,
                            null,
                            requesterId,
                            isBlank(recipientId) ? requesterId : recipientId,
                            null,
                            normalizedCategory,
                            karmaCost,
                            dropLocation,
                            now.plus(properties.claimWindow()),
                            null,
                            null),
                    now);
            // 引き落としに失敗した場合は作成済みの注文もロールバックされる
            ledgerService.debit(
                    requesterId, karmaCost, order.orderId().toString(), LedgerEntryType.ORDER_DEBIT, now);
            eventRecorder.recordOrder(OrderEventType.ORDER_PLACED, order, now);
            logger.info("order placed orderId={} requesterId={} category={} cost={}",
                    order.orderId(), requesterId, normalizedCategory, karmaCost);
            return order;
        });
    }

    /** ランナー起点のオファーを掲示する。宣言能力もプレイヤー側へ反映する。 */
    public TransitionResult<OfferRecord> offer(String runnerId, List<String> capabilities, Duration window) {
        return execute("offer", now -> {
            requireText(runnerId, "runner id");
            final List<String> normalized = PlayerService.normalizeCapabilities(capabilities);
            if (normalized.isEmpty()) {
                throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "capabilities must not be empty");
            }
            final Duration offerWindow = window == null ? properties.maxOfferWindow() : window;
            if (offerWindow.isZero() || offerWindow.isNegative()
                    || offerWindow.compareTo(properties.maxOfferWindow()) > 0) {
                throw new LifecycleException(
                        KarmaErrorCode.VALIDATION_ERROR,
                        "offer window must be within " + properties.maxOfferWindow());
            }
            playerService.ensureExists(runnerId, now);
            playerRepository.updateCapabilities(runnerId, normalized, now);
            final OfferRecord offer = offerRepository.create(
                    new NewOffer(runnerId, normalized, now.plus(offerWindow)), now);
            eventRecorder.recordOffer(OrderEventType.OFFER_POSTED, offer, now);
            logger.info("offer posted offerId={} runnerId={} capabilities={}",
                    offer.offerId(), runnerId, normalized);
            return offer;
        });
    }

    public TransitionResult<OrderRecord> claim(UUID orderId, String runnerId) {
        return execute("claim", now -> {
            requireText(runnerId, "runner id");
            final OrderRecord order = loadOrder(orderId);
            requireOrderStatus(order, OrderStatus.ORDERED);
            if (runnerId.equals(order.requesterId()) && !properties.isOperator(runnerId)) {
                throw new LifecycleException(KarmaErrorCode.UNAUTHORIZED, "cannot claim own order");
            }
            playerService.ensureExists(runnerId, now);
            final OrderRecord claimed = requireUpdated(orderRepository.conditionalUpdate(
                    orderId,
                    OrderStatus.ORDERED,
                    new OrderPatch(
                            OrderStatus.CLAIMED,
                            runnerId,
                            now,
                            now.plus(properties.deliveryWindow()),
                            null,
                            null),
                    now));
            eventRecorder.recordOrder(OrderEventType.ORDER_CLAIMED, claimed, now);
            return claimed;
        });
    }

    /**
     * オファーを受注し、依頼者のコストを引き落として CLAIMED の注文を作る。
     *
     * <p>オファー自体は CLAIMED で終端となり、以降は作成された注文が遷移を引き継ぐ。
     * 受注済みオファーへの再要求は CONFLICT で返す。
     */
    public TransitionResult<OrderRecord> claimOffer(
            UUID offerId, String requesterId, String category, Integer cost, String recipientId) {
        return execute("claim_offer", now -> {
            requireText(requesterId, "requester id");
            requireText(category, "category");
            final String normalizedCategory = normalizeCategory(category);
            final OfferRecord offer = loadOffer(offerId);
            requireOfferStatus(offer, OfferStatus.OFFERED);
            if (!offer.capabilities().contains(normalizedCategory)) {
                throw new LifecycleException(
                        KarmaErrorCode.VALIDATION_ERROR, "offer does not cover category: " + normalizedCategory);
            }
            if (requesterId.equals(offer.runnerId()) && !properties.isOperator(requesterId)) {
                throw new LifecycleException(KarmaErrorCode.UNAUTHORIZED, "cannot claim own offer");
            }
            final int karmaCost = cost == null ? properties.costFor(normalizedCategory) : cost;
            if (karmaCost <= 0) {
                throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "cost must be positive");
            }
            playerService.ensureExists(requesterId, now);
            requireAdvisoryBalance(requesterId, karmaCost);
            final OfferRecord claimedOffer = requireUpdated(offerRepository.conditionalUpdate(
                    offerId, OfferStatus.OFFERED, new OfferPatch(OfferStatus.CLAIMED, now), now));
            final OrderRecord order = orderRepository.create(
                    new NewOrder(
                            OrderStatus.CLAIMED,
                            InitiatedBy.RUNNER,
                            offerId,
                            requesterId,
                            isBlank(recipientId) ? requesterId : recipientId,
                            offer.runnerId(),
                            normalizedCategory,
                            karmaCost,
                            null,
                            now,
                            now,
                            now.plus(properties.deliveryWindow())),
                    now);
            ledgerService.debit(
                    requesterId, karmaCost, order.orderId().toString(), LedgerEntryType.ORDER_DEBIT, now);
            eventRecorder.recordOffer(OrderEventType.OFFER_CLAIMED, claimedOffer, now);
            eventRecorder.recordOrder(OrderEventType.ORDER_CLAIMED, order, now);
            logger.info("offer claimed offerId={} orderId={} requesterId={} cost={}",
                    offerId, order.orderId(), requesterId, karmaCost);
            return order;
        });
    }

    public TransitionResult<OrderRecord> cancel(UUID orderId, String actorId) {
        return execute("cancel", now -> {
            final OrderRecord order = loadOrder(orderId);
            requireOrderStatus(order, OrderStatus.ORDERED);
            requireActor(actorId, order.requesterId(), "only the requester can cancel");
            final OrderRecord cancelled = requireUpdated(orderRepository.conditionalUpdate(
                    orderId, OrderStatus.ORDERED, OrderPatch.status(OrderStatus.CANCELLED), now));
            refund(cancelled, now);
            eventRecorder.recordOrder(OrderEventType.ORDER_CANCELLED, cancelled, now);
            return cancelled;
        });
    }

    public TransitionResult<OfferRecord> cancelOffer(UUID offerId, String actorId) {
        return execute("cancel_offer", now -> {
            final OfferRecord offer = loadOffer(offerId);
            requireOfferStatus(offer, OfferStatus.OFFERED);
            requireActor(actorId, offer.runnerId(), "only the runner can cancel the offer");
            final OfferRecord cancelled = requireUpdated(offerRepository.conditionalUpdate(
                    offerId, OfferStatus.OFFERED, OfferPatch.status(OfferStatus.CANCELLED), now));
            eventRecorder.recordOffer(OrderEventType.OFFER_CANCELLED, cancelled, now);
            return cancelled;
        });
    }

    /** 受注済みの注文をランナーが手放す。依頼者へ全額返金する。 */
    public TransitionResult<OrderRecord> cancelClaimed(UUID orderId, String actorId) {
        return execute("cancel_claimed", now -> {
            final OrderRecord order = loadOrder(orderId);
            requireOrderStatus(order, OrderStatus.CLAIMED);
            requireActor(actorId, order.runnerId(), "only the runner can release the order");
            final OrderRecord released = requireUpdated(orderRepository.conditionalUpdate(
                    orderId, OrderStatus.CLAIMED, OrderPatch.status(OrderStatus.CANCELLED_BY_RUNNER), now));
            refund(released, now);
            eventRecorder.recordOrder(OrderEventType.ORDER_RELEASED, released, now);
            return released;
        });
    }

    public TransitionResult<OrderRecord> deliver(UUID orderId, String actorId) {
        return execute("deliver", now -> {
            final OrderRecord order = loadOrder(orderId);
            requireOrderStatus(order, OrderStatus.CLAIMED);
            requireActor(actorId, order.runnerId(), "only the runner can deliver");
            final int multiplier = bonusRoller.roll();
            final OrderRecord delivered = requireUpdated(orderRepository.conditionalUpdate(
                    orderId,
                    OrderStatus.CLAIMED,
                    new OrderPatch(OrderStatus.DELIVERED, null, null, null, now, multiplier),
                    now));
            // 交差した配達(A が B の、B が A の注文)で行ロックが循環しないよう順序を揃える
            playerRepository.lockInIdOrder(List.of(delivered.runnerId(), delivered.requesterId()));
            final String referenceId = orderId.toString();
            final long reward = (long) delivered.karmaCost() * multiplier;
            ledgerService.reward(
                    delivered.runnerId(), reward, reward, referenceId, LedgerEntryType.DELIVERY_REWARD, now);
            ledgerService.addReputation(
                    delivered.requesterId(),
                    delivered.karmaCost(),
                    referenceId,
                    LedgerEntryType.DELIVERY_REPUTATION,
                    now);
            ledgerService.incrementOrdersRequested(delivered.requesterId(), now);
            ledgerService.incrementDeliveriesCompleted(delivered.runnerId(), now);
            eventRecorder.recordOrder(OrderEventType.ORDER_DELIVERED, delivered, now);
            if (multiplier > 1) {
                logger.info("delivery bonus rolled orderId={} multiplier={}", orderId, multiplier);
            }
            return delivered;
        });
    }

    public TransitionResult<OrderRecord> expireUnclaimed(UUID orderId) {
        return execute("expire_unclaimed", now -> {
            final OrderRecord order = loadOrder(orderId);
            requireOrderStatus(order, OrderStatus.ORDERED);
            requireDue(order.expiryAt(), now);
            final OrderRecord expired = requireUpdated(orderRepository.conditionalUpdate(
                    orderId, OrderStatus.ORDERED, OrderPatch.status(OrderStatus.EXPIRED), now));
            refund(expired, now);
            eventRecorder.recordOrder(OrderEventType.ORDER_EXPIRED, expired, now);
            return expired;
        });
    }

    /** 配達期限切れ。依頼者へ返金し、ランナーには報酬もペナルティも与えない。 */
    public TransitionResult<OrderRecord> expireClaimed(UUID orderId) {
        return execute("expire_claimed", now -> {
            final OrderRecord order = loadOrder(orderId);
            requireOrderStatus(order, OrderStatus.CLAIMED);
            requireDue(order.claimedExpiryAt(), now);
            final OrderRecord expired = requireUpdated(orderRepository.conditionalUpdate(
                    orderId, OrderStatus.CLAIMED, OrderPatch.status(OrderStatus.EXPIRED_CLAIMED), now));
            refund(expired, now);
            eventRecorder.recordOrder(OrderEventType.ORDER_CLAIM_EXPIRED, expired, now);
            return expired;
        });
    }

    public TransitionResult<OfferRecord> expireOffer(UUID offerId) {
        return execute("expire_offer", now -> {
            final OfferRecord offer = loadOffer(offerId);
            requireOfferStatus(offer, OfferStatus.OFFERED);
            requireDue(offer.expiryAt(), now);
            final OfferRecord expired = requireUpdated(offerRepository.conditionalUpdate(
                    offerId, OfferStatus.OFFERED, OfferPatch.status(OfferStatus.EXPIRED_OFFER), now));
            eventRecorder.recordOffer(OrderEventType.OFFER_EXPIRED, expired, now);
            return expired;
        });
    }

    private <T> TransitionResult<T> execute(String action, Function<Instant, T> work) {
        final Instant now = Instant.now(clock);
        try {
            final T value = transactionTemplate.execute(status -> work.apply(now));
            metrics.recordTransition(action, "success");
            return TransitionResult.success(value);
        } catch (LifecycleException ex) {
            // 業務エラーはロールバック済み。呼び出し側へは型付きの結果で返す
            metrics.recordTransition(action, ex.code().name());
            logger.info("transition rejected action={} code={} message={}", action, ex.code(), ex.getMessage());
            return TransitionResult.from(ex);
        }
    }

    private void refund(OrderRecord order, Instant now) {
        ledgerService.credit(
                order.requesterId(),
                order.karmaCost(),
                order.orderId().toString(),
                LedgerEntryType.ORDER_REFUND,
                now);
    }

    private OrderRecord loadOrder(UUID orderId) {
        if (orderId == null) {
            throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "order id is required");
        }
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new LifecycleException(KarmaErrorCode.NOT_FOUND, "order not found: " + orderId));
    }

    private OfferRecord loadOffer(UUID offerId) {
        if (offerId == null) {
            throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "offer id is required");
        }
        return offerRepository.findById(offerId)
                .orElseThrow(() -> new LifecycleException(KarmaErrorCode.NOT_FOUND, "offer not found: " + offerId));
    }

    private void requireOrderStatus(OrderRecord order, OrderStatus expected) {
        if (order.status() == expected) {
            return;
        }
        if (order.status().isTerminal()) {
            throw new LifecycleException(KarmaErrorCode.TERMINAL_STATE, "order is " + order.status());
        }
        throw new LifecycleException(
                KarmaErrorCode.CONFLICT, "order is " + order.status() + ", expected " + expected);
    }

    private void requireOfferStatus(OfferRecord offer, OfferStatus expected) {
        if (offer.status() == expected) {
            return;
        }
        if (offer.status().isWithdrawn()) {
            throw new LifecycleException(KarmaErrorCode.TERMINAL_STATE, "offer is " + offer.status());
        }
        throw new LifecycleException(
                KarmaErrorCode.CONFLICT, "offer is " + offer.status() + ", expected " + expected);
    }

    private void requireActor(String actorId, String expectedActorId, String message) {
        if (actorId == null || !actorId.equals(expectedActorId)) {
            throw new LifecycleException(KarmaErrorCode.UNAUTHORIZED, message);
        }
    }

    private void requireDue(Instant deadline, Instant now) {
        if (deadline == null || now.isBefore(deadline)) {
            throw new LifecycleException(KarmaErrorCode.CONFLICT, "deadline not reached: " + deadline);
        }
    }

    // 事前チェックは案内用。保証は debit の条件付き UPDATE が持つ
    private void requireAdvisoryBalance(String playerId, int cost) {
        playerRepository.findById(playerId)
                .filter(player -> player.karmaBalance() < cost)
                .ifPresent(player -> {
                    throw new LifecycleException(
                            KarmaErrorCode.INSUFFICIENT_FUNDS,
                            "insufficient karma: balance=" + player.karmaBalance() + " cost=" + cost);
                });
    }

    private <T> T requireUpdated(ConditionalUpdateResult<T> result) {
        return switch (result.outcome()) {
            case OK -> result.record();
            case NOT_FOUND -> throw new LifecycleException(KarmaErrorCode.NOT_FOUND, "record not found");
            case TERMINAL_STATE -> throw new LifecycleException(
                    KarmaErrorCode.TERMINAL_STATE, "record reached a terminal state concurrently");
            case CONFLICT -> throw new LifecycleException(
                    KarmaErrorCode.CONFLICT, "record was updated concurrently");
        };
    }

    private static String normalizeCategory(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    private static void requireText(String value, String label) {
        if (isBlank(value)) {
            throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, label + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
