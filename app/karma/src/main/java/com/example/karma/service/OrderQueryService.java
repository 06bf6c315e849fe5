/*
 * どこで: Karma サービス層
 * 何を: 注文/オファーの参照、履歴取得、外部メッセージ参照の付与を行う
 * なぜ: チャット側が投稿済みメッセージと注文を対応付けられるようにするため
 */
package com.example.karma.service;

import com.example.karma.model.OfferRecord;
import com.example.karma.model.OrderRecord;
import com.example.karma.repository.OfferRepository;
import com.example.karma.repository.OrderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OrderQueryService {

  static final int MAX_HISTORY_LIMIT = 100;

  private final OrderRepository orderRepository;
  private final OfferRepository offerRepository;
  private final Clock clock;

  public TransitionResult<OrderRecord> findOrder(UUID orderId) {
    return orderRepository
        .findById(orderId)
        .map(TransitionResult::success)
        .orElseGet(() -> notFound("order", orderId));
  }

  public TransitionResult<OfferRecord> findOffer(UUID offerId) {
    return offerRepository
        .findById(offerId)
        .map(TransitionResult::success)
        .orElseGet(() -> notFound("offer", offerId));
  }

  /** role は requester / runner のいずれか。新しい順に返す。 */
  public TransitionResult<List<OrderRecord>> history(String playerId, String role, int limit) {
    if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
      return TransitionResult.failure(
          KarmaErrorCode.VALIDATION_ERROR, "limit must be between 1 and " + MAX_HISTORY_LIMIT);
    }
    final String normalizedRole = role == null ? "requester" : role.toLowerCase(Locale.ROOT);
    return switch (normalizedRole) {
      case "requester" -> TransitionResult.success(orderRepository.findByRequester(playerId, limit));
      case "runner" -> TransitionResult.success(orderRepository.findByRunner(playerId, limit));
      default -> TransitionResult.failure(
          KarmaErrorCode.VALIDATION_ERROR, "role must be requester or runner");
    };
  }

  public TransitionResult<OrderRecord> attachOrderMessageRef(UUID orderId, String messageRef) {
    if (messageRef == null || messageRef.isBlank()) {
      return TransitionResult.failure(KarmaErrorCode.VALIDATION_ERROR, "message ref is required");
    }
    final Optional<OrderRecord> updated =
        orderRepository.updateExternalMessageRef(orderId, messageRef, Instant.now(clock));
    if (updated.isPresent()) {
      return TransitionResult.success(updated.get());
    }
    return orderRepository
        .findById(orderId)
        .<TransitionResult<OrderRecord>>map(
            order ->
                TransitionResult.failure(
                    KarmaErrorCode.TERMINAL_STATE, "order is " + order.status()))
        .orElseGet(() -> notFound("order", orderId));
  }

  public TransitionResult<OfferRecord> attachOfferMessageRef(UUID offerId, String messageRef) {
    if (messageRef == null || messageRef.isBlank()) {
      return TransitionResult.failure(KarmaErrorCode.VALIDATION_ERROR, "message ref is required");
    }
    final Optional<OfferRecord> updated =
        offerRepository.updateExternalMessageRef(offerId, messageRef, Instant.now(clock));
    if (updated.isPresent()) {
      return TransitionResult.success(updated.get());
    }
    return offerRepository
        .findById(offerId)
        .<TransitionResult<OfferRecord>>map(
            offer ->
                TransitionResult.failure(
                    KarmaErrorCode.TERMINAL_STATE, "offer is " + offer.status()))
        .orElseGet(() -> notFound("offer", offerId));
  }

  private static <T> TransitionResult<T> notFound(String kind, UUID id) {
    return TransitionResult.failure(KarmaErrorCode.NOT_FOUND, kind + " not found: " + id);
  }
}
