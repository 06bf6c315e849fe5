/*
 * どこで: Karma サービス層
 * 何を: 状態遷移イベントを outbox_events へ書き込む
 * なぜ: 通知を遷移と同一トランザクションで確定させ、配信はコミット後に任せるため
 */
package com.example.karma.service;

import com.example.common.TraceIds;
import com.example.common.event.OrderEventPayload;
import com.example.karma.model.OfferRecord;
import com.example.karma.model.OrderEventType;
import com.example.karma.model.OrderRecord;
import com.example.karma.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OrderEventRecorder {

  static final String KIND_ORDER = "order";
  static final String KIND_OFFER = "offer";

  private final OutboxEventRepository outboxEventRepository;
  private final ObjectMapper objectMapper;

  public void recordOrder(OrderEventType eventType, OrderRecord order, Instant occurredAt) {
    final UUID eventId = UUID.randomUUID();
    final OrderEventPayload payload =
        new OrderEventPayload(
            eventId.toString(),
            eventType.value(),
            occurredAt.toString(),
            KIND_ORDER,
            order.orderId().toString(),
            order.status().name(),
            order.requesterId(),
            order.recipientId(),
            order.runnerId(),
            order.category(),
            null,
            order.karmaCost(),
            order.bonusMultiplier(),
            order.externalMessageRef(),
            TraceIds.currentOrNew());
    insert(eventId, eventType, aggregateKey(KIND_ORDER, order.orderId()), payload, occurredAt);
  }

  public void recordOffer(OrderEventType eventType, OfferRecord offer, Instant occurredAt) {
    final UUID eventId = UUID.randomUUID();
    final OrderEventPayload payload =
        new OrderEventPayload(
            eventId.toString(),
            eventType.value(),
            occurredAt.toString(),
            KIND_OFFER,
            offer.offerId().toString(),
            offer.status().name(),
            null,
            null,
            offer.runnerId(),
            null,
            offer.capabilities(),
            null,
            null,
            offer.externalMessageRef(),
            TraceIds.currentOrNew());
    insert(eventId, eventType, aggregateKey(KIND_OFFER, offer.offerId()), payload, occurredAt);
  }

  public static String aggregateKey(String kind, UUID id) {
    return kind + ":" + id;
  }

  private void insert(
      UUID eventId,
      OrderEventType eventType,
      String aggregateKey,
      OrderEventPayload payload,
      Instant occurredAt) {
    try {
      outboxEventRepository.insert(
          eventId,
          eventType.value(),
          aggregateKey,
          objectMapper.writeValueAsString(payload),
          occurredAt);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize outbox payload", ex);
    }
  }
}
