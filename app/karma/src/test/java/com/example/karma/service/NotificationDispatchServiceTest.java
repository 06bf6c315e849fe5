/*
 * どこで: 通知 outbox 配信のユニットテスト
 * 何を: 配信成功/失敗時のリトライ/パース失敗時の即時 FAILED を検証する
 * なぜ: 通知失敗が確定済みの遷移に影響せず、非同期にだけ再送されることを保証するため
 */
package com.example.karma.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.common.event.OrderEventPayload;
import com.example.karma.config.KarmaOutboxProperties;
import com.example.karma.model.OutboxEventRecord;
import com.example.karma.model.OutboxStatus;
import com.example.karma.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDispatchServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final KarmaOutboxProperties PROPERTIES =
      new KarmaOutboxProperties(
          true,
          Duration.ofSeconds(1),
          50,
          3,
          Duration.ofSeconds(1),
          Duration.ofSeconds(60),
          2.0d,
          0.5d,
          1.5d,
          Duration.ofMillis(500),
          16,
          Duration.ofSeconds(30),
          Duration.ofDays(7));

  @Mock private OutboxEventRepository outboxEventRepository;
  @Mock private NotificationDispatcher dispatcher;
  @Mock private KarmaMetrics metrics;

  private ObjectMapper objectMapper;
  private NotificationDispatchService service;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    service =
        new NotificationDispatchService(
            outboxEventRepository,
            dispatcher,
            PROPERTIES,
            objectMapper,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void dispatchedEventIsMarkedDispatched() throws JsonProcessingException {
    final OutboxEventRecord record = record(0);
    when(outboxEventRepository.claimPending(
            eq(PROPERTIES.batchSize()), eq(FIXED_NOW), eq(FIXED_NOW.plus(PROPERTIES.lease())), anyString()))
        .thenReturn(List.of(record));
    when(outboxEventRepository.markDispatched(eq(record.eventId()), anyString(), eq(FIXED_NOW)))
        .thenReturn(1);

    final int dispatched = service.dispatchPendingBatch();

    assertThat(dispatched).isEqualTo(1);
    final ArgumentCaptor<OrderEventPayload> payloadCaptor =
        ArgumentCaptor.forClass(OrderEventPayload.class);
    verify(dispatcher).dispatch(eq("OrderPlaced"), eq("order:1"), payloadCaptor.capture());
    assertThat(payloadCaptor.getValue().status()).isEqualTo("ORDERED");
    verify(metrics).recordDispatch("success");
    verify(metrics).recordDispatchDelay(FIXED_NOW.minusSeconds(2), FIXED_NOW);
    verify(metrics).updateOutboxFailedCurrent(0);
  }

  @Test
  void dispatchFailureSchedulesRetryWithBackoff() throws JsonProcessingException {
    final OutboxEventRecord record = record(0);
    when(outboxEventRepository.claimPending(anyInt(), any(Instant.class), any(Instant.class), anyString()))
        .thenReturn(List.of(record));
    doThrow(new ExternalDispatchFailureException("nats unavailable for a long while", null))
        .when(dispatcher)
        .dispatch(anyString(), anyString(), any(OrderEventPayload.class));
    when(outboxEventRepository.markFailure(
            eq(record.eventId()),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            any(Instant.class),
            anyString()))
        .thenReturn(1);

    assertThat(service.dispatchPendingBatch()).isZero();

    final ArgumentCaptor<Instant> nextRetryCaptor = ArgumentCaptor.forClass(Instant.class);
    final ArgumentCaptor<String> errorCaptor = ArgumentCaptor.forClass(String.class);
    verify(outboxEventRepository)
        .markFailure(
            eq(record.eventId()),
            anyString(),
            eq(1),
            eq(OutboxStatus.PENDING),
            nextRetryCaptor.capture(),
            errorCaptor.capture());
    assertThat(nextRetryCaptor.getValue()).isAfter(FIXED_NOW);
    // error-message-max-length で切り詰める
    assertThat(errorCaptor.getValue()).hasSize(16);
    verify(metrics).recordDispatch(KarmaErrorCode.EXTERNAL_DISPATCH_FAILURE.name());
    verify(outboxEventRepository, never()).markDispatched(any(UUID.class), anyString(), any());
  }

  @Test
  void lastAttemptMovesEventToFailed() throws JsonProcessingException {
    final OutboxEventRecord record = record(PROPERTIES.maxAttempts() - 1);
    when(outboxEventRepository.claimPending(anyInt(), any(Instant.class), any(Instant.class), anyString()))
        .thenReturn(List.of(record));
    doThrow(new IllegalStateException("boom"))
        .when(dispatcher)
        .dispatch(anyString(), anyString(), any(OrderEventPayload.class));
    when(outboxEventRepository.markFailure(
            eq(record.eventId()),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            eq("boom")))
        .thenReturn(1);
    when(outboxEventRepository.countByStatus(OutboxStatus.FAILED)).thenReturn(1);

    service.dispatchPendingBatch();

    verify(metrics).recordDispatch("error");
    verify(metrics).updateOutboxFailedCurrent(1);
  }

  @Test
  void unparseablePayloadGoesStraightToFailed() {
    final OutboxEventRecord record =
        new OutboxEventRecord(
            UUID.randomUUID(), "OrderPlaced", "order:1", "{broken", 0, FIXED_NOW.minusSeconds(2));
    when(outboxEventRepository.claimPending(anyInt(), any(Instant.class), any(Instant.class), anyString()))
        .thenReturn(List.of(record));
    when(outboxEventRepository.markFailure(
            eq(record.eventId()),
            anyString(),
            eq(PROPERTIES.maxAttempts()),
            eq(OutboxStatus.FAILED),
            isNull(),
            anyString()))
        .thenReturn(1);

    service.dispatchPendingBatch();

    verifyNoInteractions(dispatcher);
  }

  @Test
  void computeBackoffDurationStaysWithinJitterRange() {
    final int attempt = 3;
    final long base = PROPERTIES.backoffBase().toMillis() * 4;

    final Duration backoff = service.computeBackoffDuration(attempt);

    assertThat(backoff)
        .isBetween(
            Duration.ofMillis((long) (base * PROPERTIES.backoffJitterMin())),
            Duration.ofMillis((long) Math.ceil(base * PROPERTIES.backoffJitterMax())));
  }

  @Test
  void computeBackoffDurationIsCappedAtMaximum() {
    final Duration backoff = service.computeBackoffDuration(20);

    assertThat(backoff)
        .isLessThanOrEqualTo(
            Duration.ofMillis(
                (long) Math.ceil(PROPERTIES.backoffMax().toMillis() * PROPERTIES.backoffJitterMax())));
  }

  private OutboxEventRecord record(int attemptCount) throws JsonProcessingException {
    final UUID eventId = UUID.randomUUID();
    final OrderEventPayload payload =
        new OrderEventPayload(
            eventId.toString(),
            "OrderPlaced",
            FIXED_NOW.minusSeconds(2).toString(),
            "order",
            "1",
            "ORDERED",
            "player-p",
            "player-p",
            null,
            "tea",
            null,
            2,
            1,
            null,
            "trace-1");
    return new OutboxEventRecord(
        eventId,
        "OrderPlaced",
        "order:1",
        objectMapper.writeValueAsString(payload),
        attemptCount,
        FIXED_NOW.minusSeconds(2));
  }
}
