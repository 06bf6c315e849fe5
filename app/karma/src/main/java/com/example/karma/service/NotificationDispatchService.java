/*
 * どこで: Karma 通知層
 * 何を: outbox_events を claim して NotificationDispatcher へ渡し、結果を反映する
 * なぜ: 通知失敗をバックオフ付きで再送し、確定済みの遷移を巻き戻さないため
 */
package com.example.karma.service;

import com.example.common.event.OrderEventPayload;
import com.example.karma.config.KarmaOutboxProperties;
import com.example.karma.model.OutboxEventRecord;
import com.example.karma.model.OutboxStatus;
import com.example.karma.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "karma.outbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NotificationDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final OutboxEventRepository outboxEventRepository;
  private final NotificationDispatcher dispatcher;
  private final KarmaOutboxProperties properties;
  private final ObjectMapper objectMapper;
  private final KarmaMetrics metrics;
  private final Clock clock;

  /** @return 配信に成功した件数 */
  public int dispatchPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final Instant leaseUntil = now.plus(properties.lease());
    final List<OutboxEventRecord> pending =
        outboxEventRepository.claimPending(properties.batchSize(), now, leaseUntil, lockedBy);
    int dispatched = 0;
    for (OutboxEventRecord record : pending) {
      try {
        final OrderEventPayload payload = parsePayload(record);
        dispatcher.dispatch(record.eventType(), record.aggregateKey(), payload);
        final int updated = outboxEventRepository.markDispatched(record.eventId(), lockedBy, now);
        if (updated == 0) {
          logger.warn("notification dispatched but lock was lost eventId={}", record.eventId());
        } else {
          dispatched++;
          metrics.recordDispatch("success");
          metrics.recordDispatchDelay(record.createdAt(), now);
        }
      } catch (ExternalDispatchFailureException ex) {
        metrics.recordDispatch(ex.code().name());
        handleFailure(record, ex, now, lockedBy);
      } catch (RuntimeException ex) {
        metrics.recordDispatch("error");
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countByStatus(OutboxStatus.FAILED));
    return dispatched;
  }

  private OrderEventPayload parsePayload(OutboxEventRecord record) {
    try {
      return objectMapper.readValue(record.payloadJson(), OrderEventPayload.class);
    } catch (JsonProcessingException ex) {
      // パース不能はリトライしても回復しないので専用例外で即時FAILEDに寄せる
      throw new PayloadParseException("outbox payload parse failure", ex);
    }
  }

  private void handleFailure(OutboxEventRecord record, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable = ex instanceof PayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxEventRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "notification retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (failed) {
      if (nonRetryable) {
        logger.error(
            "notification payload parse failed and moved to FAILED eventId={}",
            record.eventId(),
            ex);
      } else {
        logger.warn("notification dispatch moved to FAILED eventId={}", record.eventId(), ex);
      }
    } else {
      logger.warn(
          "notification dispatch retry scheduled eventId={} attempt={} nextRetryAt={}",
          record.eventId(),
          nextAttempt,
          nextRetryAt,
          ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static final class PayloadParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private PayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
