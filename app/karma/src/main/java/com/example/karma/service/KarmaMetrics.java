/*
 * どこで: Karma サービス層
 * 何を: 遷移結果/スイープ/通知配信のメトリクス記録を集約する
 * なぜ: 期限切れの滞留や通知失敗を運用で継続監視できるようにするため
 */
package com.example.karma.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class KarmaMetrics {

  static final String METRIC_TRANSITION_TOTAL = "karma.transition.total";
  static final String METRIC_SWEEP_EXPIRED_TOTAL = "karma.sweep.expired.total";
  static final String METRIC_SWEEP_FAILED_TOTAL = "karma.sweep.failed.total";
  static final String METRIC_DISPATCH_TOTAL = "karma.dispatch.total";
  static final String METRIC_DISPATCH_DELAY = "karma.dispatch.delay";
  static final String METRIC_OUTBOX_FAILED_CURRENT = "karma.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer dispatchDelayTimer;

  public KarmaMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED notification outbox events")
        .register(meterRegistry);
    this.dispatchDelayTimer =
        Timer.builder(METRIC_DISPATCH_DELAY)
            .description("Delay from transition commit to notification dispatch")
            .register(meterRegistry);
  }

  /** result は success か KarmaErrorCode 名。 */
  public void recordTransition(String action, String result) {
    counter(METRIC_TRANSITION_TOTAL, "State transition attempts", "action", action, "result", result)
        .increment();
  }

  public void recordSweepExpired(String kind, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_SWEEP_EXPIRED_TOTAL, "Records expired by the sweeper", "kind", kind, null, null)
        .increment(count);
  }

  public void recordSweepFailure(String kind) {
    counter(METRIC_SWEEP_FAILED_TOTAL, "Sweeper per-record failures", "kind", kind, null, null)
        .increment();
  }

  public void recordDispatch(String result) {
    counter(METRIC_DISPATCH_TOTAL, "Notification dispatch attempts", "result", result, null, null)
        .increment();
  }

  public void recordDispatchDelay(Instant occurredAt, Instant dispatchedAt) {
    if (occurredAt == null || dispatchedAt == null || dispatchedAt.isBefore(occurredAt)) {
      return;
    }
    dispatchDelayTimer.record(Duration.between(occurredAt, dispatchedAt));
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }

  private Counter counter(
      String name,
      String description,
      String tagKey,
      String tagValue,
      String secondKey,
      String secondValue) {
    final Tags tags =
        secondKey == null
            ? Tags.of(tagKey, tagValue)
            : Tags.of(tagKey, tagValue, secondKey, secondValue);
    final String cacheKey = name + ":" + tags;
    return counters.computeIfAbsent(
        cacheKey,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
