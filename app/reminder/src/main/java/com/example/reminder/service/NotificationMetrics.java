/*
 * どこで: reminder サービス層
 * 何を: 作成・重複抑止・送信結果・sweep 状態のメトリクス
 * なぜ: ログを読まずに Prometheus から送信成功と sweep 失敗を把握するため
 */
package com.example.reminder.service;

import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.NotificationKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  private static final String METRIC_CREATED_TOTAL = "notification.created.total";
  private static final String METRIC_DEDUP_TOTAL = "notification.dedup.skipped.total";
  private static final String METRIC_DISPATCH_TOTAL = "notification.dispatch.total";
  private static final String METRIC_CHANNEL_LATENCY = "notification.channel.latency";
  private static final String METRIC_LIFECYCLE_TOTAL = "notification.lifecycle.total";
  private static final String METRIC_SWEEP_FAILURE_TOTAL = "notification.sweep.failures.total";
  private static final String METRIC_SWEEP_SKIPPED_TOTAL = "notification.sweep.overlap.skipped.total";
  private static final String METRIC_INVALID_TRANSITION_TOTAL =
      "notification.invalid.transition.total";
  private static final String METRIC_STALE_PENDING_CURRENT = "notification.stale.pending.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger stalePendingCurrent = new AtomicInteger(0);
  private final ConcurrentMap<Tags, Counter> counters = new ConcurrentHashMap<>();
  private final Counter invalidTransitionCounter;
  private final Timer channelLatencyTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_STALE_PENDING_CURRENT, stalePendingCurrent, AtomicInteger::get)
        .description("PENDING notifications older than the stale threshold at the last cleanup")
        .register(meterRegistry);
    this.invalidTransitionCounter =
        Counter.builder(METRIC_INVALID_TRANSITION_TOTAL)
            .description("Status updates rejected because the record was terminal or missing")
            .register(meterRegistry);
    this.channelLatencyTimer =
        Timer.builder(METRIC_CHANNEL_LATENCY)
            .description("Time spent waiting for the notification channel")
            .register(meterRegistry);
  }

  public void recordCreated(NotificationKind kind) {
    counter(METRIC_CREATED_TOTAL, "Notification records created", Tags.of("kind", kind.name()))
        .increment();
  }

  public void recordDedupSkipped(NotificationKind kind) {
    counter(
            METRIC_DEDUP_TOTAL,
            "Creates skipped because a record already existed",
            Tags.of("kind", kind.name()))
        .increment();
  }

  public void recordDispatch(NotificationKind kind, DispatchOutcome outcome) {
    counter(
            METRIC_DISPATCH_TOTAL,
            "Notification dispatch outcomes",
            Tags.of("kind", kind.name(), "outcome", outcome.name().toLowerCase()))
        .increment();
  }

  public void recordChannelLatency(Duration elapsed) {
    if (elapsed == null || elapsed.isNegative()) {
      return;
    }
    channelLatencyTimer.record(elapsed);
  }

  public void recordLifecycleOutcome(String outcome) {
    counter(METRIC_LIFECYCLE_TOTAL, "Lifecycle trigger outcomes", Tags.of("outcome", outcome))
        .increment();
  }

  public void recordSweepFailure(String sweep) {
    counter(METRIC_SWEEP_FAILURE_TOTAL, "Sweep ticks aborted by an error", Tags.of("sweep", sweep))
        .increment();
  }

  public void recordSweepOverlapSkipped(String sweep) {
    counter(
            METRIC_SWEEP_SKIPPED_TOTAL,
            "Sweep ticks skipped because the previous tick was still running",
            Tags.of("sweep", sweep))
        .increment();
  }

  public void recordInvalidTransition() {
    invalidTransitionCounter.increment();
  }

  public void updateStalePending(int count) {
    stalePendingCurrent.set(Math.max(count, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        tags.and("metric", name),
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
