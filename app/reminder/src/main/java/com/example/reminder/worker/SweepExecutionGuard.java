/*
 * どこで: reminder worker
 * 何を: sweep を 1 回ずつ MDC 付きで実行し、重複と失敗を計上する
 * なぜ: 遅い実行を積み上げずにスキップし、中断した実行を可視化するため
 */
package com.example.reminder.worker;

import com.example.common.logging.MdcScope;
import com.example.reminder.service.NotificationMetrics;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SweepExecutionGuard {

  private static final Logger logger = LoggerFactory.getLogger(SweepExecutionGuard.class);

  private final String sweep;
  private final NotificationMetrics metrics;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public SweepExecutionGuard(String sweep, NotificationMetrics metrics) {
    this.sweep = sweep;
    this.metrics = metrics;
  }

  /**
   * 役割: 同じ sweep の前回実行が終わっていれば {@code tick} を実行する。
   *
   * @return 実行結果。スキップまたは例外で中断した場合は空
   */
  public <T> Optional<T> run(Supplier<T> tick) {
    if (!running.compareAndSet(false, true)) {
      metrics.recordSweepOverlapSkipped(sweep);
      logger.warn("sweep tick skipped because the previous tick is still running sweep={}", sweep);
      return Optional.empty();
    }
    try (MdcScope mdc = MdcScope.open()) {
      mdc.put("sweep", sweep).put("sweep_run_id", UUID.randomUUID().toString());
      try {
        return Optional.ofNullable(tick.get());
      } catch (RuntimeException ex) {
        // 次回の実行でそのまま再試行される
        metrics.recordSweepFailure(sweep);
        logger.error("sweep tick aborted sweep={}", sweep, ex);
        return Optional.empty();
      }
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }
}
