/*
 * どこで: reminder サービス層
 * 何を: appointment 遷移時に BOOKING_CONFIRMATION と CANCELLATION を発行する
 * なぜ: 通知を送れなくても予約処理を失敗・停止させないため
 */
package com.example.reminder.service;

import com.example.reminder.config.DispatchExecutorConfig;
import com.example.reminder.config.NotificationDispatchProperties;
import com.example.reminder.model.AppointmentStatus;
import com.example.reminder.model.AppointmentTransition;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.repository.NotificationLogRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class LifecycleTriggerService {

  private static final Logger logger = LoggerFactory.getLogger(LifecycleTriggerService.class);

  private final NotificationIssuer issuer;
  private final NotificationDispatcher dispatcher;
  private final NotificationLogRepository notificationLogRepository;
  private final NotificationDispatchProperties properties;
  private final Executor lifecycleExecutor;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public LifecycleTriggerService(
      NotificationIssuer issuer,
      NotificationDispatcher dispatcher,
      NotificationLogRepository notificationLogRepository,
      NotificationDispatchProperties properties,
      @Qualifier(DispatchExecutorConfig.LIFECYCLE_EXECUTOR) Executor lifecycleExecutor,
      NotificationMetrics metrics,
      Clock clock) {
    this.issuer = issuer;
    this.dispatcher = dispatcher;
    this.notificationLogRepository = notificationLogRepository;
    this.properties = properties;
    this.lifecycleExecutor = lifecycleExecutor;
    this.metrics = metrics;
    this.clock = clock;
  }

  public LifecycleOutcome onTransition(AppointmentTransition transition) {
    final LifecycleOutcome outcome = handle(transition);
    metrics.recordLifecycleOutcome(outcome.name().toLowerCase());
    logger.info(
        "appointment transition handled appointmentId={} from={} to={} occurredAt={} outcome={}",
        transition.appointment().appointmentId(),
        transition.previousStatus(),
        transition.newStatus(),
        transition.occurredAt(),
        outcome);
    return outcome;
  }

  private LifecycleOutcome handle(AppointmentTransition transition) {
    if (transition.newStatus() == AppointmentStatus.COMPLETED) {
      return LifecycleOutcome.DEFERRED;
    }
    final Optional<NotificationKind> kind = kindFor(transition.newStatus());
    if (kind.isEmpty()) {
      return LifecycleOutcome.NOT_APPLICABLE;
    }
    final Optional<NotificationRecord> created;
    try {
      created = issuer.create(transition.appointment(), kind.get(), Instant.now(clock));
    } catch (RuntimeException ex) {
      logger.error(
          "lifecycle notification could not be stored appointmentId={} kind={}",
          transition.appointment().appointmentId(),
          kind.get(),
          ex);
      return LifecycleOutcome.ENQUEUE_FAILED;
    }
    if (created.isEmpty()) {
      return LifecycleOutcome.ALREADY_EXISTS;
    }
    final NotificationRecord record = created.get();
    try {
      lifecycleExecutor.execute(() -> dispatchInBackground(record));
    } catch (RejectedExecutionException ex) {
      logger.warn(
          "lifecycle executor saturated; left for retry sweep id={} leaseUntil={}",
          record.notificationId(),
          record.leaseUntil());
      return LifecycleOutcome.QUEUED_FOR_RECOVERY;
    }
    return LifecycleOutcome.ENQUEUED;
  }

  private void dispatchInBackground(NotificationRecord record) {
    try {
      // キュー待ちの間に作成時のリースが切れている場合がある
      final Instant now = Instant.now(clock);
      final Optional<NotificationRecord> renewed =
          notificationLogRepository.renewLease(record, now, now.plus(properties.lease()));
      if (renewed.isEmpty()) {
        metrics.recordLifecycleOutcome("lease_lapsed");
        logger.warn(
            "lifecycle dispatch skipped; lease lapsed before the task ran id={} leaseUntil={}",
            record.notificationId(),
            record.leaseUntil());
        return;
      }
      dispatcher.dispatch(renewed.get());
    } catch (RuntimeException ex) {
      // 行はリース付きの PENDING のまま残り、リース切れ後に retry sweep が拾う
      logger.error(
          "lifecycle dispatch failed id={} kind={}", record.notificationId(), record.kind(), ex);
    }
  }

  private static Optional<NotificationKind> kindFor(AppointmentStatus status) {
    return switch (status) {
      case CONFIRMED -> Optional.of(NotificationKind.BOOKING_CONFIRMATION);
      case CANCELLED -> Optional.of(NotificationKind.CANCELLATION);
      case PENDING, COMPLETED -> Optional.empty();
    };
  }
}
