/*
 * どこで: reminder サービス層
 * 何を: 保存済み通知 1 件をチャネルへ送り、結果を記録する
 * なぜ: sweep・リトライ・lifecycle の全経路で同じタイムアウトと失敗分類を使うため
 */
package com.example.reminder.service;

import com.example.reminder.channel.NotificationChannel;
import com.example.reminder.config.DispatchExecutorConfig;
import com.example.reminder.config.NotificationDispatchProperties;
import com.example.reminder.model.DeliveryResult;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.NotificationMessage;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.model.NotificationStatus;
import com.example.reminder.repository.InvalidTransitionException;
import com.example.reminder.repository.NotificationLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

@Service
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationLogRepository notificationLogRepository;
  private final NotificationChannel channel;
  private final AsyncTaskExecutor channelExecutor;
  private final ObjectMapper objectMapper;
  private final NotificationDispatchProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public NotificationDispatcher(
      NotificationLogRepository notificationLogRepository,
      NotificationChannel channel,
      @Qualifier(DispatchExecutorConfig.CHANNEL_EXECUTOR) AsyncTaskExecutor channelExecutor,
      ObjectMapper objectMapper,
      NotificationDispatchProperties properties,
      NotificationMetrics metrics,
      Clock clock) {
    this.notificationLogRepository = notificationLogRepository;
    this.channel = channel;
    this.channelExecutor = channelExecutor;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: PENDING または FAILED のレコードを送信し、結果を保存する。
   * 動作: チャネル側の問題は FAILED（または PERMANENTLY_FAILED）として記録し、ストア障害と不正な遷移は例外で返す。
   */
  public DispatchOutcome dispatch(NotificationRecord record) {
    if (!record.status().isDispatchable()) {
      metrics.recordInvalidTransition();
      throw new InvalidTransitionException(
          record.notificationId(), record.status(), NotificationStatus.SENT);
    }
    final DeliveryResult result = deliver(record);
    final Instant at = Instant.now(clock);
    final NotificationRecord updated;
    try {
      if (result instanceof DeliveryResult.Failed failed) {
        updated =
            notificationLogRepository.markFailed(
                record.notificationId(),
                at,
                properties.maxRetries(),
                failed.reason(),
                truncateError(failed.detail()));
        logger.warn(
            "notification delivery failed id={} kind={} attempt={} reason={} status={} error={}",
            record.notificationId(),
            record.kind(),
            updated.attemptCount(),
            failed.reason(),
            updated.status(),
            updated.lastError());
      } else {
        updated = notificationLogRepository.markSent(record.notificationId(), at);
        logger.info(
            "notification sent id={} kind={} attempt={}",
            record.notificationId(),
            record.kind(),
            updated.attemptCount());
      }
    } catch (InvalidTransitionException ex) {
      metrics.recordInvalidTransition();
      logger.error("notification outcome could not be recorded id={}", record.notificationId(), ex);
      throw ex;
    }
    final DispatchOutcome outcome = DispatchOutcome.of(updated.status());
    metrics.recordDispatch(record.kind(), outcome);
    return outcome;
  }

  @VisibleForTesting
  DeliveryResult deliver(NotificationRecord record) {
    if (record.recipientRef() == null || record.recipientRef().isBlank()) {
      return DeliveryResult.permanentFailure("recipient token is missing");
    }
    final NotificationMessage message;
    try {
      message = objectMapper.readValue(record.payloadJson(), NotificationMessage.class);
    } catch (JsonProcessingException ex) {
      return DeliveryResult.permanentFailure("payload unreadable: " + ex.getOriginalMessage());
    }
    final Duration timeout = properties.channelTimeout();
    final long startedAt = System.nanoTime();
    final Future<DeliveryResult> future;
    try {
      future =
          channelExecutor.submit(() -> channel.send(record.recipientRef(), record.kind(), message));
    } catch (RejectedExecutionException ex) {
      return DeliveryResult.transientFailure("channel executor saturated");
    }
    try {
      final DeliveryResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return result == null ? DeliveryResult.transientFailure("channel returned no result") : result;
    } catch (TimeoutException ex) {
      future.cancel(true);
      return DeliveryResult.transientFailure("channel timed out after " + timeout);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return DeliveryResult.transientFailure(
          cause.getClass().getSimpleName() + ": " + cause.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return DeliveryResult.transientFailure("interrupted while waiting for channel");
    } finally {
      metrics.recordChannelLatency(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
