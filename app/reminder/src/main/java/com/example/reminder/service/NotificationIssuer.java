/*
 * どこで: reminder サービス層
 * 何を: 1 組の (appointment, kind) を描画して tryCreate し、必要なら同期送信する
 * なぜ: reminder・review・lifecycle の各経路で同じ重複抑止を守るため
 */
package com.example.reminder.service;

import com.example.reminder.config.NotificationDispatchProperties;
import com.example.reminder.model.Appointment;
import com.example.reminder.model.CreateResult;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.NotificationDraft;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationMessage;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.model.SweepSummary;
import com.example.reminder.repository.NotificationLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationIssuer {

  private static final Logger logger = LoggerFactory.getLogger(NotificationIssuer.class);

  private final NotificationLogRepository notificationLogRepository;
  private final NotificationMessageRenderer renderer;
  private final NotificationDispatcher dispatcher;
  private final ObjectMapper objectMapper;
  private final NotificationDispatchProperties properties;
  private final WorkerIdentity workerIdentity;
  private final NotificationMetrics metrics;

  /**
   * 役割: {@code (appointment, kind)} の PENDING レコードを作成する。
   *
   * @return この worker の送信リースを持つ新規レコード。状態を問わず既存レコードがあれば空
   */
  public Optional<NotificationRecord> create(
      Appointment appointment, NotificationKind kind, Instant now) {
    final NotificationMessage message = renderer.render(appointment, kind);
    final NotificationDraft draft =
        new NotificationDraft(
            appointment.appointmentId(), kind, appointment.recipientRef(), toJson(message));
    final CreateResult result =
        notificationLogRepository.tryCreate(
            draft, now, workerIdentity.name(), now.plus(properties.lease()));
    if (result instanceof CreateResult.Created created) {
      metrics.recordCreated(kind);
      logger.info(
          "notification created id={} appointmentId={} kind={}",
          created.record().notificationId(),
          appointment.appointmentId(),
          kind);
      return Optional.of(created.record());
    }
    metrics.recordDedupSkipped(kind);
    logger.debug(
        "notification already exists appointmentId={} kind={}", appointment.appointmentId(), kind);
    return Optional.empty();
  }

  /**
   * 役割: 作成してすぐ送信し、結果を {@code tally} に記録する。
   * 動作: appointment 単位の失敗は計上してログに残し、ストア障害は呼び出し元の sweep を中断させる。
   */
  public void issue(
      Appointment appointment, NotificationKind kind, Instant now, SweepSummary.Tally tally) {
    try {
      final Optional<NotificationRecord> created = create(appointment, kind, now);
      if (created.isEmpty()) {
        tally.skipped();
        return;
      }
      tally.created();
      final DispatchOutcome outcome = dispatcher.dispatch(created.get());
      tally.outcome(outcome);
    } catch (DataAccessException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      tally.error();
      logger.error(
          "notification issue failed appointmentId={} kind={}",
          appointment.appointmentId(),
          kind,
          ex);
    }
  }

  private String toJson(NotificationMessage message) {
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new NotificationPayloadException("notification payload serialization failure", ex);
    }
  }
}
