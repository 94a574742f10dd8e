/*
 * どこで: reminder サービスの単体テスト
 * 何を: issuer の作成・重複処理と appointment 単位のエラー分離を検証する
 */
package com.example.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.reminder.config.NotificationDispatchProperties;
import com.example.reminder.model.Appointment;
import com.example.reminder.model.AppointmentStatus;
import com.example.reminder.model.CreateResult;
import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.NotificationDraft;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.model.NotificationStatus;
import com.example.reminder.model.SweepSummary;
import com.example.reminder.repository.NotificationLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class NotificationIssuerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
  private static final NotificationDispatchProperties PROPERTIES =
      new NotificationDispatchProperties(
          Duration.ofSeconds(5), 3, Duration.ofMinutes(2), 1000, 16, 4, 200);

  @Mock private NotificationLogRepository repository;
  @Mock private NotificationDispatcher dispatcher;
  @Mock private WorkerIdentity workerIdentity;
  @Mock private NotificationMetrics metrics;

  private NotificationIssuer issuer;

  @BeforeEach
  void setUp() {
    issuer =
        new NotificationIssuer(
            repository,
            new NotificationMessageRenderer(),
            dispatcher,
            new ObjectMapper(),
            PROPERTIES,
            workerIdentity,
            metrics);
  }

  @Test
  void createStoresRenderedPayloadUnderWorkerLease() throws Exception {
    final Appointment appointment = appointment();
    final NotificationRecord stored = record(appointment, NotificationKind.REMINDER_24H);
    when(workerIdentity.name()).thenReturn("host-1-abcd1234");
    when(repository.tryCreate(any(), eq(NOW), eq("host-1-abcd1234"), eq(NOW.plusSeconds(120))))
        .thenReturn(new CreateResult.Created(stored));

    final Optional<NotificationRecord> created =
        issuer.create(appointment, NotificationKind.REMINDER_24H, NOW);

    assertThat(created).contains(stored);
    final ArgumentCaptor<NotificationDraft> draft = ArgumentCaptor.forClass(NotificationDraft.class);
    verify(repository).tryCreate(draft.capture(), any(), any(), any());
    assertThat(draft.getValue().appointmentId()).isEqualTo(appointment.appointmentId());
    assertThat(draft.getValue().recipientRef()).isEqualTo("token-1");
    assertThat(new ObjectMapper().readTree(draft.getValue().payloadJson()).path("title").asText())
        .isEqualTo("Appointment Reminder - 24 hours");
    verify(metrics).recordCreated(NotificationKind.REMINDER_24H);
  }

  @Test
  void existingRecordIsSkippedWithoutDispatch() {
    final Appointment appointment = appointment();
    when(workerIdentity.name()).thenReturn("host-1");
    when(repository.tryCreate(any(), any(), any(), any()))
        .thenReturn(
            new CreateResult.AlreadyExists(
                appointment.appointmentId(), NotificationKind.REMINDER_2H));
    final SweepSummary.Tally tally = SweepSummary.tally();

    issuer.issue(appointment, NotificationKind.REMINDER_2H, NOW, tally);

    assertThat(tally.toSummary()).isEqualTo(new SweepSummary(0, 1, 0, 0, 0, 0));
    verify(metrics).recordDedupSkipped(NotificationKind.REMINDER_2H);
    verifyNoInteractions(dispatcher);
  }

  @Test
  void createdRecordIsDispatchedAndTallied() {
    final Appointment appointment = appointment();
    final NotificationRecord stored = record(appointment, NotificationKind.REMINDER_2H);
    when(workerIdentity.name()).thenReturn("host-1");
    when(repository.tryCreate(any(), any(), any(), any()))
        .thenReturn(new CreateResult.Created(stored));
    when(dispatcher.dispatch(stored)).thenReturn(DispatchOutcome.SENT);
    final SweepSummary.Tally tally = SweepSummary.tally();

    issuer.issue(appointment, NotificationKind.REMINDER_2H, NOW, tally);

    assertThat(tally.toSummary()).isEqualTo(new SweepSummary(1, 0, 1, 0, 0, 0));
  }

  @Test
  void dispatchErrorIsCountedAndDoesNotEscape() {
    final Appointment appointment = appointment();
    final NotificationRecord stored = record(appointment, NotificationKind.REMINDER_2H);
    when(workerIdentity.name()).thenReturn("host-1");
    when(repository.tryCreate(any(), any(), any(), any()))
        .thenReturn(new CreateResult.Created(stored));
    when(dispatcher.dispatch(stored)).thenThrow(new IllegalStateException("boom"));
    final SweepSummary.Tally tally = SweepSummary.tally();

    issuer.issue(appointment, NotificationKind.REMINDER_2H, NOW, tally);

    assertThat(tally.toSummary()).isEqualTo(new SweepSummary(1, 0, 0, 0, 0, 1));
  }

  @Test
  void storeFailureAbortsTheCaller() {
    when(workerIdentity.name()).thenReturn("host-1");
    when(repository.tryCreate(any(), any(), any(), any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThatThrownBy(
            () ->
                issuer.issue(
                    appointment(), NotificationKind.REMINDER_2H, NOW, SweepSummary.tally()))
        .isInstanceOf(DataAccessResourceFailureException.class);
  }

  private static Appointment appointment() {
    return new Appointment(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        NOW.plus(Duration.ofHours(24)),
        ZoneOffset.UTC,
        AppointmentStatus.CONFIRMED,
        null,
        "token-1");
  }

  private static NotificationRecord record(Appointment appointment, NotificationKind kind) {
    return new NotificationRecord(
        UUID.randomUUID(),
        appointment.appointmentId(),
        kind,
        NotificationStatus.PENDING,
        0,
        appointment.recipientRef(),
        "{}",
        NOW,
        null,
        null,
        null,
        null,
        "host-1",
        NOW.plusSeconds(120));
  }
}
