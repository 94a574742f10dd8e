/*
 * どこで: reminder API
 * 何を: 予約サブシステムからの appointment 遷移を受け付ける
 * なぜ: 遷移通知は次の sweep を待たず予約の変更時に送るため
 */
package com.example.reminder.api;

import com.example.reminder.model.Appointment;
import com.example.reminder.model.AppointmentTransition;
import com.example.reminder.service.LifecycleOutcome;
import com.example.reminder.service.LifecycleTriggerService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/appointments")
@RequiredArgsConstructor
public class AppointmentTransitionController {

  private final LifecycleTriggerService lifecycleTriggerService;
  private final Clock clock;

  @PostMapping("/transitions")
  public ResponseEntity<AppointmentTransitionResponse> transition(
      @Valid @RequestBody AppointmentTransitionRequest request) {
    final LifecycleOutcome outcome = lifecycleTriggerService.onTransition(toTransition(request));
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new AppointmentTransitionResponse(request.appointmentId(), outcome));
  }

  private AppointmentTransition toTransition(AppointmentTransitionRequest request) {
    final Appointment appointment =
        new Appointment(
            request.appointmentId(),
            request.businessId(),
            request.clientId(),
            request.scheduledAt(),
            resolveZone(request.timeZone()),
            request.status(),
            request.completedAt(),
            request.recipientRef());
    final Instant occurredAt =
        request.occurredAt() == null ? Instant.now(clock) : request.occurredAt();
    return new AppointmentTransition(appointment, request.previousStatus(), occurredAt);
  }

  private ZoneId resolveZone(String timeZone) {
    if (timeZone == null || timeZone.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(timeZone);
    } catch (DateTimeException ex) {
      throw new InvalidRequestException("time_zone is invalid");
    }
  }
}
