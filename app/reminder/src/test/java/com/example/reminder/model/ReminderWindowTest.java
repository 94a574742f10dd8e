package com.example.reminder.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ReminderWindowTest {

  private final ReminderWindow window = new ReminderWindow(Duration.ofHours(24), Duration.ofHours(25));

  @Test
  void containsIsHalfOpen() {
    assertThat(window.contains(Duration.ofHours(24))).isTrue();
    assertThat(window.contains(Duration.ofHours(25).minusNanos(1))).isTrue();
    assertThat(window.contains(Duration.ofHours(25))).isFalse();
    assertThat(window.contains(Duration.ofHours(23))).isFalse();
  }

  @Test
  void scheduledAtBoundsFollowNow() {
    final Instant now = Instant.parse("2026-03-02T09:00:00Z");

    assertThat(window.earliestScheduledAt(now)).isEqualTo(Instant.parse("2026-03-03T09:00:00Z"));
    assertThat(window.latestScheduledAt(now)).isEqualTo(Instant.parse("2026-03-03T10:00:00Z"));
  }

  @Test
  void rejectsEmptyOrNegativeWindows() {
    assertThatThrownBy(() -> new ReminderWindow(Duration.ofHours(2), Duration.ofHours(2)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ReminderWindow(Duration.ofHours(-1), Duration.ofHours(2)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void onlyWindowedKindsHaveDefaults() {
    assertThat(NotificationKind.BOOKING_CONFIRMATION.defaultWindow()).isEmpty();
    assertThat(NotificationKind.anchoredTo(NotificationKind.Anchor.BEFORE_SCHEDULED))
        .containsExactly(NotificationKind.REMINDER_24H, NotificationKind.REMINDER_2H);
  }
}
