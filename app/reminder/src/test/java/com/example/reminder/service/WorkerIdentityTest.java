package com.example.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkerIdentityTest {

  @Test
  void usesHostnameFromEnvironmentWithRandomSuffix() {
    final WorkerIdentity first = new WorkerIdentity(Map.of("HOSTNAME", "reminder-7f9c")::get);
    final WorkerIdentity second = new WorkerIdentity(Map.of("HOSTNAME", "reminder-7f9c")::get);

    assertThat(first.name()).matches("reminder-7f9c-[0-9a-f]{8}");
    assertThat(first.name()).isNotEqualTo(second.name());
  }

  @Test
  void fallsBackToResolvedHostWhenEnvironmentIsBlank() {
    final WorkerIdentity identity = new WorkerIdentity(Map.of("HOSTNAME", " ")::get);

    assertThat(identity.name()).isNotBlank().doesNotStartWith(" ");
  }
}
