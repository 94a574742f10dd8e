package com.example.reminder.api;

import com.example.reminder.service.LifecycleOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppointmentTransitionResponse(UUID appointmentId, LifecycleOutcome outcome) {}
