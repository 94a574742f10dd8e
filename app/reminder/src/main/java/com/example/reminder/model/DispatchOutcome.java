package com.example.reminder.model;

public enum DispatchOutcome {
  SENT,
  FAILED,
  PERMANENTLY_FAILED;

  public static DispatchOutcome of(NotificationStatus status) {
    return switch (status) {
      case SENT -> SENT;
      case FAILED -> FAILED;
      case PERMANENTLY_FAILED -> PERMANENTLY_FAILED;
      case PENDING -> throw new IllegalArgumentException("PENDING is not a dispatch outcome");
    };
  }
}
