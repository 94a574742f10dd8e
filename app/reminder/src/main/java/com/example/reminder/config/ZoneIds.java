package com.example.reminder.config;

import java.time.DateTimeException;
import java.time.ZoneId;

final class ZoneIds {
  private ZoneIds() {}

  static boolean isValid(String zone) {
    if (zone == null || zone.isBlank()) {
      return false;
    }
    try {
      ZoneId.of(zone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }
}
