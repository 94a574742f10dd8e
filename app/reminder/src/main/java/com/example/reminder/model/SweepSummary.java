/*
 * どこで: notification ドメインモデル
 * 何を: 各 sweep が 1 回ごとに返す件数
 * なぜ: worker が 1 回ごとに 1 行の要約をログに出し、テストで検証するため
 */
package com.example.reminder.model;

public record SweepSummary(
    int created, int skipped, int sent, int failed, int permanentlyFailed, int errors) {

  public static Tally tally() {
    return new Tally();
  }

  public static final class Tally {
    private int created;
    private int skipped;
    private int sent;
    private int failed;
    private int permanentlyFailed;
    private int errors;

    private Tally() {}

    public void created() {
      created++;
    }

    public void skipped() {
      skipped++;
    }

    public void error() {
      errors++;
    }

    public void outcome(DispatchOutcome outcome) {
      switch (outcome) {
        case SENT -> sent++;
        case FAILED -> failed++;
        case PERMANENTLY_FAILED -> permanentlyFailed++;
      }
    }

    public SweepSummary toSummary() {
      return new SweepSummary(created, skipped, sent, failed, permanentlyFailed, errors);
    }
  }
}
