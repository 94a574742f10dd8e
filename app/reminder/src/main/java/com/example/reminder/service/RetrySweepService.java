/*
 * どこで: reminder サービス層
 * 何を: リトライ上限内の FAILED を再送し、滞留した PENDING を回収する
 * なぜ: 一時的なチャネル障害や送信側の異常終了で通知を失わないため
 */
package com.example.reminder.service;

import com.example.reminder.config.NotificationDispatchProperties;
import com.example.reminder.config.RetrySweepProperties;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.model.SweepSummary;
import com.example.reminder.repository.NotificationLogRepository;
import com.example.reminder.repository.PageCursor;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetrySweepService {

  private static final Logger logger = LoggerFactory.getLogger(RetrySweepService.class);

  private final NotificationLogRepository notificationLogRepository;
  private final NotificationDispatcher dispatcher;
  private final RetrySweepProperties properties;
  private final NotificationDispatchProperties dispatchProperties;
  private final WorkerIdentity workerIdentity;
  private final Clock clock;

  public SweepSummary runSweep() {
    final Instant now = Instant.now(clock);
    final SweepSummary.Tally tally = SweepSummary.tally();
    final int pageSize = properties.pageSize();
    drain(
        cursor ->
            notificationLogRepository.listRetryCandidates(
                now, properties.lookback(), dispatchProperties.maxRetries(), cursor, pageSize),
        pageSize,
        tally);
    drain(
        cursor ->
            notificationLogRepository.listStalledPending(
                now, properties.lookback(), cursor, pageSize),
        pageSize,
        tally);
    return tally.toSummary();
  }

  private void drain(
      Function<PageCursor, List<NotificationRecord>> pageLoader,
      int pageSize,
      SweepSummary.Tally tally) {
    PageCursor cursor = PageCursor.START;
    while (true) {
      final List<NotificationRecord> page = pageLoader.apply(cursor);
      for (NotificationRecord record : page) {
        redispatch(record, tally);
      }
      if (page.size() < pageSize) {
        return;
      }
      cursor = PageCursor.after(page.get(page.size() - 1));
    }
  }

  private void redispatch(NotificationRecord candidate, SweepSummary.Tally tally) {
    final Instant now = Instant.now(clock);
    try {
      final Optional<NotificationRecord> claimed =
          notificationLogRepository.claimForDispatch(
              candidate, workerIdentity.name(), now, now.plus(dispatchProperties.lease()));
      if (claimed.isEmpty()) {
        // 別 worker がリースを保持中か、この試行を記録済み
        logger.debug("retry claim lost id={}", candidate.notificationId());
        tally.skipped();
        return;
      }
      tally.outcome(dispatcher.dispatch(claimed.get()));
    } catch (DataAccessException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      tally.error();
      logger.error("retry dispatch failed id={}", candidate.notificationId(), ex);
    }
  }
}
