/*
 * どこで: notification ログのデータアクセス
 * 何を: notification_records の挿入・条件付き状態更新・リトライ走査・保持期間削除
 * なぜ: sweep とレプリカ間の調停はこのテーブルだけで行うため
 */
package com.example.reminder.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.reminder.model.CreateResult;
import com.example.reminder.model.FailureReason;
import com.example.reminder.model.NotificationDraft;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationLogRepository {

  private static final String COLUMNS =
      """
      notification_id, appointment_id, kind, status, attempt_count, recipient_ref,
      payload_json::text AS payload_json_text, created_at, last_attempt_at, sent_at,
      failure_reason, last_error, locked_by, lease_until
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: (appointment_id, kind) のレコードがまだ無ければ PENDING で挿入する。
   * 動作: 作成者は {@code leaseUntil} まで送信リースを持ち、初回送信中は滞留 PENDING の回収対象にならない。
   */
  public CreateResult tryCreate(
      NotificationDraft draft, Instant now, String lockedBy, Instant leaseUntil) {
    final String sql =
        """
        INSERT INTO notification_records (
          notification_id,
          appointment_id,
          kind,
          status,
          attempt_count,
          recipient_ref,
          payload_json,
          created_at,
          locked_by,
          lease_until
        ) VALUES (
          :notificationId,
          :appointmentId,
          :kind,
          'PENDING',
          0,
          :recipientRef,
          :payloadJson::jsonb,
          :createdAt,
          :lockedBy,
          :leaseUntil
        )
        ON CONFLICT (appointment_id, kind) DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", UUID.randomUUID())
            .addValue("appointmentId", draft.appointmentId())
            .addValue("kind", draft.kind().name())
            .addValue("recipientRef", draft.recipientRef())
            .addValue("payloadJson", draft.payloadJson())
            .addValue("createdAt", toTimestamp(now))
            .addValue("lockedBy", lockedBy)
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    final List<NotificationRecord> inserted = jdbcTemplate.query(sql, params, this::mapRow);
    if (inserted.isEmpty()) {
      return new CreateResult.AlreadyExists(draft.appointmentId(), draft.kind());
    }
    return new CreateResult.Created(inserted.get(0));
  }

  public NotificationRecord markSent(UUID notificationId, Instant at) {
    final String sql =
        """
        UPDATE notification_records
        SET status = 'SENT',
            attempt_count = attempt_count + 1,
            last_attempt_at = :at,
            sent_at = :at,
            locked_by = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status IN ('PENDING', 'FAILED')
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("at", toTimestamp(at));
    return single(
        jdbcTemplate.query(sql, params, this::mapRow), notificationId, NotificationStatus.SENT);
  }

  /**
   * 役割: 失敗した送信試行を記録する。
   * 動作: 加算後の試行回数が {@code maxRetries} に達したら同じ文で PERMANENTLY_FAILED にする。
   */
  public NotificationRecord markFailed(
      UUID notificationId, Instant at, int maxRetries, FailureReason reason, String error) {
    final String sql =
        """
        UPDATE notification_records
        SET status = CASE
              WHEN attempt_count + 1 >= :maxRetries THEN 'PERMANENTLY_FAILED'
              ELSE 'FAILED'
            END,
            attempt_count = attempt_count + 1,
            last_attempt_at = :at,
            failure_reason = :reason,
            last_error = :error,
            locked_by = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status IN ('PENDING', 'FAILED')
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("at", toTimestamp(at))
            .addValue("maxRetries", maxRetries)
            .addValue("reason", reason.name())
            .addValue("error", error);
    return single(
        jdbcTemplate.query(sql, params, this::mapRow), notificationId, NotificationStatus.FAILED);
  }

  /**
   * 役割: {@code record} が示す試行の送信リースを取得する。
   * 動作: 別 worker が有効なリースを保持中か、すでにこの試行より先へ進めていれば空を返す。
   */
  public Optional<NotificationRecord> claimForDispatch(
      NotificationRecord record, String lockedBy, Instant now, Instant leaseUntil) {
    final String sql =
        """
        UPDATE notification_records
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND attempt_count = :expectedAttemptCount
          AND (lease_until IS NULL OR lease_until <= :now)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("expectedStatus", record.status().name())
            .addValue("expectedAttemptCount", record.attemptCount())
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 役割: 呼び出し元が保持中のリースを延長する。
   * 動作: リースが切れた後、別 worker が取得した後、試行が記録済みの場合は空を返す。
   */
  public Optional<NotificationRecord> renewLease(
      NotificationRecord record, Instant now, Instant leaseUntil) {
    final String sql =
        """
        UPDATE notification_records
        SET lease_until = :leaseUntil
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND attempt_count = :expectedAttemptCount
          AND locked_by = :lockedBy
          AND lease_until > :now
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("expectedStatus", record.status().name())
            .addValue("expectedAttemptCount", record.attemptCount())
            .addValue("lockedBy", record.lockedBy())
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> listRetryCandidates(
      Instant now, Duration maxAge, int maxRetries, PageCursor cursor, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_records
            WHERE status = 'FAILED'
              AND attempt_count < :maxRetries
              AND created_at > :since
              AND (created_at, notification_id) > (:cursorCreatedAt, :cursorId)
            ORDER BY created_at, notification_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        pageParams(cursor, limit)
            .addValue("maxRetries", maxRetries)
            .addValue("since", toTimestamp(now.minus(maxAge)));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 結果を記録する前に作成者のリースが切れた PENDING 行。 */
  public List<NotificationRecord> listStalledPending(
      Instant now, Duration maxAge, PageCursor cursor, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_records
            WHERE status = 'PENDING'
              AND (lease_until IS NULL OR lease_until <= :now)
              AND created_at > :since
              AND (created_at, notification_id) > (:cursorCreatedAt, :cursorId)
            ORDER BY created_at, notification_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        pageParams(cursor, limit)
            .addValue("now", toTimestamp(now))
            .addValue("since", toTimestamp(now.minus(maxAge)));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM notification_records WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findByAppointmentId(UUID appointmentId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_records
            WHERE appointment_id = :appointmentId
            ORDER BY created_at, notification_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("appointmentId", appointmentId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countByStatusSince(NotificationStatus status, Instant since) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_records
        WHERE status = :status
          AND created_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public int countStalePending(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_records
        WHERE created_at < :threshold
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int deleteOlderThan(Collection<NotificationStatus> statuses, Instant threshold) {
    if (statuses.contains(NotificationStatus.PENDING)) {
      throw new IllegalArgumentException("PENDING notifications are never deleted by retention");
    }
    if (statuses.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        DELETE FROM notification_records
        WHERE created_at < :threshold
          AND status IN (:statuses)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("statuses", statuses.stream().map(NotificationStatus::name).toList());
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord single(
      List<NotificationRecord> updated, UUID notificationId, NotificationStatus target) {
    if (!updated.isEmpty()) {
      return updated.get(0);
    }
    final NotificationStatus current =
        findById(notificationId).map(NotificationRecord::status).orElse(null);
    throw new InvalidTransitionException(notificationId, current, target);
  }

  private MapSqlParameterSource pageParams(PageCursor cursor, int limit) {
    return new MapSqlParameterSource()
        .addValue("cursorCreatedAt", toTimestamp(cursor.createdAt()))
        .addValue("cursorId", cursor.notificationId())
        .addValue("limit", limit);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String failureReason = rs.getString("failure_reason");
    return new NotificationRecord(
        rs.getObject("notification_id", UUID.class),
        rs.getObject("appointment_id", UUID.class),
        NotificationKind.valueOf(rs.getString("kind")),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        rs.getString("recipient_ref"),
        rs.getString("payload_json_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_attempt_at")),
        toInstant(rs.getTimestamp("sent_at")),
        failureReason == null ? null : FailureReason.valueOf(failureReason),
        rs.getString("last_error"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")));
  }
}
