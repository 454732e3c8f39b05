/*
 * どこで: Notification データアクセス
 * 何を: 配信 outbox (notifications) の登録/取得/claim/状態更新を担う
 * なぜ: 受信者ごとの配信要求を送信ワーカーとデバッグ API に引き渡すため
 */
package com.issuealert.notification.repository;

import static com.issuealert.common.JdbcTimestampUtils.toInstant;
import static com.issuealert.common.JdbcTimestampUtils.toTimestamp;

import com.issuealert.notification.model.NotificationRecord;
import com.issuealert.notification.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, user_id, type, subject, reference_type, reference_id,
      payload_json::text AS payload_json_text, status, locked_by, locked_at, lease_until,
      attempt_count, next_retry_at, created_at, sent_at
      """;

  private static final String RELEASE_LOCK =
      "locked_by = NULL, locked_at = NULL, lease_until = NULL ";

  // lease を失ったワーカーの更新は 0 件になる
  private static final String OWNED_BY_CALLER =
      "WHERE notification_id = :notificationId AND status = 'PROCESSING' AND locked_by = :lockedBy";

  private static final RowMapper<NotificationRecord> ROW_MAPPER =
      (rs, rowNum) -> mapRow(rs);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id, user_id, type, subject, reference_type, reference_id, payload_json,
          status, attempt_count, next_retry_at, created_at
        ) VALUES (
          :notificationId, :userId, :type, :subject, :referenceType, :referenceId, :payloadJson::jsonb,
          :status, :attemptCount, :nextRetryAt, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("type", record.type())
            .addValue("subject", record.subject())
            .addValue("referenceType", record.referenceType())
            .addValue("referenceId", record.referenceId())
            .addValue("payloadJson", record.payloadJson())
            .addValue("status", record.status().name())
            .addValue("attemptCount", record.attemptCount())
            .addValue("nextRetryAt", toTimestamp(record.nextRetryAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public List<NotificationRecord> findByUserId(long userId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM notifications WHERE user_id = :userId ORDER BY created_at DESC";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("userId", userId), ROW_MAPPER);
  }

  /**
   * 送信対象を最大 limit 件 claim して PROCESSING にする。
   *
   * <p>PENDING (再送時刻到来済み) に加え、lease が切れた PROCESSING も対象にする。
   */
  public List<NotificationRecord> claimPendingForUpdate(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        WHERE notification_id IN (
          SELECT notification_id
          FROM notifications
          WHERE (status = 'PENDING' AND coalesce(next_retry_at, :now) <= :now)
             OR (status = 'PROCESSING' AND coalesce(lease_until, :now) <= :now)
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, ROW_MAPPER);
  }

  /** @return 0 なら lease 切れで他ワーカーに claim し直されている */
  public int markSent(UUID notificationId, Instant sentAt, String lockedBy) {
    final String sql =
        "UPDATE notifications SET status = 'SENT', sent_at = :sentAt, next_retry_at = NULL, "
            + RELEASE_LOCK
            + OWNED_BY_CALLER;
    return jdbcTemplate.update(
        sql, ownedBy(notificationId, lockedBy).addValue("sentAt", toTimestamp(sentAt)));
  }

  /** failed=true なら FAILED で確定し、それ以外は nextRetryAt で PENDING に戻す。 */
  public int markRetry(
      UUID notificationId, int attemptCount, Instant nextRetryAt, boolean failed, String lockedBy) {
    final String sql =
        "UPDATE notifications SET status = :status, attempt_count = :attemptCount,"
            + " next_retry_at = :nextRetryAt, "
            + RELEASE_LOCK
            + OWNED_BY_CALLER;
    final NotificationStatus status = failed ? NotificationStatus.FAILED : NotificationStatus.PENDING;
    return jdbcTemplate.update(
        sql,
        ownedBy(notificationId, lockedBy)
            .addValue("status", status.name())
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", failed ? null : toTimestamp(nextRetryAt)));
  }

  public int countPending() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM notifications WHERE status IN ('PENDING', 'PROCESSING')",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private static MapSqlParameterSource ownedBy(UUID notificationId, String lockedBy) {
    return new MapSqlParameterSource()
        .addValue("notificationId", notificationId)
        .addValue("lockedBy", lockedBy);
  }

  private static NotificationRecord mapRow(ResultSet rs) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getLong("user_id"),
        rs.getString("type"),
        rs.getString("subject"),
        rs.getString("reference_type"),
        rs.getLong("reference_id"),
        rs.getString("payload_json_text"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("next_retry_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
