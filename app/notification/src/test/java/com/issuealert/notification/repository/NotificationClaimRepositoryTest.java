/*
 * どこで: Notification テスト
 * 何を: Postgres での outbox claim/lease と状態遷移を検証する
 * なぜ: UPDATE ... RETURNING + SKIP LOCKED の方言差異を統合テストで検証するため
 */
package com.issuealert.notification.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.issuealert.notification.AbstractPostgresContainerTest;
import com.issuealert.notification.config.NotificationDeliveryProperties;
import com.issuealert.notification.model.NotificationRecord;
import com.issuealert.notification.model.NotificationStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationClaimRepositoryTest extends AbstractPostgresContainerTest {

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private NotificationDeliveryProperties properties;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    }

    @Test
    void claimMovesPendingToProcessingWithLock() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        notificationRepository.insert(pending(7L, now));

        Instant leaseUntil = now.plus(properties.lease());
        List<NotificationRecord> claimed = notificationRepository.claimPendingForUpdate(
                properties.batchSize(),
                now,
                leaseUntil,
                "test-host");

        assertThat(claimed).hasSize(1);
        NotificationRecord claimedRecord = claimed.get(0);
        assertThat(claimedRecord.status()).isEqualTo(NotificationStatus.PROCESSING);
        assertThat(claimedRecord.lockedBy()).isEqualTo("test-host");
        assertThat(claimedRecord.payloadJson()).contains("notify.error");
        assertInstantCloseToMicros(leaseUntil, claimedRecord.leaseUntil());
    }

    @Test
    void claimSkipsRecordsWaitingForRetry() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        NotificationRecord record = pending(8L, now);
        notificationRepository.insert(new NotificationRecord(
                record.notificationId(), record.userId(), record.type(), record.subject(),
                record.referenceType(), record.referenceId(), record.payloadJson(),
                NotificationStatus.PENDING, null, null, null, 1, now.plusSeconds(60), now, null));

        List<NotificationRecord> claimed = notificationRepository.claimPendingForUpdate(
                properties.batchSize(), now, now.plus(properties.lease()), "test-host");

        assertThat(claimed).isEmpty();
        assertThat(notificationRepository.countPending()).isEqualTo(1);
    }

    @Test
    void markSentAndMarkRetryRequireOwnLock() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        UUID first = notificationRepository.insert(pending(9L, now));
        UUID second = notificationRepository.insert(pending(9L, now.plusMillis(1)));
        notificationRepository.claimPendingForUpdate(10, now.plusSeconds(1), now.plusSeconds(31), "worker-a");

        // 他ワーカーのロックでは更新されない
        assertThat(notificationRepository.markSent(first, now, "worker-b")).isZero();
        assertThat(notificationRepository.markSent(first, now, "worker-a")).isEqualTo(1);
        assertThat(notificationRepository.markRetry(second, 10, null, true, "worker-a")).isEqualTo(1);

        List<NotificationRecord> inbox = notificationRepository.findByUserId(9L);
        assertThat(inbox).extracting(NotificationRecord::status)
                .containsExactlyInAnyOrder(NotificationStatus.SENT, NotificationStatus.FAILED);
        assertThat(notificationRepository.countPending()).isZero();
    }

    private NotificationRecord pending(long userId, Instant now) {
        return new NotificationRecord(
                UUID.randomUUID(),
                userId,
                "notify.error",
                "[IssueAlert] WEB-1 - boom",
                "group",
                1L,
                "{\"type\":\"notify.error\"}",
                NotificationStatus.PENDING,
                null,
                null,
                null,
                0,
                now,
                now,
                null);
    }

    private void assertInstantCloseToMicros(Instant expected, Instant actual) {
        Duration delta = Duration.between(expected, actual).abs();
        assertThat(delta).isLessThanOrEqualTo(ChronoUnit.MICROS.getDuration());
    }
}
