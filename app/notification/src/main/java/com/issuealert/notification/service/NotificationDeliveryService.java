/*
 * どこで: Notification サービス層
 * 何を: PENDING の配信要求を送信し、成功/リトライ/失敗確定を記録する
 * なぜ: 一時的な送信失敗をバックオフ付きで再送し、上限到達時に運用から見える状態で止めるため
 */
package com.issuealert.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.issuealert.notification.config.NotificationDeliveryProperties;
import com.issuealert.notification.model.DeliveryRequest;
import com.issuealert.notification.model.NotificationRecord;
import com.issuealert.notification.repository.NotificationRepository;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
    private static final String HOSTNAME_ENV = "HOSTNAME";
    private static final String DEFAULT_HOSTNAME = "unknown-host";

    private final NotificationRepository notificationRepository;
    private final NotificationSender sender;
    private final NotificationDeliveryProperties properties;
    private final NotificationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** @return claim した件数 */
    public int processPendingBatch() {
        Instant now = Instant.now(clock);
        String lockedBy = resolveLockedBy();
        Instant leaseUntil = now.plus(properties.lease());
        // claim を単一 SQL で行い、送信 IO を長期トランザクションに載せない
        List<NotificationRecord> pending = notificationRepository.claimPendingForUpdate(
                properties.batchSize(),
                now,
                leaseUntil,
                lockedBy);
        for (NotificationRecord record : pending) {
            DeliveryRequest request;
            try {
                request = objectMapper.readValue(record.payloadJson(), DeliveryRequest.class);
            } catch (JsonProcessingException ex) {
                // payload 破損は再送で回復しないため即座に FAILED にする
                markFailed(record, record.attemptCount() + 1, lockedBy, ex);
                continue;
            }
            try {
                sender.send(record.notificationId(), request);
                int updated = notificationRepository.markSent(record.notificationId(), now, lockedBy);
                if (updated == 0) {
                    logger.warn("notification sent but lock was lost id={} userId={}",
                            record.notificationId(),
                            record.userId());
                }
                metrics.recordDeliveryResult("sent");
            } catch (RuntimeException ex) {
                handleFailure(record, ex, now, lockedBy);
            }
        }
        metrics.updateBacklogCurrent(notificationRepository.countPending());
        return pending.size();
    }

    @VisibleForTesting
    void handleFailure(NotificationRecord record, RuntimeException ex, Instant now, String lockedBy) {
        int nextAttempt = record.attemptCount() + 1;
        if (nextAttempt >= properties.maxAttempts()) {
            markFailed(record, nextAttempt, lockedBy, ex);
            return;
        }
        Instant nextRetryAt = now.plus(computeBackoffDuration(nextAttempt));
        int updated = notificationRepository.markRetry(record.notificationId(), nextAttempt, nextRetryAt, false,
                lockedBy);
        if (updated == 0) {
            logger.warn("notification retry skipped because lock was lost id={} attempt={}",
                    record.notificationId(),
                    nextAttempt);
            return;
        }
        metrics.recordDeliveryResult("retry");
        logger.warn("notification retry scheduled id={} attempt={} nextRetryAt={}",
                record.notificationId(), nextAttempt, nextRetryAt, ex);
    }

    private void markFailed(NotificationRecord record, int attempt, String lockedBy, Exception ex) {
        int updated = notificationRepository.markRetry(record.notificationId(), attempt, null, true, lockedBy);
        if (updated == 0) {
            logger.warn("notification failure skipped because lock was lost id={}", record.notificationId());
            return;
        }
        metrics.recordDeliveryResult("failed");
        logger.warn("notification marked FAILED id={} userId={} attempt={}",
                record.notificationId(), record.userId(), attempt, ex);
    }

    @VisibleForTesting
    Duration computeBackoffDuration(int attempt) {
        double baseMillis = properties.backoffBase().toMillis();
        double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
        long capped = (long) Math.ceil(Math.min(exp, properties.backoffMax().toMillis()));
        return Duration.ofMillis(capped);
    }

    @VisibleForTesting
    String resolveLockedBy() {
        String env = System.getenv(HOSTNAME_ENV);
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException ex) {
            logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
            return DEFAULT_HOSTNAME;
        }
    }
}
