/*
 * どこで: Notification ドメインモデル
 * 何を: notifications (配信 outbox) テーブルのスナップショット
 * なぜ: 配信要求の登録・送信ワーカー・デバッグ API で共通化するため
 */
package com.issuealert.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    long userId,
    String type,
    String subject,
    String referenceType,
    long referenceId,
    String payloadJson,
    NotificationStatus status,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    int attemptCount,
    Instant nextRetryAt,
    Instant createdAt,
    Instant sentAt) {}
