/*
 * どこで: Notification API モデル
 * 何を: デバッグ用 outbox 一覧の要素
 * なぜ: 配信要求の送信状態と内容を確認できるようにするため
 */
package com.issuealert.notification.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.issuealert.notification.model.NotificationStatus;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String type,
    String subject,
    String referenceType,
    long referenceId,
    NotificationStatus status,
    int attemptCount,
    Instant createdAt,
    Instant sentAt,
    JsonNode payload) {}
