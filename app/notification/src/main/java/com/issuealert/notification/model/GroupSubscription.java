/*
 * どこで: Notification ドメインモデル
 * 何を: group_subscriptions テーブルのスナップショット
 * なぜ: 購読ストアと参加者計算で同じ形を使うため
 */
package com.issuealert.notification.model;

import java.time.Instant;

public record GroupSubscription(
    long projectId,
    long groupId,
    long userId,
    boolean active,
    SubscriptionReason reason,
    Instant createdAt) {}
