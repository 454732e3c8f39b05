/*
 * どこで: Notification ドメインモデル
 * 何を: notification_settings テーブルの 1 行 (読み取り専用)
 * なぜ: ユーザーごとの通知可否判定の入力にするため
 */
package com.issuealert.notification.model;

public record NotificationSetting(
    long userId,
    NotificationProvider provider,
    NotificationSettingType type,
    NotificationScopeType scopeType,
    long scopeIdentifier,
    NotificationSettingOption value) {}
