/*
 * どこで: Notification ドメインモデル
 * 何を: issue_groups テーブルのスナップショット
 * なぜ: 件名・ヘッダ生成と digest の集約キーに使うため
 */
package com.issuealert.notification.model;

public record IssueGroup(
    long groupId,
    long projectId,
    String qualifiedShortId,
    String title,
    String logger,
    String level) {}
