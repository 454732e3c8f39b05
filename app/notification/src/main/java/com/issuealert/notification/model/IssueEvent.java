/*
 * どこで: Notification ドメインモデル
 * 何を: アラート対象イベントの通知に必要な部分だけを保持する
 * なぜ: ownership 判定・メッセージ生成・digest レコードで共有するため
 */
package com.issuealert.notification.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record IssueEvent(
    String eventId,
    IssueGroup group,
    Instant occurredAt,
    String title,
    String environment,
    Map<String, String> tags,
    List<String> stackPaths,
    String url) {

  public IssueEvent {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    stackPaths = stackPaths == null ? List.of() : List.copyOf(stackPaths);
  }

  public long groupId() {
    return group.groupId();
  }

  public long projectId() {
    return group.projectId();
  }
}
