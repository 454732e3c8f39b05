/*
 * どこで: Notification digest モデル
 * 何を: digest に積まれる 1 イベント分のレコード (時刻, イベント, 一致ルール)
 * なぜ: flush 時にルール/Issue 単位へ組み直す元データにするため
 */
package com.issuealert.notification.model;

import java.time.Instant;
import java.util.List;

public record DigestRecord(Instant timestamp, IssueEvent event, List<AlertRule> rules) {

  public DigestRecord {
    rules = List.copyOf(rules);
  }

  public String eventId() {
    return event.eventId();
  }

  public long groupId() {
    return event.groupId();
  }
}
