/*
 * どこで: Notification API モデル
 * 何を: ユーザ宛て配信要求一覧のレスポンス
 * なぜ: API レスポンスの構造を固定するため
 */
package com.issuealert.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(long userId, List<NotificationSummary> notifications) {
  public NotificationInboxResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを不変コピーにする
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
