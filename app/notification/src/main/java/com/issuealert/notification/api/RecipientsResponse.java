/*
 * どこで: Notification API モデル
 * 何を: アラート配信先の解決結果
 * なぜ: target 種別ごとの宛先計算をデバッグ時に確認するため
 */
package com.issuealert.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipientsResponse(
    long projectId,
    String targetType,
    String targetIdentifier,
    boolean shouldNotify,
    List<Long> userIds) {
  public RecipientsResponse {
    userIds = userIds == null ? List.of() : List.copyOf(userIds);
  }
}
