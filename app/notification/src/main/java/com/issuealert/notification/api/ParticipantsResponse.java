/*
 * どこで: Notification API モデル
 * 何を: Issue 参加者と参加理由のレスポンス
 * なぜ: ワークフロー通知の宛先計算をデバッグ時に確認するため
 */
package com.issuealert.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParticipantsResponse(long groupId, List<Participant> participants) {
  public ParticipantsResponse {
    participants = participants == null ? List.of() : List.copyOf(participants);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Participant(long userId, String reason, String description) {}
}
