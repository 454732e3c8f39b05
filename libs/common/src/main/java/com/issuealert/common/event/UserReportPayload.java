/*
 * どこで: common のイベント payload 定義
 * 何を: ユーザーフィードバック作成シグナルの payload
 * なぜ: フィードバック通知を Issue 参加者へ配信する入力を共通化するため
 */
package com.issuealert.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserReportPayload(
        String reportId,
        long groupId,
        long projectId,
        String name,
        String email,
        String comments) {
}
