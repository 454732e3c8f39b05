/*
 * どこで: common のイベント payload 定義
 * 何を: ルールに一致したイベントのアラート通知 payload を共通レコードとして提供する
 * なぜ: イベント処理側と通知サービスで同一のペイロード形状を共有するため
 */
package com.issuealert.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueAlertEventPayload(
        String eventId,
        long groupId,
        long projectId,
        String occurredAt,
        String title,
        String environment,
        Map<String, String> tags,
        List<String> stackPaths,
        String url,
        List<MatchedRule> rules,
        String targetType,
        String targetIdentifier) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MatchedRule(long ruleId, String label) {
    }
}
