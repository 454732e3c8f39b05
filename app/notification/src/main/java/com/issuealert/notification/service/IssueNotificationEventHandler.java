/*
 * どこで: Notification サービス層
 * 何を: NATS で受けたアラート/フィードバックシグナルをドメイン型に変換しディスパッチャへ渡す
 * なぜ: payload の検証と恒久的失敗の判定を購読処理から分離するため
 */
package com.issuealert.notification.service;

import com.issuealert.common.event.IssueAlertEventPayload;
import com.issuealert.common.event.UserReportPayload;
import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.AlertRule;
import com.issuealert.notification.model.DispatchState;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.repository.EventProcessingStore;
import com.issuealert.notification.repository.IssueGroupRepository;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IssueNotificationEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(IssueNotificationEventHandler.class);

  private final IssueGroupRepository issueGroupRepository;
  private final EventProcessingStore eventProcessingStore;
  private final NotificationDispatcher dispatcher;

  public DispatchState handleIssueAlert(IssueAlertEventPayload payload) {
    final IssueGroup group = findGroup(payload.groupId(), payload.projectId());
    final ActionTargetType targetType = parseTargetType(payload.targetType());
    if (payload.eventId() == null || payload.eventId().isBlank()) {
      throw new NotificationEventPermanentException("issue alert without event_id");
    }
    final IssueEvent event =
        new IssueEvent(
            payload.eventId(),
            group,
            parseOccurredAt(payload.occurredAt()),
            payload.title(),
            payload.environment(),
            payload.tags(),
            payload.stackPaths(),
            payload.url());
    final List<AlertRule> rules =
        payload.rules() == null
            ? List.of()
            : payload.rules().stream()
                .map(rule -> new AlertRule(rule.ruleId(), rule.label()))
                .toList();
    // 処理中は未処理版として保持し、完了後に処理済み版へ置き換える
    final String key = eventProcessingStore.store(event, true);
    final DispatchState state =
        dispatcher.ruleNotify(event, rules, targetType, payload.targetIdentifier());
    markProcessed(key, event);
    return state;
  }

  private void markProcessed(String key, IssueEvent event) {
    try {
      eventProcessingStore.deleteByKey(key);
      eventProcessingStore.store(event);
    } catch (RuntimeException ex) {
      // dispatch 済みのイベントは保存失敗でも再配信させない
      logger.warn("event store update failed after dispatch key={}", key, ex);
    }
  }

  public int handleUserReport(UserReportPayload payload) {
    final IssueGroup group = findGroup(payload.groupId(), payload.projectId());
    return dispatcher.handleUserReport(group, payload);
  }

  private IssueGroup findGroup(long groupId, long projectId) {
    final IssueGroup group =
        issueGroupRepository
            .findById(groupId)
            // group が無いシグナルは再配信しても回復しないため恒久的に扱う
            .orElseThrow(
                () -> new NotificationEventPermanentException("unknown group_id=" + groupId));
    if (group.projectId() != projectId) {
      throw new NotificationEventPermanentException(
          "group_id=" + groupId + " does not belong to project_id=" + projectId);
    }
    return group;
  }

  private ActionTargetType parseTargetType(String value) {
    try {
      return ActionTargetType.fromValue(value);
    } catch (IllegalArgumentException ex) {
      throw new NotificationEventPermanentException("invalid target_type=" + value, ex);
    }
  }

  private Instant parseOccurredAt(String value) {
    try {
      return Instant.parse(value);
    } catch (RuntimeException ex) {
      // occurred_at 不正は再配信しても回復しないため恒久的に扱う
      throw new NotificationEventPermanentException("invalid occurred_at", ex);
    }
  }
}
