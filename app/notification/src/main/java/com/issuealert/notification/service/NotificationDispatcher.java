/*
 * どこで: Notification サービス層
 * 何を: ルールに一致したイベントを digest 追記か即時通知へ振り分け、フィードバック通知を参加者へ送る
 * なぜ: 通知 1 件ごとの状態遷移 (RECEIVED -> DIGESTING/IMMEDIATE -> DELIVERED) を 1 箇所で管理するため
 */
package com.issuealert.notification.service;

import com.issuealert.common.event.UserReportPayload;
import com.issuealert.notification.config.NotificationDigestProperties;
import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.AlertRule;
import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.DispatchState;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SubscriptionReason;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationDigestProperties digestProperties;
  private final RecipientResolver recipientResolver;
  private final DigestAccumulator digestAccumulator;
  private final DigestDeliveryScheduler deliveryScheduler;
  private final IssueAlertNotifier issueAlertNotifier;
  private final ParticipantResolver participantResolver;
  private final ProjectMembershipRepository membershipRepository;
  private final NotificationMessageBuilder messageBuilder;
  private final NotificationOutboxService outboxService;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /**
   * ルールに一致したイベントを処理する。
   *
   * @return SKIPPED (送信可能ユーザーなし) / IMMEDIATE (flush を即時登録) / DIGESTING (次の flush 待ち) /
   *     DELIVERED (digest 無効で即時配信済み)
   */
  public DispatchState ruleNotify(
      IssueEvent event,
      List<AlertRule> rules,
      ActionTargetType targetType,
      String targetIdentifier) {
    metrics.recordAdapterCall("rule_notify");
    if (!recipientResolver.shouldNotify(targetType, event.projectId())) {
      logger.info("issue alert skipped, nobody to notify eventId={} groupId={} projectId={}",
          event.eventId(), event.groupId(), event.projectId());
      return DispatchState.SKIPPED;
    }
    if (!digestProperties.enabled()) {
      final int delivered = issueAlertNotifier.notify(event, rules, targetType, targetIdentifier);
      logger.info("issue alert dispatched eventId={} groupId={} delivered={}",
          event.eventId(), event.groupId(), delivered);
      return DispatchState.DELIVERED;
    }
    final DigestKey key = new DigestKey(event.projectId(), targetType, targetIdentifier);
    final boolean immediate =
        digestAccumulator.add(key, new DigestRecord(Instant.now(clock), event, rules));
    if (immediate) {
      deliveryScheduler.schedule(key, Duration.ZERO);
      logger.info("issue alert dispatched eventId={} groupId={} digestKey={}",
          event.eventId(), event.groupId(), key);
      return DispatchState.IMMEDIATE;
    }
    logger.info("issue alert digested eventId={} groupId={} digestKey={}",
        event.eventId(), event.groupId(), key);
    return DispatchState.DIGESTING;
  }

  /** フィードバックを Issue の参加者全員へ送る。参加者がいなければ 0。 */
  public int handleUserReport(IssueGroup group, UserReportPayload report) {
    metrics.recordAdapterCall("handle_user_report");
    final Map<Long, SubscriptionReason> participants = participantResolver.getParticipants(group);
    if (participants.isEmpty()) {
      return 0;
    }
    final Optional<Project> project = membershipRepository.findProject(group.projectId());
    if (project.isEmpty()) {
      return 0;
    }
    int delivered = 0;
    for (Map.Entry<Long, SubscriptionReason> participant : participants.entrySet()) {
      try {
        outboxService.enqueue(
            messageBuilder.buildUserReport(
                project.get(), group, report, participant.getValue(), participant.getKey()));
        delivered++;
      } catch (RuntimeException ex) {
        logger.warn("user report failed for recipient groupId={} userId={}",
            group.groupId(), participant.getKey(), ex);
        metrics.recordRecipientFailure("user_report");
      }
    }
    logger.info("user report dispatched groupId={} reportId={} delivered={}",
        group.groupId(), report.reportId(), delivered);
    return delivered;
  }
}
