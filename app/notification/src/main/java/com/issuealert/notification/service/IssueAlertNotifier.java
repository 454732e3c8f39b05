/*
 * どこで: Notification サービス層
 * 何を: 単一アラート (digest を経由しない/1 Issue だけの digest) を受信者ごとに配信要求へ変換する
 * なぜ: 即時通知と digest の単一 Issue 経路で同じ本文と失敗隔離を使うため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.AlertRule;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SuspectCommit;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IssueAlertNotifier {

  private static final Logger logger = LoggerFactory.getLogger(IssueAlertNotifier.class);

  private final ProjectMembershipRepository membershipRepository;
  private final RecipientResolver recipientResolver;
  private final SuspectCommitLookup suspectCommitLookup;
  private final NotificationMessageBuilder messageBuilder;
  private final NotificationOutboxService outboxService;
  private final NotificationMetrics metrics;

  /**
   * 配信先種別から受信者を解決し、1 人ずつ配信要求を登録する。
   *
   * @return 登録できた配信要求の件数
   */
  public int notify(
      IssueEvent event,
      List<AlertRule> rules,
      ActionTargetType targetType,
      String targetIdentifier) {
    metrics.recordAdapterCall("notify");
    final Optional<Project> project = membershipRepository.findProject(event.projectId());
    if (project.isEmpty()) {
      logger.debug("notify skipped, project missing projectId={}", event.projectId());
      return 0;
    }
    final Set<Long> recipients =
        recipientResolver.resolve(event.projectId(), targetType, targetIdentifier, event);
    logger.info(
        "issue alert notify targetType={} targetIdentifier={} groupId={} projectId={} recipients={}",
        targetType.value(),
        targetIdentifier,
        event.groupId(),
        event.projectId(),
        recipients.size());
    final List<SuspectCommit> commits = suspectCommits(project.get(), event);
    int delivered = 0;
    for (Long userId : recipients) {
      if (notifyRecipient(project.get(), event, rules, commits, userId)) {
        delivered++;
      }
    }
    return delivered;
  }

  /** 受信者 1 人分。失敗はログとメトリクスに残し false を返す。 */
  public boolean notifyRecipient(Project project, IssueEvent event, List<AlertRule> rules, long userId) {
    return notifyRecipient(project, event, rules, suspectCommits(project, event), userId);
  }

  private boolean notifyRecipient(
      Project project,
      IssueEvent event,
      List<AlertRule> rules,
      List<SuspectCommit> commits,
      long userId) {
    try {
      outboxService.enqueue(messageBuilder.buildIssueAlert(project, event, rules, commits, userId));
      logger.info("issue alert queued groupId={} projectId={} userId={}",
          event.groupId(), project.projectId(), userId);
      return true;
    } catch (RuntimeException ex) {
      logger.warn("issue alert failed for recipient groupId={} userId={}",
          event.groupId(), userId, ex);
      metrics.recordRecipientFailure("notify");
      return false;
    }
  }

  // コミット推定は付加情報なので、失敗しても本文から外すだけにする
  private List<SuspectCommit> suspectCommits(Project project, IssueEvent event) {
    try {
      return suspectCommitLookup.findSuspectCommits(project, event);
    } catch (RuntimeException ex) {
      logger.warn("suspect commit lookup failed projectId={} eventId={}",
          project.projectId(), event.eventId(), ex);
      return List.of();
    }
  }
}
