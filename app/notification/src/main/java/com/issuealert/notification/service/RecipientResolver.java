/*
 * どこで: Notification サービス層
 * 何を: アラートの配信先種別 (Issue オーナー/チーム/メンバー) から受信ユーザー集合を求める
 * なぜ: 即時通知と digest 配信で同じ受信者規則を使うため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.config.NotificationMailProperties;
import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.NotificationProvider;
import com.issuealert.notification.model.NotificationScopeType;
import com.issuealert.notification.model.NotificationSettingOption;
import com.issuealert.notification.model.NotificationSettingType;
import com.issuealert.notification.model.Owner;
import com.issuealert.notification.model.OwnerType;
import com.issuealert.notification.model.OwnershipResult;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.repository.NotificationSettingRepository;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import com.issuealert.notification.repository.SendableUserCache;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(RecipientResolver.class);

  private final ProjectMembershipRepository membershipRepository;
  private final NotificationSettingRepository settingRepository;
  private final OwnershipEvaluator ownershipEvaluator;
  private final SendableUserCache sendableUserCache;
  private final NotificationMailProperties mailProperties;
  private final NotificationMetrics metrics;

  /**
   * 受信者を求める。プロジェクトが無い/チームを持たない場合は空集合。
   *
   * @param event Issue オーナー判定に使うイベント。digest 配信時は null
   */
  public Set<Long> resolve(
      long projectId, ActionTargetType targetType, String targetIdentifier, IssueEvent event) {
    final Optional<Project> project = membershipRepository.findProject(projectId);
    if (project.isEmpty() || !membershipRepository.hasTeams(projectId)) {
      logger.debug("recipients skipped, invalid project projectId={}", projectId);
      return Set.of();
    }
    return switch (targetType) {
      case ISSUE_OWNERS -> event == null
          ? sendableUserIds(project.get())
          : ownersOf(project.get(), event);
      case TEAM -> teamMembers(project.get(), targetIdentifier);
      case MEMBER -> member(project.get(), targetIdentifier);
    };
  }

  /** MEMBER 宛ては常に通知し、それ以外は送信可能ユーザーが 1 人以上いる場合だけ通知する。 */
  public boolean shouldNotify(ActionTargetType targetType, long projectId) {
    metrics.recordAdapterCall("should_notify");
    if (targetType == ActionTargetType.MEMBER) {
      return true;
    }
    return membershipRepository
        .findProject(projectId)
        .map(project -> !sendableUserIds(project).isEmpty())
        .orElse(false);
  }

  /** ISSUE_ALERTS のメール設定が NEVER でないプロジェクトメンバー。プロジェクト単位で短時間キャッシュする。 */
  public Set<Long> sendableUserIds(Project project) {
    final Optional<Set<Long>> cached = sendableUserCache.get(project.projectId());
    if (cached.isPresent()) {
      return cached.get();
    }
    final Map<Long, Map<NotificationScopeType, NotificationSettingOption>> settingsByUser =
        issueAlertSettings(project);
    final Set<Long> sendable = new LinkedHashSet<>();
    settingsByUser.forEach(
        (userId, byScope) -> {
          if (NotificationSettingResolver.mostSpecific(byScope) != NotificationSettingOption.NEVER) {
            sendable.add(userId);
          }
        });
    sendableUserCache.put(project.projectId(), sendable, mailProperties.sendableCacheTtl());
    return Collections.unmodifiableSet(sendable);
  }

  /** プロジェクトスコープで ISSUE_ALERTS を NEVER にしたユーザー。 */
  public Set<Long> disabledUserIds(Project project) {
    final Set<Long> disabled = new LinkedHashSet<>();
    issueAlertSettings(project)
        .forEach(
            (userId, byScope) -> {
              if (byScope.get(NotificationScopeType.PROJECT) == NotificationSettingOption.NEVER) {
                disabled.add(userId);
              }
            });
    return disabled;
  }

  private Set<Long> ownersOf(Project project, IssueEvent event) {
    final OwnershipResult result = evaluateOwners(project, event);
    if (result.everyone()) {
      metrics.recordOwnersSendTo("everyone");
      return sendableUserIds(project);
    }
    if (result.owners().isEmpty()) {
      metrics.recordOwnersSendTo("empty");
      return Set.of();
    }
    metrics.recordOwnersSendTo("match");
    final Set<Long> recipients = new LinkedHashSet<>();
    final Set<Long> teamIds = new LinkedHashSet<>();
    for (Owner owner : result.owners()) {
      if (owner.type() == OwnerType.USER) {
        recipients.add(owner.id());
      } else {
        teamIds.add(owner.id());
      }
    }
    recipients.addAll(membershipRepository.findTeamMemberUserIds(teamIds));
    recipients.removeAll(disabledUserIds(project));
    return recipients;
  }

  private OwnershipResult evaluateOwners(Project project, IssueEvent event) {
    try {
      return ownershipEvaluator.getOwners(project.projectId(), event);
    } catch (RuntimeException ex) {
      // ルール評価が使えない場合はオーナー不明としてプロジェクト全体へ送る
      logger.warn("ownership lookup failed projectId={} eventId={}",
          project.projectId(), event.eventId(), ex);
      return OwnershipResult.everyoneResult();
    }
  }

  private Set<Long> teamMembers(Project project, String targetIdentifier) {
    final Optional<Long> teamId = parseIdentifier(targetIdentifier);
    if (teamId.isEmpty() || !membershipRepository.isTeamInProject(teamId.get(), project.projectId())) {
      return Set.of();
    }
    final Set<Long> members =
        new LinkedHashSet<>(membershipRepository.findTeamMemberUserIds(Set.of(teamId.get())));
    members.removeAll(disabledUserIds(project));
    return members;
  }

  // 明示指定されたメンバーには個人の無効化設定を適用しない
  private Set<Long> member(Project project, String targetIdentifier) {
    return parseIdentifier(targetIdentifier)
        .flatMap(userId -> membershipRepository.findMemberInProject(userId, project.projectId()))
        .map(Set::of)
        .orElse(Set.of());
  }

  private Map<Long, Map<NotificationScopeType, NotificationSettingOption>> issueAlertSettings(
      Project project) {
    final Set<Long> members = membershipRepository.findMemberUserIds(project.projectId());
    if (members.isEmpty()) {
      return Map.of();
    }
    return NotificationSettingResolver.byUser(
        settingRepository.findForUsersByParent(
            NotificationProvider.EMAIL, NotificationSettingType.ISSUE_ALERTS, project, members),
        members);
  }

  private Optional<Long> parseIdentifier(String targetIdentifier) {
    if (targetIdentifier == null || targetIdentifier.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(targetIdentifier.trim()));
    } catch (NumberFormatException ex) {
      logger.debug("invalid target identifier ignored value={}", targetIdentifier);
      return Optional.empty();
    }
  }
}
