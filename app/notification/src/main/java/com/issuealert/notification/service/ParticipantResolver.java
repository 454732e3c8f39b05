/*
 * どこで: Notification サービス層
 * 何を: Issue の参加者 (ユーザー -> 参加理由) を購読と WORKFLOW 設定から求める
 * なぜ: フィードバック等のワークフロー通知を受け取るべきユーザーを決めるため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.GroupSubscription;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.NotificationProvider;
import com.issuealert.notification.model.NotificationScopeType;
import com.issuealert.notification.model.NotificationSetting;
import com.issuealert.notification.model.NotificationSettingOption;
import com.issuealert.notification.model.NotificationSettingType;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SubscriptionReason;
import com.issuealert.notification.repository.GroupSubscriptionRepository;
import com.issuealert.notification.repository.NotificationSettingRepository;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ParticipantResolver {

  private static final Logger logger = LoggerFactory.getLogger(ParticipantResolver.class);

  private final ProjectMembershipRepository membershipRepository;
  private final GroupSubscriptionRepository subscriptionRepository;
  private final NotificationSettingRepository settingRepository;

  public Map<Long, SubscriptionReason> getParticipants(IssueGroup group) {
    final Optional<Project> project = membershipRepository.findProject(group.projectId());
    if (project.isEmpty()) {
      logger.debug("participants skipped, project missing groupId={} projectId={}",
          group.groupId(), group.projectId());
      return Map.of();
    }
    final Set<Long> members = membershipRepository.findMemberUserIds(group.projectId());
    if (members.isEmpty()) {
      return Map.of();
    }
    final List<NotificationSetting> settings =
        settingRepository.findForUsersByParent(
            NotificationProvider.EMAIL, NotificationSettingType.WORKFLOW, project.get(), members);
    final Map<Long, Map<NotificationScopeType, NotificationSettingOption>> settingsByUser =
        NotificationSettingResolver.byUser(settings, members);
    final Map<Long, GroupSubscription> subscriptions =
        subscriptionRepository.findByGroupAndUsers(group.groupId(), members).stream()
            .collect(Collectors.toMap(GroupSubscription::userId, Function.identity()));

    final Map<Long, SubscriptionReason> participants = new LinkedHashMap<>();
    for (Long userId : members) {
      final GroupSubscription subscription = subscriptions.get(userId);
      final NotificationSettingOption value =
          NotificationSettingResolver.mostSpecific(settingsByUser.get(userId));
      if (!NotificationSettingResolver.shouldBeParticipating(subscription, value)) {
        continue;
      }
      participants.put(
          userId, subscription != null ? subscription.reason() : SubscriptionReason.IMPLICIT);
    }
    return Collections.unmodifiableMap(participants);
  }
}
