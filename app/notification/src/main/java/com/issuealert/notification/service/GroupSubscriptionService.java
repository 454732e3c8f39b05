/*
 * どこで: Notification サービス層
 * 何を: Issue 購読の冪等登録 (単体/一括/アクター経由) を行う
 * なぜ: 並行するイベント取り込みから同じ購読が重複作成されても 1 行に収束させるため
 */
package com.issuealert.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.issuealert.notification.model.Actor;
import com.issuealert.notification.model.GroupSubscription;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.SubscriptionReason;
import com.issuealert.notification.model.TeamActor;
import com.issuealert.notification.model.UserActor;
import com.issuealert.notification.repository.GroupSubscriptionRepository;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class GroupSubscriptionService {

  private static final Logger logger = LoggerFactory.getLogger(GroupSubscriptionService.class);

  @VisibleForTesting static final int BULK_SUBSCRIBE_ATTEMPTS = 5;

  private final GroupSubscriptionRepository subscriptionRepository;
  private final ProjectMembershipRepository membershipRepository;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  public void subscribe(IssueGroup group, long userId) {
    subscribe(group, userId, SubscriptionReason.UNKNOWN);
  }

  /** 既に購読済みなら何もしない。 */
  public void subscribe(IssueGroup group, long userId, SubscriptionReason reason) {
    requirePersisted(reason);
    try {
      subscriptionRepository.insert(toRow(group, userId, reason, Instant.now(clock)));
    } catch (DuplicateKeyException ex) {
      logger.debug("subscription already exists groupId={} userId={}", group.groupId(), userId);
    }
  }

  public void bulkSubscribe(IssueGroup group, Collection<Long> userIds) {
    bulkSubscribe(group, userIds, SubscriptionReason.UNKNOWN);
  }

  /**
   * 未購読のユーザーだけを一括登録する。
   *
   * <p>一意制約違反のたびに既存行を再取得して挿入対象を絞り込み、最大 {@value #BULK_SUBSCRIBE_ATTEMPTS}
   * 回まで試す。最後の試行の DuplicateKeyException はそのまま送出する。
   */
  public void bulkSubscribe(IssueGroup group, Collection<Long> userIds, SubscriptionReason reason) {
    requirePersisted(reason);
    final Set<Long> pending = new LinkedHashSet<>(userIds);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    for (int attempt = 1; ; attempt++) {
      pending.removeAll(subscriptionRepository.findSubscribedUserIds(group.groupId(), pending));
      if (pending.isEmpty()) {
        return;
      }
      final Instant now = Instant.now(clock);
      final List<GroupSubscription> rows =
          pending.stream().map(userId -> toRow(group, userId, reason, now)).toList();
      try {
        // 一括挿入は 1 トランザクションにまとめ、衝突時に部分登録を残さない
        transactionTemplate.executeWithoutResult(status -> subscriptionRepository.insertAll(rows));
        return;
      } catch (DuplicateKeyException ex) {
        if (attempt >= BULK_SUBSCRIBE_ATTEMPTS) {
          logger.warn(
              "bulk subscribe gave up groupId={} attempts={} pending={}",
              group.groupId(),
              attempt,
              pending.size());
          throw ex;
        }
        logger.info(
            "bulk subscribe conflict, retrying groupId={} attempt={} pending={}",
            group.groupId(),
            attempt,
            pending.size());
      }
    }
  }

  /** ユーザーは単体購読、チームはメンバー全員の一括購読に展開する。 */
  public void subscribeActor(IssueGroup group, Actor actor, SubscriptionReason reason) {
    if (actor instanceof UserActor user) {
      subscribe(group, user.id(), reason);
      return;
    }
    if (actor instanceof TeamActor team) {
      bulkSubscribe(group, membershipRepository.findTeamMemberUserIds(List.of(team.id())), reason);
      return;
    }
    throw new UnsupportedActorException(actor);
  }

  private void requirePersisted(SubscriptionReason reason) {
    if (!reason.persisted()) {
      throw new IllegalArgumentException("synthetic subscription reason cannot be stored: " + reason);
    }
  }

  private GroupSubscription toRow(
      IssueGroup group, long userId, SubscriptionReason reason, Instant createdAt) {
    return new GroupSubscription(group.projectId(), group.groupId(), userId, true, reason, createdAt);
  }
}
