/*
 * どこで: Notification サービス層
 * 何を: digest を受信者ごとに閲覧可能な内容へ絞り込み、要約メタデータを求める
 * なぜ: Issue オーナー宛て digest で各ユーザーが自分の担当イベントだけを受け取るため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.Digest;
import com.issuealert.notification.model.DigestMetadata;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.PersonalizedDigest;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DigestPersonalizer {

  private static final Logger logger = LoggerFactory.getLogger(DigestPersonalizer.class);

  private final RecipientResolver recipientResolver;
  private final NotificationMetrics metrics;

  /**
   * 受信者ごとの digest を遅延評価で返す。内容が空になったユーザーは含めない。
   *
   * <p>Issue オーナー宛てはイベント単位のオーナー解決で絞り込み、チーム/メンバー宛ては全内容を渡す。
   * 1 ユーザーの絞り込み失敗はそのユーザーだけを除外する。
   */
  public Stream<PersonalizedDigest> personalize(
      ActionTargetType targetType, long projectId, Digest digest, Collection<Long> userIds) {
    if (digest.isEmpty() || userIds.isEmpty()) {
      return Stream.empty();
    }
    final Map<String, Set<Long>> recipientsByEvent = new HashMap<>();
    return userIds.stream()
        .map(userId -> personalizeFor(targetType, projectId, digest, userId, recipientsByEvent))
        .flatMap(Optional::stream);
  }

  public DigestMetadata getDigestMetadata(Digest digest) {
    return DigestMetadata.of(digest);
  }

  private Optional<PersonalizedDigest> personalizeFor(
      ActionTargetType targetType,
      long projectId,
      Digest digest,
      long userId,
      Map<String, Set<Long>> recipientsByEvent) {
    try {
      final Digest view =
          targetType == ActionTargetType.ISSUE_OWNERS
              ? digest.filter(
                  record ->
                      recipientsByEvent
                          .computeIfAbsent(
                              record.eventId(), ignored -> ownersOf(projectId, record))
                          .contains(userId))
              : digest;
      return view.isEmpty() ? Optional.empty() : Optional.of(new PersonalizedDigest(userId, view));
    } catch (RuntimeException ex) {
      logger.warn("digest personalization failed projectId={} userId={}", projectId, userId, ex);
      metrics.recordRecipientFailure("personalize");
      return Optional.empty();
    }
  }

  private Set<Long> ownersOf(long projectId, DigestRecord record) {
    return recipientResolver.resolve(
        projectId, ActionTargetType.ISSUE_OWNERS, null, record.event());
  }
}
