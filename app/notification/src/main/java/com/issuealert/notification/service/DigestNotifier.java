/*
 * どこで: Notification サービス層
 * 何を: digest key を drain し、受信者ごとに単一アラートまたはまとめ通知の配信要求を登録する
 * なぜ: スケジューラから起動される flush の処理を 1 箇所にまとめるため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.Digest;
import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestMetadata;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.PersonalizedDigest;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DigestNotifier {

  private static final Logger logger = LoggerFactory.getLogger(DigestNotifier.class);

  private final DigestAccumulator digestAccumulator;
  private final DigestPersonalizer digestPersonalizer;
  private final ProjectMembershipRepository membershipRepository;
  private final RecipientResolver recipientResolver;
  private final IssueAlertNotifier issueAlertNotifier;
  private final NotificationMessageBuilder messageBuilder;
  private final NotificationOutboxService outboxService;
  private final NotificationMetrics metrics;

  /**
   * key のバッファを drain して配信する。バッファが空なら何もしない。
   *
   * <p>受信者を確定する前に失敗した場合は drain したレコードをバッファへ戻してから例外を投げ直す。
   */
  public int deliverDigest(DigestKey key) {
    final List<DigestRecord> records = digestAccumulator.drainRecords(key);
    if (records.isEmpty()) {
      logger.debug("digest flush skipped, buffer empty key={}", key);
      return 0;
    }
    final Optional<Audience> audience;
    try {
      audience = resolveAudience(key.projectId(), key.targetType(), key.targetIdentifier());
    } catch (RuntimeException ex) {
      restore(key, records, ex);
      throw ex;
    }
    return audience
        .map(resolved -> deliverAll(resolved, Digest.build(records), key.targetType()))
        .orElse(0);
  }

  /**
   * 受信者ごとに personalize した digest を配信する。
   *
   * <p>1 Issue だけの digest はその Issue の最新レコードで単一アラートとして、その受信者にだけ送る。
   */
  public int notifyDigest(
      long projectId, Digest digest, ActionTargetType targetType, String targetIdentifier) {
    return resolveAudience(projectId, targetType, targetIdentifier)
        .map(audience -> deliverAll(audience, digest, targetType))
        .orElse(0);
  }

  private Optional<Audience> resolveAudience(
      long projectId, ActionTargetType targetType, String targetIdentifier) {
    metrics.recordAdapterCall("notify_digest");
    final Optional<Project> project = membershipRepository.findProject(projectId);
    if (project.isEmpty()) {
      logger.debug("digest skipped, project missing projectId={}", projectId);
      return Optional.empty();
    }
    final Set<Long> userIds = recipientResolver.resolve(projectId, targetType, targetIdentifier, null);
    logger.info(
        "digest notify projectId={} targetType={} targetIdentifier={} userIds={}",
        projectId,
        targetType.value(),
        targetIdentifier,
        userIds);
    return Optional.of(new Audience(project.get(), userIds));
  }

  private int deliverAll(Audience audience, Digest digest, ActionTargetType targetType) {
    int delivered = 0;
    final Iterator<PersonalizedDigest> personalized =
        digestPersonalizer
            .personalize(targetType, audience.project().projectId(), digest, audience.userIds())
            .iterator();
    while (personalized.hasNext()) {
      if (deliverTo(audience.project(), personalized.next())) {
        delivered++;
      }
    }
    return delivered;
  }

  private void restore(DigestKey key, List<DigestRecord> records, RuntimeException cause) {
    try {
      digestAccumulator.restore(key, records);
    } catch (RuntimeException ex) {
      cause.addSuppressed(ex);
      logger.error("digest records lost, restore failed key={} records={}", key, records.size(), ex);
    }
  }

  private boolean deliverTo(Project project, PersonalizedDigest personalized) {
    final long userId = personalized.userId();
    try {
      final DigestMetadata metadata = digestPersonalizer.getDigestMetadata(personalized.digest());
      if (metadata.singleGroup()) {
        final DigestRecord record =
            personalized
                .digest()
                .mostRecentRecord(metadata.firstGroupId())
                .orElseThrow(() -> new IllegalStateException("digest group without records"));
        return issueAlertNotifier.notifyRecipient(project, record.event(), record.rules(), userId);
      }
      outboxService.enqueue(
          messageBuilder.buildDigest(project, personalized.digest(), metadata, userId));
      logger.info("digest queued projectId={} userId={} groups={}",
          project.projectId(), userId, metadata.counts().size());
      return true;
    } catch (RuntimeException ex) {
      logger.warn("digest failed for recipient projectId={} userId={}",
          project.projectId(), userId, ex);
      metrics.recordRecipientFailure("notify_digest");
      return false;
    }
  }

  private record Audience(Project project, Set<Long> userIds) {}
}
