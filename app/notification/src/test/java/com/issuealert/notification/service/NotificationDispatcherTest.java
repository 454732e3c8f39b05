/*
 * どこで: NotificationDispatcher のユニットテスト
 * 何を: ルール通知の状態遷移 (SKIPPED/DELIVERED/IMMEDIATE/DIGESTING) とフィードバック配信を検証する
 * なぜ: digest の即時 flush 登録とフィードバックの受信者単位の失敗分離を保証するため
 */
package com.issuealert.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.issuealert.common.event.UserReportPayload;
import com.issuealert.notification.config.NotificationDigestProperties;
import com.issuealert.notification.model.ActionTargetType;
import com.issuealert.notification.model.AlertRule;
import com.issuealert.notification.model.DeliveryRequest;
import com.issuealert.notification.model.DigestKey;
import com.issuealert.notification.model.DigestRecord;
import com.issuealert.notification.model.DispatchState;
import com.issuealert.notification.model.IssueEvent;
import com.issuealert.notification.model.IssueGroup;
import com.issuealert.notification.model.Project;
import com.issuealert.notification.model.SubscriptionReason;
import com.issuealert.notification.repository.ProjectMembershipRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-02-01T12:00:00Z");
  private static final Project PROJECT = new Project(3L, 30L, "web", "Web", false);
  private static final IssueGroup GROUP = new IssueGroup(7L, 3L, "WEB-7", "KeyError", "root", "error");
  private static final IssueEvent EVENT =
      new IssueEvent("evt-1", GROUP, FIXED_NOW, "KeyError: 'id'", "production", Map.of(), List.of(), null);
  private static final List<AlertRule> RULES = List.of(new AlertRule(1L, "New issue"));
  private static final DigestKey OWNERS_KEY = new DigestKey(3L, ActionTargetType.ISSUE_OWNERS, null);

  @Mock private RecipientResolver recipientResolver;
  @Mock private DigestAccumulator digestAccumulator;
  @Mock private DigestDeliveryScheduler deliveryScheduler;
  @Mock private IssueAlertNotifier issueAlertNotifier;
  @Mock private ParticipantResolver participantResolver;
  @Mock private ProjectMembershipRepository membershipRepository;
  @Mock private NotificationMessageBuilder messageBuilder;
  @Mock private NotificationOutboxService outboxService;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Test
  void skipsWhenNobodyCanBeNotified() {
    when(recipientResolver.shouldNotify(ActionTargetType.ISSUE_OWNERS, 3L)).thenReturn(false);

    assertThat(dispatcher(true).ruleNotify(EVENT, RULES, ActionTargetType.ISSUE_OWNERS, null))
        .isEqualTo(DispatchState.SKIPPED);
    verifyNoInteractions(digestAccumulator, issueAlertNotifier);
  }

  @Test
  void deliversDirectlyWhenDigestsAreDisabled() {
    when(recipientResolver.shouldNotify(ActionTargetType.MEMBER, 3L)).thenReturn(true);
    when(issueAlertNotifier.notify(EVENT, RULES, ActionTargetType.MEMBER, "5")).thenReturn(1);

    assertThat(dispatcher(false).ruleNotify(EVENT, RULES, ActionTargetType.MEMBER, "5"))
        .isEqualTo(DispatchState.DELIVERED);
    verifyNoInteractions(digestAccumulator, deliveryScheduler);
  }

  @Test
  void firstRecordSchedulesImmediateFlush() {
    when(recipientResolver.shouldNotify(ActionTargetType.ISSUE_OWNERS, 3L)).thenReturn(true);
    final ArgumentCaptor<DigestRecord> recordCaptor = ArgumentCaptor.forClass(DigestRecord.class);
    when(digestAccumulator.add(eq(OWNERS_KEY), recordCaptor.capture())).thenReturn(true);

    assertThat(dispatcher(true).ruleNotify(EVENT, RULES, ActionTargetType.ISSUE_OWNERS, null))
        .isEqualTo(DispatchState.IMMEDIATE);

    verify(deliveryScheduler).schedule(OWNERS_KEY, Duration.ZERO);
    assertThat(recordCaptor.getValue().timestamp()).isEqualTo(FIXED_NOW);
    assertThat(recordCaptor.getValue().rules()).isEqualTo(RULES);
  }

  @Test
  void laterRecordsWaitForScheduledFlush() {
    when(recipientResolver.shouldNotify(ActionTargetType.ISSUE_OWNERS, 3L)).thenReturn(true);
    when(digestAccumulator.add(eq(OWNERS_KEY), any(DigestRecord.class))).thenReturn(false);

    assertThat(dispatcher(true).ruleNotify(EVENT, RULES, ActionTargetType.ISSUE_OWNERS, null))
        .isEqualTo(DispatchState.DIGESTING);
    verify(deliveryScheduler, never()).schedule(any(), any());
  }

  @Test
  void userReportReachesParticipantsDespiteSingleFailure() {
    final UserReportPayload report =
        new UserReportPayload("r-1", 7L, 3L, "Jane", "jane@example.com", "It broke");
    final Map<Long, SubscriptionReason> participants = new LinkedHashMap<>();
    participants.put(1L, SubscriptionReason.COMMENT);
    participants.put(2L, SubscriptionReason.IMPLICIT);
    when(participantResolver.getParticipants(GROUP)).thenReturn(participants);
    when(membershipRepository.findProject(3L)).thenReturn(Optional.of(PROJECT));
    when(messageBuilder.buildUserReport(PROJECT, GROUP, report, SubscriptionReason.COMMENT, 1L))
        .thenThrow(new IllegalStateException("boom"));
    final DeliveryRequest request =
        new DeliveryRequest(2L, "s", "t", "h", "notify.user-report", Map.of(), Map.of(), "group", 7L);
    when(messageBuilder.buildUserReport(PROJECT, GROUP, report, SubscriptionReason.IMPLICIT, 2L))
        .thenReturn(request);
    when(outboxService.enqueue(request)).thenReturn(UUID.randomUUID());

    assertThat(dispatcher(true).handleUserReport(GROUP, report)).isEqualTo(1);
    assertThat(
            meterRegistry
                .counter(NotificationMetrics.METRIC_RECIPIENT_FAILURES, "path", "user_report")
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void userReportWithoutParticipantsSendsNothing() {
    when(participantResolver.getParticipants(GROUP)).thenReturn(Map.of());

    assertThat(
            dispatcher(true)
                .handleUserReport(GROUP, new UserReportPayload("r-2", 7L, 3L, "Jo", "jo@example.com", "hi")))
        .isZero();
    verifyNoInteractions(outboxService);
  }

  private NotificationDispatcher dispatcher(boolean digestsEnabled) {
    final NotificationDigestProperties properties =
        new NotificationDigestProperties(
            digestsEnabled,
            Duration.ofMinutes(5),
            Duration.ofMinutes(30),
            Duration.ofSeconds(10),
            Duration.ofMinutes(5),
            100);
    return new NotificationDispatcher(
        properties,
        recipientResolver,
        digestAccumulator,
        deliveryScheduler,
        issueAlertNotifier,
        participantResolver,
        membershipRepository,
        messageBuilder,
        outboxService,
        new NotificationMetrics(meterRegistry),
        Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }
}
