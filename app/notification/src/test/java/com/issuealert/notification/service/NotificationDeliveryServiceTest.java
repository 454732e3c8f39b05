/*
 * どこで: Notification 配信サービスのユニットテスト
 * 何を: バックオフ計算・送信成功・リトライ・失敗確定・ロック喪失の挙動を検証する
 * なぜ: 再送制御と FAILED 確定の分岐を安全に保つため
 */
package com.issuealert.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuealert.notification.config.NotificationDeliveryProperties;
import com.issuealert.notification.model.DeliveryRequest;
import com.issuealert.notification.model.NotificationRecord;
import com.issuealert.notification.model.NotificationStatus;
import com.issuealert.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final String LOCKED_BY = "worker-1";
  private static final NotificationDeliveryProperties PROPERTIES =
      new NotificationDeliveryProperties(
          true,
          Duration.ofSeconds(1),
          50,
          10,
          Duration.ofSeconds(1),
          Duration.ofSeconds(60),
          2.0d,
          Duration.ofSeconds(30));

  @Mock private NotificationRepository notificationRepository;
  @Mock private NotificationSender sender;
  @Mock private NotificationMetrics metrics;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private NotificationDeliveryService service;

  @BeforeEach
  void setUp() {
    service =
        new NotificationDeliveryService(
            notificationRepository,
            sender,
            PROPERTIES,
            metrics,
            objectMapper,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void computeBackoffDurationGrowsExponentiallyUntilCap() {
    assertThat(service.computeBackoffDuration(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(service.computeBackoffDuration(3)).isEqualTo(Duration.ofSeconds(4));
    // 2^6 = 64 秒は上限 60 秒に丸める
    assertThat(service.computeBackoffDuration(7)).isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void processPendingBatchSendsAndMarksSent() throws Exception {
    final NotificationRecord record = notificationRecord(0, payload());
    when(notificationRepository.claimPendingForUpdate(
            eq(50), eq(FIXED_NOW), eq(FIXED_NOW.plusSeconds(30)), anyString()))
        .thenReturn(List.of(record));
    when(notificationRepository.markSent(eq(record.notificationId()), eq(FIXED_NOW), anyString()))
        .thenReturn(1);
    when(notificationRepository.countPending()).thenReturn(3);

    final int claimed = service.processPendingBatch();

    assertThat(claimed).isEqualTo(1);
    final ArgumentCaptor<DeliveryRequest> requestCaptor = ArgumentCaptor.forClass(DeliveryRequest.class);
    verify(sender).send(eq(record.notificationId()), requestCaptor.capture());
    assertThat(requestCaptor.getValue().subject()).isEqualTo("[IssueAlert] WEB-7 - KeyError");
    assertThat(requestCaptor.getValue().headers()).containsEntry("X-IssueAlert-Reply-To", "group-7");
    verify(metrics).recordDeliveryResult("sent");
    verify(metrics).updateBacklogCurrent(3);
  }

  @Test
  void processPendingBatchFailsCorruptPayloadWithoutSending() {
    final NotificationRecord record = notificationRecord(0, "{not json");
    when(notificationRepository.claimPendingForUpdate(anyInt(), any(), any(), anyString()))
        .thenReturn(List.of(record));
    when(notificationRepository.markRetry(
            eq(record.notificationId()), eq(1), isNull(), eq(true), anyString()))
        .thenReturn(1);

    service.processPendingBatch();

    verifyNoInteractions(sender);
    verify(metrics).recordDeliveryResult("failed");
  }

  @Test
  void processPendingBatchSchedulesRetryWhenSenderThrows() throws Exception {
    final NotificationRecord record = notificationRecord(0, payload());
    when(notificationRepository.claimPendingForUpdate(anyInt(), any(), any(), anyString()))
        .thenReturn(List.of(record));
    doThrow(new IllegalStateException("smtp down"))
        .when(sender)
        .send(eq(record.notificationId()), any(DeliveryRequest.class));
    when(notificationRepository.markRetry(
            eq(record.notificationId()), eq(1), eq(FIXED_NOW.plusSeconds(1)), eq(false), anyString()))
        .thenReturn(1);

    service.processPendingBatch();

    verify(notificationRepository, never()).markSent(any(), any(), any());
    verify(metrics).recordDeliveryResult("retry");
  }

  @Test
  void handleFailureSchedulesRetryWithBackoff() {
    final NotificationRecord record = notificationRecord(1, "{}");
    when(notificationRepository.markRetry(
            record.notificationId(), 2, FIXED_NOW.plusSeconds(2), false, LOCKED_BY))
        .thenReturn(1);

    service.handleFailure(record, new IllegalStateException("boom"), FIXED_NOW, LOCKED_BY);

    verify(metrics).recordDeliveryResult("retry");
  }

  @Test
  void handleFailureMarksFailedWhenMaxAttemptsReached() {
    final NotificationRecord record = notificationRecord(PROPERTIES.maxAttempts() - 1, "{}");
    when(notificationRepository.markRetry(
            eq(record.notificationId()), eq(PROPERTIES.maxAttempts()), isNull(), eq(true), eq(LOCKED_BY)))
        .thenReturn(1);

    service.handleFailure(record, new IllegalStateException("boom"), FIXED_NOW, LOCKED_BY);

    verify(metrics).recordDeliveryResult("failed");
    verifyNoInteractions(sender);
  }

  @Test
  void handleFailureSkipsMetricsWhenLockWasLost() {
    final NotificationRecord record = notificationRecord(1, "{}");
    when(notificationRepository.markRetry(any(), anyInt(), any(), eq(false), eq(LOCKED_BY)))
        .thenReturn(0);

    service.handleFailure(record, new IllegalStateException("boom"), FIXED_NOW, LOCKED_BY);

    verify(metrics, never()).recordDeliveryResult(anyString());
  }

  @Test
  void resolveLockedByPrefersHostnameEnvOrFallbacks() {
    final String env = System.getenv("HOSTNAME");

    final String resolved = service.resolveLockedBy();

    if (env != null && !env.isBlank()) {
      assertThat(resolved).isEqualTo(env);
    } else {
      assertThat(resolved).isNotBlank();
    }
  }

  private String payload() throws Exception {
    return objectMapper.writeValueAsString(
        new DeliveryRequest(
            5L,
            "[IssueAlert] WEB-7 - KeyError",
            "issue-alert/error.txt",
            "issue-alert/error.html",
            "notify.error",
            Map.of("environment", "production"),
            Map.of("X-IssueAlert-Reply-To", "group-7"),
            "group",
            7L));
  }

  private NotificationRecord notificationRecord(int attemptCount, String payloadJson) {
    return new NotificationRecord(
        UUID.randomUUID(),
        5L,
        "notify.error",
        "[IssueAlert] WEB-7 - KeyError",
        "group",
        7L,
        payloadJson,
        NotificationStatus.PROCESSING,
        LOCKED_BY,
        FIXED_NOW,
        FIXED_NOW.plus(PROPERTIES.lease()),
        attemptCount,
        null,
        FIXED_NOW,
        null);
  }
}
