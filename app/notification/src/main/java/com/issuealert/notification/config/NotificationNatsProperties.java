/*
 * どこで: Notification アプリの設定バインド
 * 何を: Issue 通知シグナル購読の JetStream 設定(subject/stream/durable/duplicate-window/ack-wait/max-deliver)を保持する
 * なぜ: アラート/フィードバックの subject と再配信制御の窓を環境で調整し、起動時に妥当性を検証するため
 */
package com.issuealert.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats")
@Validated
public record NotificationNatsProperties(
    @NotBlank String alertSubject,
    @NotBlank String userReportSubject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "notification.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "notification.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // ack-wait は再配信猶予なので 0 以下は許容しない。
    return isPositiveDuration(ackWait);
  }

  @AssertTrue(message = "notification.nats.alert-subject and user-report-subject must differ")
  public boolean isSubjectsDistinct() {
    // 同じ subject だと 2 つの durable が同一メッセージを取り合う
    return alertSubject == null || !alertSubject.equals(userReportSubject);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
