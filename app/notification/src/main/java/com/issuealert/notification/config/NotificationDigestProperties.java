/*
 * どこで: Notification アプリの設定バインド
 * 何を: digest の有効化・既定遅延・スケジュールワーカー設定を保持する
 * なぜ: プロジェクト option が無い場合の既定値を環境ごとに調整するため
 */
package com.issuealert.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.digest")
@Validated
public record NotificationDigestProperties(
    boolean enabled,
    @NotNull Duration defaultIncrementDelay,
    @NotNull Duration defaultMaximumDelay,
    @NotNull Duration pollInterval,
    @NotNull Duration readyTimeout,
    @Positive int batchSize) {

  @AssertTrue(message = "notification.digest.default-maximum-delay must not be shorter than the increment delay")
  public boolean isMaximumDelayConsistent() {
    // null は @NotNull で検出する前提。
    return defaultIncrementDelay == null
        || defaultMaximumDelay == null
        || defaultMaximumDelay.compareTo(defaultIncrementDelay) >= 0;
  }
}
