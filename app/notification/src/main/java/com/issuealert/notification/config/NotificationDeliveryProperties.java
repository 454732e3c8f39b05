/*
 * どこで: Notification アプリの設定バインド
 * 何を: メール outbox 配信ワーカーのポーリング/バッチ/再送/lease 設定を保持する
 * なぜ: 送信先障害時の再送間隔と打ち切り回数を環境ごとに調整するため
 */
package com.issuealert.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    @NotNull Duration lease) {

  @AssertTrue(message = "notification.delivery.backoff-exponent-base must be at least 1.0")
  public boolean isBackoffExponentBaseValid() {
    return backoffExponentBase >= 1.0d;
  }
}
