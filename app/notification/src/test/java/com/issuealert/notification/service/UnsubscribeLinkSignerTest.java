/*
 * どこで: UnsubscribeLinkSigner のユニットテスト
 * 何を: 署名付き配信停止リンクの生成と検証を確認する
 * なぜ: 改ざんされたリンクで他人の配信設定を変更できないことを保証するため
 */
package com.issuealert.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.issuealert.notification.config.NotificationMailProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.web.util.UriComponentsBuilder;

class UnsubscribeLinkSignerTest {

  private final UnsubscribeLinkSigner signer =
      new UnsubscribeLinkSigner(
          new NotificationMailProperties(null, "https://issuealert.test", "secret", Duration.ofMinutes(5)));

  @Test
  void signedLinkVerifiesOnlyForSameParameters() {
    final String link = signer.sign(5L, UnsubscribeLinkSigner.Scope.PROJECT, 3L, "alert_email");
    final String signature =
        UriComponentsBuilder.fromUriString(link).build().getQueryParams().getFirst("signature");

    assertThat(link).startsWith("https://issuealert.test/unsubscribe/project/3/?user_id=5&referrer=alert_email");
    assertThat(signature).hasSize(64).matches("[0-9a-f]+");
    assertThat(signer.verify(5L, UnsubscribeLinkSigner.Scope.PROJECT, 3L, "alert_email", signature)).isTrue();
    assertThat(signer.verify(6L, UnsubscribeLinkSigner.Scope.PROJECT, 3L, "alert_email", signature)).isFalse();
    assertThat(signer.verify(5L, UnsubscribeLinkSigner.Scope.ISSUE, 3L, "alert_email", signature)).isFalse();
    assertThat(signer.verify(5L, UnsubscribeLinkSigner.Scope.PROJECT, 3L, null, signature)).isFalse();
    assertThat(signer.verify(5L, UnsubscribeLinkSigner.Scope.PROJECT, 3L, "alert_email", null)).isFalse();
  }
}
