/*
 * Where: Notification service layer
 * What: Builds HMAC-SHA256 signed unsubscribe links for a recipient and a project or issue
 * Why: Recipients must be able to opt out from a mail without signing in, and links must not be forgeable
 */
package com.issuealert.notification.service;

import com.google.common.io.BaseEncoding;
import com.issuealert.notification.config.NotificationMailProperties;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class UnsubscribeLinkSigner {

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  /** Unsubscribe target. */
  public enum Scope {
    PROJECT("project"),
    ISSUE("issue");

    private final String path;

    Scope(String path) {
      this.path = path;
    }
  }

  private final NotificationMailProperties properties;

  public String sign(long userId, Scope scope, long targetId, String referrer) {
    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
            .path("/unsubscribe/{scope}/{targetId}/")
            .queryParam("user_id", userId);
    if (referrer != null) {
      builder.queryParam("referrer", referrer);
    }
    return builder
        .queryParam("signature", signature(userId, scope, targetId, referrer))
        .buildAndExpand(scope.path, targetId)
        .encode()
        .toUriString();
  }

  public boolean verify(long userId, Scope scope, long targetId, String referrer, String signature) {
    final byte[] expected =
        signature(userId, scope, targetId, referrer).getBytes(StandardCharsets.US_ASCII);
    final byte[] actual =
        signature == null ? new byte[0] : signature.getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, actual);
  }

  private String signature(long userId, Scope scope, long targetId, String referrer) {
    final String payload =
        userId + ":" + scope.path + ":" + targetId + ":" + (referrer == null ? "" : referrer);
    try {
      final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(
          new SecretKeySpec(
              properties.linkSigningKey().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return BaseEncoding.base16()
          .lowerCase()
          .encode(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("failed to sign unsubscribe link", ex);
    }
  }
}
