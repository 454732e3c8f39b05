/*
 * どこで: Notification digest モデル
 * 何を: digest バッファを特定するキー (project, target type, target identifier)
 * なぜ: 同じ受信者解決ルールに向かうイベントを 1 つのバッファへ集めるため
 */
package com.issuealert.notification.model;

public record DigestKey(long projectId, ActionTargetType targetType, String targetIdentifier) {

  private static final String PREFIX = "mail:p:";

  /** "mail:p:{projectId}:{targetType}:{identifier}" 形式。identifier 無しは空文字。 */
  public String unsplit() {
    return PREFIX
        + projectId
        + ":"
        + targetType.value()
        + ":"
        + (targetIdentifier == null ? "" : targetIdentifier);
  }

  public static DigestKey split(String key) {
    if (key == null || !key.startsWith(PREFIX)) {
      throw new IllegalArgumentException("invalid digest key: " + key);
    }
    final String[] parts = key.substring(PREFIX.length()).split(":", 3);
    if (parts.length != 3) {
      throw new IllegalArgumentException("invalid digest key: " + key);
    }
    final String identifier = parts[2].isEmpty() ? null : parts[2];
    try {
      return new DigestKey(
          Long.parseLong(parts[0]), ActionTargetType.fromValue(parts[1]), identifier);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid digest key: " + key, ex);
    }
  }

  @Override
  public String toString() {
    return unsplit();
  }
}
