/*
 * どこで: Notification ドメインモデル
 * 何を: アラートアクションの配信先種別
 * なぜ: digest key と受信者解決で同じ識別子を使うため
 */
package com.issuealert.notification.model;

import java.util.Arrays;

public enum ActionTargetType {
  ISSUE_OWNERS("IssueOwners"),
  TEAM("Team"),
  MEMBER("Member");

  private final String value;

  ActionTargetType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ActionTargetType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown target type: " + value));
  }
}
