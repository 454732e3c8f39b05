/*
 * どこで: Notification ドメインモデル
 * 何を: Issue 購読の理由コードと通知文面用の説明を表す
 * なぜ: 永続化される理由と参加者計算専用の合成理由を型で区別するため
 */
package com.issuealert.notification.model;

import java.util.Arrays;

public enum SubscriptionReason {
  IMPLICIT(-1, false,
      "have opted to receive updates for all issues within projects that you are a member of"),
  COMMITTED(-2, false, "were involved in a commit that is part of this release"),
  PROCESSING_ISSUE(-3, false, "are subscribed to alerts for this project"),
  UNKNOWN(0, true, null),
  COMMENT(1, true, "have commented on this issue"),
  ASSIGNED(2, true, "have been assigned to this issue"),
  BOOKMARK(3, true, "have bookmarked this issue"),
  STATUS_CHANGE(4, true, "have changed the resolution status of this issue"),
  DEPLOY_SETTING(5, true, "opted to receive all deploy notifications for this organization"),
  MENTIONED(6, true, "have been mentioned in this issue"),
  TEAM_MENTIONED(7, true, "are a member of a team mentioned in this issue");

  private static final String FALLBACK_DESCRIPTION = "are subscribed to this issue";

  private final int code;
  private final boolean persisted;
  private final String description;

  SubscriptionReason(int code, boolean persisted, String description) {
    this.code = code;
    this.persisted = persisted;
    this.description = description;
  }

  public int code() {
    return code;
  }

  /** 合成理由 (implicit/committed/processing_issue) は DB に書かない。 */
  public boolean persisted() {
    return persisted;
  }

  public String description() {
    return description == null ? FALLBACK_DESCRIPTION : description;
  }

  public static SubscriptionReason fromCode(int code) {
    return Arrays.stream(values())
        .filter(reason -> reason.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown subscription reason: " + code));
  }
}
