/*
 * どこで: Notification ドメインモデル
 * 何を: 通知設定のスコープ種別
 * なぜ: project > organization > user の優先順位で設定値を解決するため
 */
package com.issuealert.notification.model;

public enum NotificationScopeType {
  USER(0),
  ORGANIZATION(1),
  PROJECT(2);

  private final int specificity;

  NotificationScopeType(int specificity) {
    this.specificity = specificity;
  }

  public int specificity() {
    return specificity;
  }
}
