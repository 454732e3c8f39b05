package com.issuealert.notification.model;

public enum NotificationSettingType {
  DEFAULT,
  DEPLOY,
  ISSUE_ALERTS,
  WORKFLOW
}
