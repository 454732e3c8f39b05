package com.issuealert.notification.model;

public enum NotificationSettingOption {
  DEFAULT,
  NEVER,
  ALWAYS,
  SUBSCRIBE_ONLY,
  COMMITTED_ONLY
}
