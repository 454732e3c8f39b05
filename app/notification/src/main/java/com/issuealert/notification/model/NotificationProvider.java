package com.issuealert.notification.model;

/** 通知チャネル。DB には小文字の値で保存する。 */
public enum NotificationProvider {
  EMAIL,
  SLACK
}
