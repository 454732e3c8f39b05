package com.issuealert.notification.model;

public enum OwnerType {
  USER,
  TEAM
}
