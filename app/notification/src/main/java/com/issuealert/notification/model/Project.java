package com.issuealert.notification.model;

public record Project(long projectId, long organizationId, String slug, String name, boolean enhancedPrivacy) {

  public String fullName() {
    return name == null || name.isBlank() ? slug : name;
  }
}
