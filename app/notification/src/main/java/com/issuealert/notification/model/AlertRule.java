package com.issuealert.notification.model;

public record AlertRule(long ruleId, String label) {}
