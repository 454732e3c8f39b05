package com.issuealert.notification.model;

public record Owner(OwnerType type, long id) {}
