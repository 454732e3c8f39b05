package com.issuealert.notification.model;

public record PersonalizedDigest(long userId, Digest digest) {}
