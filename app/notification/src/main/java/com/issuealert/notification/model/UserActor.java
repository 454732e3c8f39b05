package com.issuealert.notification.model;

public record UserActor(long id) implements Actor {}
