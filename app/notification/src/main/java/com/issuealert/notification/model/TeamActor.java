package com.issuealert.notification.model;

public record TeamActor(long id) implements Actor {}
