package com.issuealert.notification.model;

/** イベントのスタックに関与したと推定されるコミット。score が高いほど疑わしい。 */
public record SuspectCommit(String id, String message, String authorEmail, int score) {}
