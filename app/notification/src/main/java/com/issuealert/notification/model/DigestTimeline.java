/*
 * どこで: Notification digest モデル
 * 何を: digest key ごとのスケジュール状態
 * なぜ: 即時配信と遅延 flush の判定を保存先に依存せず表現するため
 */
package com.issuealert.notification.model;

import java.time.Duration;
import java.time.Instant;

public record DigestTimeline(
    DigestTimelineState state,
    Instant deadline,
    Instant windowStart,
    Duration incrementDelay,
    Duration maximumDelay) {}
