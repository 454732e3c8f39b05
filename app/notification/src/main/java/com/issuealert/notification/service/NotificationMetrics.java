/*
 * どこで: Notification サービス層
 * 何を: 通知コア (アダプタ呼び出し/オーナー解決/受信者失敗/digest 追加/配信結果/backlog) のメトリクスを記録する
 * なぜ: 配信漏れや digest の滞留を Prometheus から直接観測できるようにするため
 */
package com.issuealert.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  static final String METRIC_ADAPTER_CALLS = "notification.adapter.calls";
  static final String METRIC_OWNERS_SEND_TO = "notification.owners.send_to";
  static final String METRIC_RECIPIENT_FAILURES = "notification.recipient.failures";
  static final String METRIC_DIGEST_ADDED = "notification.digest.added";
  static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending notifications")
        .register(meterRegistry);
  }

  /** operation: rule_notify / notify / notify_digest / should_notify / handle_user_report */
  public void recordAdapterCall(String operation) {
    increment(METRIC_ADAPTER_CALLS, "Notification adapter entry points", "operation", operation);
  }

  /** outcome: everyone / empty / match */
  public void recordOwnersSendTo(String outcome) {
    increment(METRIC_OWNERS_SEND_TO, "Issue owner resolution outcomes", "outcome", outcome);
  }

  /** path: notify / notify_digest / user_report */
  public void recordRecipientFailure(String path) {
    increment(METRIC_RECIPIENT_FAILURES, "Per-recipient notification failures", "path", path);
  }

  public void recordDigestAdded(boolean immediate) {
    increment(
        METRIC_DIGEST_ADDED,
        "Records appended to digest buffers",
        "immediate",
        String.valueOf(immediate));
  }

  public void recordDeliveryResult(String result) {
    increment(METRIC_DELIVERY_TOTAL, "Notification delivery outcomes", "result", result);
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + "|" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
