/*
 * どこで: Notification サービス層
 * 何を: Spring の TaskScheduler で digest flush を実行する
 * なぜ: 即時 flush と期限到来 flush を同じスレッドプールで処理するため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.DigestKey;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "TaskScheduler は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TaskSchedulerDigestDeliveryScheduler implements DigestDeliveryScheduler {

  private static final Logger logger =
      LoggerFactory.getLogger(TaskSchedulerDigestDeliveryScheduler.class);

  private final TaskScheduler taskScheduler;
  private final DigestNotifier digestNotifier;
  private final Clock clock;

  public TaskSchedulerDigestDeliveryScheduler(
      TaskScheduler taskScheduler, DigestNotifier digestNotifier, Clock clock) {
    this.taskScheduler = taskScheduler;
    this.digestNotifier = digestNotifier;
    this.clock = clock;
  }

  @Override
  public void schedule(DigestKey key, Duration delay) {
    final Instant runAt = Instant.now(clock).plus(delay);
    taskScheduler.schedule(() -> flush(key), runAt);
    logger.debug("digest flush scheduled key={} runAt={}", key, runAt);
  }

  void flush(DigestKey key) {
    MDC.put("digest_key", key.unsplit());
    try {
      final int delivered = digestNotifier.deliverDigest(key);
      logger.info("digest flushed key={} delivered={}", key, delivered);
    } catch (RuntimeException ex) {
      // 未配信のレコードは READY の key に残り、ready-timeout 経過後に再 claim される
      logger.warn("digest flush failed key={}", key, ex);
    } finally {
      MDC.remove("digest_key");
    }
  }
}
