/*
 * どこで: Notification digest ワーカー
 * 何を: 期限到来した digest key を claim して flush を登録する
 * なぜ: 遅延 digest を一定間隔で配信するため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.DigestKey;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.digest.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DigestScheduleWorker {

  private static final Logger logger = LoggerFactory.getLogger(DigestScheduleWorker.class);

  private final DigestAccumulator digestAccumulator;
  private final DigestDeliveryScheduler deliveryScheduler;

  @Scheduled(fixedDelayString = "${notification.digest.poll-interval}")
  public void run() {
    final List<DigestKey> due = digestAccumulator.claimDue();
    for (DigestKey key : due) {
      deliveryScheduler.schedule(key, Duration.ZERO);
    }
    if (!due.isEmpty()) {
      logger.info("digest keys claimed count={}", due.size());
    }
  }
}
