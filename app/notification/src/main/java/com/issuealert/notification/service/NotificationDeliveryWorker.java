/*
 * どこで: Notification 配信ワーカー
 * 何を: 一定間隔で outbox のメール配信バッチを起動する
 * なぜ: 受信者ごとの配信要求を通知判定とは別スレッドで送るため
 */
package com.issuealert.notification.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryWorker.class);

  private final NotificationDeliveryService deliveryService;

  @Scheduled(fixedDelayString = "${notification.delivery.poll-interval}")
  public void run() {
    final int claimed = deliveryService.processPendingBatch();
    if (claimed > 0) {
      logger.debug("mail outbox batch processed claimed={}", claimed);
    }
  }
}
