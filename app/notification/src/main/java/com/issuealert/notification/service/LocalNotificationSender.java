/*
 * どこで: Notification サービス層
 * 何を: メール送信を模擬する実装
 * なぜ: 外部 SMTP を伴わずに outbox の状態遷移を確認するため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.DeliveryRequest;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);

    @Override
    public void send(UUID notificationId, DeliveryRequest request) {
        // 実送信は行わず、宛先・件名・テンプレートをログに残すだけとする
        logger.info("mail simulated send id={} userId={} type={} template={} subject={}",
                notificationId,
                request.userId(),
                request.type(),
                request.template(),
                request.subject());
    }
}
