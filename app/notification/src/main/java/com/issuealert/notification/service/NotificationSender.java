/*
 * どこで: Notification サービス層
 * 何を: 受信者 1 人分の配信要求を送るトランスポートの抽象
 * なぜ: メール送信実装とテスト差し替えを容易にするため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.DeliveryRequest;
import java.util.UUID;

public interface NotificationSender {

    /** 送信に失敗した場合は RuntimeException を送出し、呼び出し側がリトライを判断する。 */
    void send(UUID notificationId, DeliveryRequest request);
}
