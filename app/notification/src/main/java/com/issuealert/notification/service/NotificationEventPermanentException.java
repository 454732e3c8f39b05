/*
 * どこで: Notification サービス層
 * 何を: 再配信しても回復しないシグナル処理失敗を示す例外
 * なぜ: NATS 再配信を止めて TERM する判断に使うため
 */
package com.issuealert.notification.service;

public class NotificationEventPermanentException extends RuntimeException {

    public NotificationEventPermanentException(String message) {
        super(message);
    }

    public NotificationEventPermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
