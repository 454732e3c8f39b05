/*
 * どこで: Notification サービス層
 * 何を: digest key の flush を遅延実行に登録する抽象
 * なぜ: 実行基盤 (Spring TaskScheduler 等) をディスパッチャから切り離すため
 */
package com.issuealert.notification.service;

import com.issuealert.notification.model.DigestKey;
import java.time.Duration;

public interface DigestDeliveryScheduler {

  void schedule(DigestKey key, Duration delay);
}
