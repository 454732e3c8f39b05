/*
 * どこで: Notification API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: actuator を使わない疎通確認のため
 */
package com.issuealert.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "issue-notification: ok";
  }
}
