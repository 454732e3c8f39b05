/*
 * どこで: common の時刻設定
 * 何を: UTC の Clock を Bean として公開する。既に Clock Bean があればそちらを使う
 * なぜ: digest の期限や outbox の lease を固定時刻でテストできるようにするため
 */
package com.issuealert.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
