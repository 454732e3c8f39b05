/*
 * どこで: Notification アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン、定期ワーカーの有効化を行う
 * なぜ: digest 配信と outbox 送信のスケジュールを同一プロセスで動かすため
 */
package com.issuealert.notification;

import com.issuealert.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotificationApplication {

	public static void main(String[] args) {
		SpringApplication.run(NotificationApplication.class, args);
	}
}
