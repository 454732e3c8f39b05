/*
 * どこで: Notification アプリの設定バインド
 * 何を: NATS 接続設定 (接続先/タイムアウト/接続名) をプロパティから読み込む
 * なぜ: 環境ごとの接続先を安全に切り替え、サーバ側で接続元を識別できるようにするため
 */
package com.issuealert.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Integer connectionTimeout, String connectionName) {}
