/*
 * どこで: Notification アプリのインフラ設定
 * 何を: NATS Connection を Spring 管理下に置き、再接続と接続状態のログを設定する
 * なぜ: アラート/フィードバック購読が同一接続を共有し、切断後も durable consumer へ自動で戻れるようにするため
 */
package com.issuealert.notification.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);
    private static final int RECONNECT_FOREVER = -1;

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        Options.Builder builder = new Options.Builder()
                .server(properties.url())
                .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
                .maxReconnects(RECONNECT_FOREVER)
                .connectionListener(NatsConfig::logConnectionEvent);
        if (properties.connectionName() != null && !properties.connectionName().isBlank()) {
            builder.connectionName(properties.connectionName());
        }
        return Nats.connect(builder.build());
    }

    private static void logConnectionEvent(Connection connection, ConnectionListener.Events event) {
        if (event == ConnectionListener.Events.DISCONNECTED || event == ConnectionListener.Events.CLOSED) {
            logger.warn("nats connection event={} server={}", event, connection.getConnectedUrl());
            return;
        }
        logger.info("nats connection event={} server={}", event, connection.getConnectedUrl());
    }
}
