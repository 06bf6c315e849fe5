/*
 * どこで: Karma アプリのインフラ設定
 * 何を: 通知 publish 用の NATS Connection と JetStream コンテキストを Spring 管理下に置く
 * なぜ: Dispatcher と stream 初期化が同一接続を再利用するため
 */
package com.example.karma.config;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        Options options = new Options.Builder()
                .server(properties.url())
                .connectionName(properties.connectionName())
                .connectionTimeout(properties.connectionTimeout())
                .connectionListener(connectionListener())
                .build();
        return Nats.connect(options);
    }

    @Bean
    public JetStream jetStream(Connection natsConnection) throws IOException {
        return natsConnection.jetStream();
    }

    // 切断中の publish 失敗は outbox 側で再送される
    private ConnectionListener connectionListener() {
        return (connection, event) -> {
            if (event == ConnectionListener.Events.DISCONNECTED || event == ConnectionListener.Events.CLOSED) {
                logger.warn("nats connection {} server={}", event, connection.getConnectedUrl());
            } else {
                logger.info("nats connection {} server={}", event, connection.getConnectedUrl());
            }
        };
    }
}
