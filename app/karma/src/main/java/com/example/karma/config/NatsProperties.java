/*
 * どこで: Karma アプリの設定バインド
 * 何を: 通知 publish 用 NATS 接続の接続先/タイムアウト/接続名を保持する
 * なぜ: 環境ごとの接続先を切り替え、サーバ側で接続元を識別できるようにするため
 */
package com.example.karma.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    @DefaultValue("true") boolean enabled,
    String url,
    @DefaultValue("5s") Duration connectionTimeout,
    @DefaultValue("karma") String connectionName) {}
