/*
 * どこで: Karma アプリの設定バインド
 * 何を: 配信済み outbox の削除周期を保持する
 * なぜ: outbox テーブルの肥大化を防ぐため
 */
package com.example.karma.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "karma.retention")
public record KarmaRetentionProperties(boolean enabled, Duration cleanupInterval) {}
