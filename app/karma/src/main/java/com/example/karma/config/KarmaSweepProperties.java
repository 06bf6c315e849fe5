/*
 * どこで: Karma アプリの設定バインド
 * 何を: 期限切れスイープの周期と 1 回あたりの処理件数を保持する
 * なぜ: 負荷に応じてスイープ間隔を外部から調整するため
 */
package com.example.karma.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "karma.sweep")
public record KarmaSweepProperties(boolean enabled, Duration pollInterval, int batchSize) {}
