/*
 * どこで: Karma アプリの設定バインド
 * 何を: 初回参加プレイヤーへの付与 karma を保持する
 * なぜ: 新規参加者が最初の注文を出せる残高を運用で決めるため
 */
package com.example.karma.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "karma.player")
public record KarmaPlayerProperties(@PositiveOrZero int initialKarma) {}
