/*
 * どこで: Karma 通知層
 * 何を: 状態遷移イベントを外部(チャット描画側)へ届ける抽象
 * なぜ: NATS 配信とローカル動作確認を差し替えられるようにするため
 */
package com.example.karma.service;

import com.example.common.event.OrderEventPayload;

public interface NotificationDispatcher {

  /**
   * @throws ExternalDispatchFailureException 送信先が受理しなかった場合
   */
  void dispatch(String eventType, String aggregateKey, OrderEventPayload payload);
}
