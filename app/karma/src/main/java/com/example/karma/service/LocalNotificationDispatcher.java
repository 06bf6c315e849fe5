/*
 * どこで: Karma 通知層
 * 何を: NATS を使わずに通知をログへ出す実装
 * なぜ: ローカル環境で外部送信なしに遷移イベントを確認するため
 */
package com.example.karma.service;

import com.example.common.event.OrderEventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalNotificationDispatcher implements NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(LocalNotificationDispatcher.class);

    @Override
    public void dispatch(String eventType, String aggregateKey, OrderEventPayload payload) {
        // 実送信は行わず、ログに残すだけとする
        logger.info("notification simulated dispatch eventId={} eventType={} aggregateKey={} status={}",
                payload.eventId(), eventType, aggregateKey, payload.status());
    }
}
