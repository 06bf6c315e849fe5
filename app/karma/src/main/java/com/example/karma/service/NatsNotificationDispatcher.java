/*
 * どこで: Karma 通知層
 * 何を: 遷移イベントを JSON で JetStream へ publish する
 * なぜ: Nats-Msg-Id による重複排除付きでチャット側へ届けるため
 */
package com.example.karma.service;

import com.example.common.event.OrderEventPayload;
import com.example.karma.config.KarmaNatsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NatsNotificationDispatcher implements NotificationDispatcher {

  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final KarmaNatsProperties natsProperties;
  private final ObjectMapper objectMapper;

  @Override
  public void dispatch(String eventType, String aggregateKey, OrderEventPayload payload) {
    final Headers headers = new Headers();
    // 重複排除キーとして event_id を NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, eventType);
    headers.add(HEADER_AGGREGATE_KEY, aggregateKey);
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    if (payload.traceId() != null) {
      headers.add(HEADER_TRACE_ID, payload.traceId());
    }
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification payload", ex);
    }
    try {
      // puback を受け取れた場合のみ配信成功とみなす
      final PublishAck ack = jetStream.publish(natsProperties.subject(), headers, body);
      if (ack == null) {
        throw new ExternalDispatchFailureException("puback is missing", null);
      }
    } catch (IOException | JetStreamApiException ex) {
      throw new ExternalDispatchFailureException(
          "failed to publish notification eventId=" + payload.eventId(), ex);
    }
  }
}
