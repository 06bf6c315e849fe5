package com.example.karma.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.common.event.OrderEventPayload;
import com.example.karma.config.KarmaNatsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NatsNotificationDispatcherTest {

  private static final KarmaNatsProperties NATS_PROPERTIES =
      new KarmaNatsProperties("karma.order-events", "KARMA_ORDER_EVENTS", Duration.ofMinutes(2));
  private static final OrderEventPayload PAYLOAD =
      new OrderEventPayload(
          "event-1",
          "OrderClaimed",
          "2026-03-01T09:00:00Z",
          "order",
          "order-1",
          "CLAIMED",
          "player-p",
          "player-p",
          "runner-r",
          "tea",
          null,
          2,
          1,
          "msg-42",
          "trace-1");

  @Mock private JetStream jetStream;

  private NatsNotificationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = new NatsNotificationDispatcher(jetStream, NATS_PROPERTIES, new ObjectMapper());
  }

  @Test
  void publishesJsonWithDeduplicationHeader() throws IOException, JetStreamApiException {
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenReturn(mock(PublishAck.class));

    dispatcher.dispatch("OrderClaimed", "order:order-1", PAYLOAD);

    final ArgumentCaptor<Headers> headersCaptor = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> bodyCaptor = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publish(eq(NATS_PROPERTIES.subject()), headersCaptor.capture(), bodyCaptor.capture());
    assertThat(headersCaptor.getValue().getFirst("Nats-Msg-Id")).isEqualTo("event-1");
    assertThat(headersCaptor.getValue().getFirst("aggregate_key")).isEqualTo("order:order-1");
    assertThat(headersCaptor.getValue().getFirst("trace_id")).isEqualTo("trace-1");
    assertThat(new String(bodyCaptor.getValue(), StandardCharsets.UTF_8))
        .contains("\"runner_id\":\"runner-r\"")
        .contains("\"external_message_ref\":\"msg-42\"")
        .doesNotContain("capabilities");
  }

  @Test
  void publishIoFailureBecomesExternalDispatchFailure() throws IOException, JetStreamApiException {
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("connection closed"));

    assertThatThrownBy(() -> dispatcher.dispatch("OrderClaimed", "order:order-1", PAYLOAD))
        .isInstanceOf(ExternalDispatchFailureException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void missingPubAckIsTreatedAsFailure() throws IOException, JetStreamApiException {
    when(jetStream.publish(eq(NATS_PROPERTIES.subject()), any(Headers.class), any(byte[].class)))
        .thenReturn(null);

    assertThatThrownBy(() -> dispatcher.dispatch("OrderClaimed", "order:order-1", PAYLOAD))
        .isInstanceOf(ExternalDispatchFailureException.class)
        .hasMessageContaining("puback");
  }
}
