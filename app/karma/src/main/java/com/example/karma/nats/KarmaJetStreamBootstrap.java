/*
 * どこで: Karma NATS 初期化
 * 何を: 通知用 JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.example.karma.nats;

import com.example.karma.config.KarmaNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class KarmaJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(KarmaJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final KarmaNatsProperties properties;

  @PostConstruct
  public void ensureStream() {
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("karma.nats.duplicate-window must be positive");
    }
    final StreamConfiguration desired =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    try {
      final JetStreamManagement management = connection.jetStreamManagement();
      final boolean created = createOrUpdate(management, desired);
      logger.info(
          "karma notification stream {} stream={} subject={} duplicateWindow={}",
          created ? "created" : "updated",
          properties.stream(),
          properties.subject(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream " + properties.stream(), ex);
    }
  }

  /** @return 新規作成した場合 true */
  private boolean createOrUpdate(JetStreamManagement management, StreamConfiguration desired)
      throws IOException, JetStreamApiException {
    try {
      management.getStreamInfo(properties.stream());
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR) {
        throw ex;
      }
      management.addStream(desired);
      return true;
    }
    management.updateStream(desired);
    return false;
  }
}
