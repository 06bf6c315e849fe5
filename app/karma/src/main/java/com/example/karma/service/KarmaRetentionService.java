/*
 * どこで: Karma retention サービス
 * 何を: 配信済み通知 outbox の期限切れ行を削除する
 * なぜ: テーブル肥大化を防ぎ、未配信/失敗行だけを調査用に残すため
 */
package com.example.karma.service;

import com.example.karma.config.KarmaOutboxProperties;
import com.example.karma.repository.OutboxEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class KarmaRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(KarmaRetentionService.class);

  private final OutboxEventRepository outboxEventRepository;
  private final KarmaOutboxProperties outboxProperties;
  private final Clock clock;

  /** @return 削除した outbox 行数 */
  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(outboxProperties.dispatchedTtl());
    final int deleted = outboxEventRepository.deleteDispatchedOlderThan(threshold);
    logger.info("karma retention cleanup deleted outboxEvents={} threshold={}", deleted, threshold);
    return deleted;
  }
}
