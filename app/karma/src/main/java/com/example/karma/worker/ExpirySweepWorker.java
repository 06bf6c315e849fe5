/*
 * どこで: Karma 期限切れワーカー
 * 何を: 一定間隔で ExpirySweeper の tick を起動する
 * なぜ: 外部からの tick が無くても期限切れ返金を進めるため
 */
package com.example.karma.worker;

import com.example.karma.service.ExpirySweeper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "karma.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ExpirySweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(ExpirySweepWorker.class);

  private final ExpirySweeper sweeper;

  @Scheduled(fixedDelayString = "${karma.sweep.poll-interval}")
  public void run() {
    try {
      sweeper.tick();
    } catch (RuntimeException ex) {
      // スケジューラを止めないよう、次周期で再試行する
      logger.warn("expiry sweep tick failed", ex);
    }
  }
}
