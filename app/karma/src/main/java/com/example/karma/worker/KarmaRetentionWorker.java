/*
 * どこで: Karma retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで配信済み通知を削除するため
 */
package com.example.karma.worker;

import com.example.karma.service.KarmaRetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "karma.retention.enabled", havingValue = "true")
public class KarmaRetentionWorker {

  private final KarmaRetentionService retentionService;

  @Scheduled(fixedDelayString = "${karma.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
