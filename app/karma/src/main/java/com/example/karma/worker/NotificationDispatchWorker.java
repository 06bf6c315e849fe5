/*
 * どこで: Karma 通知ワーカー
 * 何を: スケジュールで outbox の通知配信を起動する
 * なぜ: コミット済みの遷移イベントを定期的に送り出すため
 */
package com.example.karma.worker;

import com.example.karma.service.NotificationDispatchService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

@Component
@ConditionalOnProperty(name = "karma.outbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NotificationDispatchWorker {

    private final NotificationDispatchService dispatchService;

    @Scheduled(fixedDelayString = "${karma.outbox.poll-interval}")
    public void run() {
        dispatchService.dispatchPendingBatch();
    }
}
