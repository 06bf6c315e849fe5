/*
 * どこで: Karma サービス層
 * 何を: プレイヤーの初回作成/能力宣言/参照/ランキングを担う
 * なぜ: 初回参加時の karma 付与と称号を一箇所で決めるため
 */
package com.example.karma.service;

import com.example.karma.config.KarmaPlayerProperties;
import com.example.karma.model.PlayerRecord;
import com.example.karma.repository.PlayerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PlayerService {

  private static final Logger logger = LoggerFactory.getLogger(PlayerService.class);
  static final int MAX_LEADERBOARD_LIMIT = 50;

  private final PlayerRepository playerRepository;
  private final ReputationTitles reputationTitles;
  private final KarmaPlayerProperties properties;
  private final Clock clock;

  /** 未登録なら初期 karma 付きで作成し、現在のプレイヤーを返す。 */
  @Transactional
  public PlayerRecord getOrCreate(String playerId) {
    ensureExists(playerId, Instant.now(clock));
    return playerRepository
        .findById(playerId)
        .orElseThrow(() -> new IllegalStateException("player vanished after insert: " + playerId));
  }

  /** 遷移トランザクション内から呼ばれる。既存プレイヤーには何もしない。 */
  public void ensureExists(String playerId, Instant now) {
    requirePlayerId(playerId);
    final int created =
        playerRepository.insertIfAbsent(
            playerId, properties.initialKarma(), reputationTitles.titleFor(0), now);
    if (created > 0) {
      logger.info("player onboarded playerId={} karma={}", playerId, properties.initialKarma());
    }
  }

  public TransitionResult<PlayerRecord> find(String playerId) {
    return playerRepository
        .findById(playerId)
        .map(TransitionResult::success)
        .orElseGet(
            () ->
                TransitionResult.failure(
                    KarmaErrorCode.NOT_FOUND, "player not found: " + playerId));
  }

  @Transactional
  public TransitionResult<PlayerRecord> updateCapabilities(
      String playerId, List<String> capabilities) {
    try {
      final List<String> normalized = normalizeCapabilities(capabilities);
      final Instant now = Instant.now(clock);
      ensureExists(playerId, now);
      return TransitionResult.success(
          playerRepository
              .updateCapabilities(playerId, normalized, now)
              .orElseThrow(
                  () ->
                      new LifecycleException(
                          KarmaErrorCode.NOT_FOUND, "player not found: " + playerId)));
    } catch (LifecycleException ex) {
      return TransitionResult.from(ex);
    }
  }

  public TransitionResult<List<PlayerRecord>> leaderboard(int limit) {
    if (limit < 1 || limit > MAX_LEADERBOARD_LIMIT) {
      return TransitionResult.failure(
          KarmaErrorCode.VALIDATION_ERROR,
          "limit must be between 1 and " + MAX_LEADERBOARD_LIMIT);
    }
    return TransitionResult.success(playerRepository.findTopByReputation(limit));
  }

  /** 空白のタグは拒否し、小文字化して重複を除く。 */
  static List<String> normalizeCapabilities(List<String> capabilities) {
    if (capabilities == null) {
      throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "capabilities are required");
    }
    final Set<String> normalized = new LinkedHashSet<>();
    for (String capability : capabilities) {
      if (capability == null || capability.isBlank()) {
        throw new LifecycleException(
            KarmaErrorCode.VALIDATION_ERROR, "capability must not be blank");
      }
      normalized.add(capability.trim().toLowerCase(Locale.ROOT));
    }
    return List.copyOf(normalized);
  }

  private void requirePlayerId(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, "player id is required");
    }
  }
}
