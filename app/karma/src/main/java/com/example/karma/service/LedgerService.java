/*
 * どこで: Karma サービス層
 * 何を: karma/reputation の原子的増減と仕訳の記録を担う
 * なぜ: 残高変動を注文遷移と同一トランザクションに載せ、二重計上を防ぐため
 */
package com.example.karma.service;

import com.example.karma.model.BalanceKind;
import com.example.karma.model.LedgerEntryType;
import com.example.karma.repository.LedgerEntryRepository;
import com.example.karma.repository.PlayerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class LedgerService {

  private static final Logger logger = LoggerFactory.getLogger(LedgerService.class);

  private final PlayerRepository playerRepository;
  private final LedgerEntryRepository ledgerEntryRepository;
  private final ReputationTitles reputationTitles;
  private final Clock clock;

  /**
   * 残高を単一の UPDATE 文で増減する。
   *
   * <p>REPUTATION の負値は VALIDATION_ERROR、KARMA の残高不足は INSUFFICIENT_FUNDS。
   */
  @Transactional
  public TransitionResult<Long> adjustBalance(String playerId, long delta, BalanceKind kind) {
    final Instant now = Instant.now(clock);
    try {
      if (kind == BalanceKind.REPUTATION) {
        return TransitionResult.success(applyReputation(playerId, delta, now));
      }
      final Optional<Long> balance = playerRepository.adjustKarma(playerId, delta, now);
      if (balance.isEmpty()) {
        throw missingOrInsufficient(playerId);
      }
      return TransitionResult.success(balance.get());
    } catch (LifecycleException ex) {
      return TransitionResult.from(ex);
    }
  }

  /**
   * 残高を amount 減らし、仕訳を 1 行残す。
   *
   * <p>仕訳は残高更新の後に書く(プレイヤー不在を外部キー違反ではなく NOT_FOUND で返すため)。
   * 同一参照・同一種別の二重引落しは CONFLICT となり、呼び出し元のトランザクションごと戻る。
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public long debit(
      String playerId, long amount, String referenceId, LedgerEntryType entryType, Instant now) {
    requirePositive(amount, "debit amount");
    final long balance =
        playerRepository
            .adjustKarma(playerId, -amount, now)
            .orElseThrow(() -> missingOrInsufficient(playerId));
    journal(playerId, referenceId, entryType, -amount, 0, now);
    return balance;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public long credit(
      String playerId, long amount, String referenceId, LedgerEntryType entryType, Instant now) {
    requirePositive(amount, "credit amount");
    final long balance =
        playerRepository.adjustKarma(playerId, amount, now).orElseThrow(() -> notFound(playerId));
    journal(playerId, referenceId, entryType, amount, 0, now);
    return balance;
  }

  /** 配達報酬のように karma と reputation を同時に加算する。仕訳は 1 行にまとめる。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public void reward(
      String playerId,
      long karma,
      long reputation,
      String referenceId,
      LedgerEntryType entryType,
      Instant now) {
    requirePositive(karma, "reward karma");
    requireNonNegativeReputation(reputation);
    playerRepository.adjustKarma(playerId, karma, now).orElseThrow(() -> notFound(playerId));
    applyReputation(playerId, reputation, now);
    journal(playerId, referenceId, entryType, karma, reputation, now);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public long addReputation(
      String playerId, long delta, String referenceId, LedgerEntryType entryType, Instant now) {
    requireNonNegativeReputation(delta);
    final long reputation = applyReputation(playerId, delta, now);
    journal(playerId, referenceId, entryType, 0, delta, now);
    return reputation;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void incrementOrdersRequested(String playerId, Instant now) {
    if (playerRepository.incrementOrdersRequested(playerId, now) == 0) {
      throw notFound(playerId);
    }
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void incrementDeliveriesCompleted(String playerId, Instant now) {
    if (playerRepository.incrementDeliveriesCompleted(playerId, now) == 0) {
      throw notFound(playerId);
    }
  }

  private long applyReputation(String playerId, long delta, Instant now) {
    requireNonNegativeReputation(delta);
    final long reputation =
        playerRepository.addReputation(playerId, delta, now).orElseThrow(() -> notFound(playerId));
    // 称号は reputation の派生値なので、変更のたびに再計算して保存する
    playerRepository.updateTitle(playerId, reputationTitles.titleFor(reputation), now);
    return reputation;
  }

  private void journal(
      String playerId,
      String referenceId,
      LedgerEntryType entryType,
      long karmaDelta,
      long reputationDelta,
      Instant now) {
    final int inserted =
        ledgerEntryRepository.insert(
            playerId, referenceId, entryType, karmaDelta, reputationDelta, now);
    if (inserted == 0) {
      logger.warn(
          "duplicate ledger entry rejected playerId={} referenceId={} entryType={}",
          playerId,
          referenceId,
          entryType);
      throw new LifecycleException(
          KarmaErrorCode.CONFLICT, "ledger entry already recorded: " + entryType);
    }
  }

  private LifecycleException missingOrInsufficient(String playerId) {
    if (!playerRepository.exists(playerId)) {
      return notFound(playerId);
    }
    return new LifecycleException(
        KarmaErrorCode.INSUFFICIENT_FUNDS, "insufficient karma: " + playerId);
  }

  private LifecycleException notFound(String playerId) {
    return new LifecycleException(KarmaErrorCode.NOT_FOUND, "player not found: " + playerId);
  }

  private void requirePositive(long amount, String label) {
    if (amount <= 0) {
      throw new LifecycleException(KarmaErrorCode.VALIDATION_ERROR, label + " must be positive");
    }
  }

  private void requireNonNegativeReputation(long delta) {
    if (delta < 0) {
      throw new LifecycleException(
          KarmaErrorCode.VALIDATION_ERROR, "reputation delta must not be negative");
    }
  }
}
