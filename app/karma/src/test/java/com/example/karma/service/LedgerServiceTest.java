/*
 * どこで: LedgerService の統合テスト
 * 何を: 原子的な残高増減と仕訳の一意性を検証する
 * なぜ: 残高が負にならず、同一参照の二重計上が起きないことを保証するため
 */
package com.example.karma.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.karma.AbstractPostgresContainerTest;
import com.example.karma.model.BalanceKind;
import com.example.karma.model.LedgerEntryType;
import com.example.karma.repository.LedgerEntryRepository;
import com.example.karma.repository.PlayerRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class LedgerServiceTest extends AbstractPostgresContainerTest {

  private static final String PLAYER = "ledger-player";
  private static final int CONCURRENT_CALLS = 8;
  private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(10);

  @Autowired private LedgerService ledgerService;
  @Autowired private PlayerService playerService;
  @Autowired private PlayerRepository playerRepository;
  @Autowired private LedgerEntryRepository ledgerEntryRepository;
  @Autowired private PlatformTransactionManager transactionManager;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
    playerService.getOrCreate(PLAYER);
  }

  @Test
  void adjustBalanceAppliesKarmaDelta() {
    final TransitionResult<Long> result = ledgerService.adjustBalance(PLAYER, 4, BalanceKind.KARMA);

    assertThat(result.value()).isEqualTo(7L);
  }

  @Test
  void adjustBalanceRejectsOverdraft() {
    final TransitionResult<Long> result = ledgerService.adjustBalance(PLAYER, -4, BalanceKind.KARMA);

    assertThat(result.error()).isEqualTo(KarmaErrorCode.INSUFFICIENT_FUNDS);
    assertThat(playerRepository.findById(PLAYER).orElseThrow().karmaBalance()).isEqualTo(3);
  }

  @Test
  void adjustBalanceRejectsNegativeReputation() {
    assertThat(ledgerService.adjustBalance(PLAYER, -1, BalanceKind.REPUTATION).error())
        .isEqualTo(KarmaErrorCode.VALIDATION_ERROR);
  }

  @Test
  void adjustBalanceForUnknownPlayerIsNotFound() {
    assertThat(ledgerService.adjustBalance("ghost", 1, BalanceKind.KARMA).error())
        .isEqualTo(KarmaErrorCode.NOT_FOUND);
    assertThat(ledgerService.adjustBalance("ghost", 1, BalanceKind.REPUTATION).error())
        .isEqualTo(KarmaErrorCode.NOT_FOUND);
  }

  @Test
  void reputationUpdateRecomputesTitle() {
    ledgerService.adjustBalance(PLAYER, 12, BalanceKind.REPUTATION);

    assertThat(playerRepository.findById(PLAYER).orElseThrow().title()).isEqualTo("Foam Scryer");
  }

  @Test
  void duplicateDebitForSameReferenceRollsBack() {
    final TransactionTemplate template = new TransactionTemplate(transactionManager);
    final Instant now = Instant.now();
    template.executeWithoutResult(
        status -> ledgerService.debit(PLAYER, 1, "order-1", LedgerEntryType.ORDER_DEBIT, now));

    assertThatThrownBy(
            () ->
                template.executeWithoutResult(
                    status ->
                        ledgerService.debit(PLAYER, 1, "order-1", LedgerEntryType.ORDER_DEBIT, now)))
        .isInstanceOf(LifecycleException.class)
        .extracting(ex -> ((LifecycleException) ex).code())
        .isEqualTo(KarmaErrorCode.CONFLICT);
    assertThat(playerRepository.findById(PLAYER).orElseThrow().karmaBalance()).isEqualTo(2);
    assertThat(ledgerEntryRepository.findByReference("order-1")).hasSize(1);
  }

  @Test
  void debitOutsideTransactionIsRejected() {
    assertThatThrownBy(
            () -> ledgerService.debit(PLAYER, 1, "order-2", LedgerEntryType.ORDER_DEBIT, Instant.now()))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void concurrentCreditsAreAllApplied() throws Exception {
    final List<TransitionResult<Long>> results = runConcurrently(+1);

    assertThat(results).allMatch(TransitionResult::isSuccess);
    assertThat(playerRepository.findById(PLAYER).orElseThrow().karmaBalance())
        .isEqualTo(3 + CONCURRENT_CALLS);
  }

  @Test
  void concurrentDebitsNeverOverdraw() throws Exception {
    final List<TransitionResult<Long>> results = runConcurrently(-1);

    // 初期 karma 3 に対して 3 件だけ成功し、残りは残高不足になる
    assertThat(results.stream().filter(TransitionResult::isSuccess)).hasSize(3);
    assertThat(results.stream().filter(result -> !result.isSuccess()))
        .extracting(TransitionResult::error)
        .containsOnly(KarmaErrorCode.INSUFFICIENT_FUNDS)
        .hasSize(CONCURRENT_CALLS - 3);
    assertThat(playerRepository.findById(PLAYER).orElseThrow().karmaBalance()).isZero();
  }

  private List<TransitionResult<Long>> runConcurrently(long delta) throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(CONCURRENT_CALLS);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<TransitionResult<Long>>> futures = new ArrayList<>();
      for (int i = 0; i < CONCURRENT_CALLS; i++) {
        final Callable<TransitionResult<Long>> task =
            () -> {
              start.await();
              return ledgerService.adjustBalance(PLAYER, delta, BalanceKind.KARMA);
            };
        futures.add(executor.submit(task));
      }
      start.countDown();
      final List<TransitionResult<Long>> results = new ArrayList<>();
      for (Future<TransitionResult<Long>> future : futures) {
        results.add(future.get(COMPLETION_TIMEOUT.toSeconds(), TimeUnit.SECONDS));
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }
}
