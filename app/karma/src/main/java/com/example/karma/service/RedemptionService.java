/*
 * どこで: Karma サービス層
 * 何を: 引き換えコードの発行と消費(karma 付与)を行う
 * なぜ: 回数上限とユーザー別上限を守ったまま karma を配布するため
 */
package com.example.karma.service;

import com.example.karma.model.LedgerEntryType;
import com.example.karma.model.RedemptionCodeRecord;
import com.example.karma.model.RedemptionReceipt;
import com.example.karma.repository.RedemptionCodeRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class RedemptionService {

    private static final Logger logger = LoggerFactory.getLogger(RedemptionService.class);
    private static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 8;
    private static final int MAX_GENERATE_ATTEMPTS = 5;

    private final RedemptionCodeRepository redemptionCodeRepository;
    private final PlayerService playerService;
    private final LedgerService ledgerService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public RedemptionService(
            RedemptionCodeRepository redemptionCodeRepository,
            PlayerService playerService,
            LedgerService ledgerService,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.redemptionCodeRepository = redemptionCodeRepository;
        this.playerService = playerService;
        this.ledgerService = ledgerService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public TransitionResult<RedemptionCodeRecord> createCode(
            int karmaValue, int maxRedemptions, int perUserLimit, Instant activeFrom, Instant expiresAt) {
        if (karmaValue <= 0 || maxRedemptions <= 0 || perUserLimit <= 0) {
            return TransitionResult.failure(
                    KarmaErrorCode.VALIDATION_ERROR,
                    "karma value, max redemptions and per user limit must be positive");
        }
        if (activeFrom != null && expiresAt != null && !expiresAt.isAfter(activeFrom)) {
            return TransitionResult.failure(
                    KarmaErrorCode.VALIDATION_ERROR, "expires_at must be after active_from");
        }
        final Instant now = Instant.now(clock);
        for (int attempt = 0; attempt < MAX_GENERATE_ATTEMPTS; attempt++) {
            final String code = generateCode();
            if (redemptionCodeRepository.insert(
                    code, karmaValue, maxRedemptions, perUserLimit, activeFrom, expiresAt, now) > 0) {
                logger.info("redemption code created code={} karmaValue={} maxRedemptions={}",
                        code, karmaValue, maxRedemptions);
                return TransitionResult.success(redemptionCodeRepository.findByCode(code)
                        .orElseThrow(() -> new IllegalStateException("redemption code vanished: " + code)));
            }
        }
        throw new IllegalStateException("failed to generate a unique redemption code");
    }

    /** コードを 1 回消費して karma を付与する。コードは大文字に正規化して照合する。 */
    public TransitionResult<RedemptionReceipt> redeem(String rawCode, String playerId) {
        if (rawCode == null || rawCode.isBlank()) {
            return TransitionResult.failure(KarmaErrorCode.VALIDATION_ERROR, "code is required");
        }
        final String code = rawCode.trim().toUpperCase(Locale.ROOT);
        final Instant now = Instant.now(clock);
        try {
            return TransitionResult.success(transactionTemplate.execute(status -> {
                playerService.ensureExists(playerId, now);
                final RedemptionCodeRecord current = redemptionCodeRepository.findByCode(code)
                        .orElseThrow(() -> new LifecycleException(
                                KarmaErrorCode.NOT_FOUND, "redemption code not found: " + code));
                if (!current.isActiveAt(now)) {
                    throw new LifecycleException(KarmaErrorCode.CONFLICT, "redemption code is not active");
                }
                final int claimed = redemptionCodeRepository.countClaims(code, playerId);
                if (claimed >= current.perUserLimit()) {
                    throw new LifecycleException(KarmaErrorCode.CONFLICT, "redemption limit reached for player");
                }
                final RedemptionCodeRecord consumed = redemptionCodeRepository.incrementIfAvailable(code, now)
                        .orElseThrow(() -> new LifecycleException(
                                KarmaErrorCode.CONFLICT, "redemption code is exhausted"));
                final int claimSeq = claimed + 1;
                // 同一プレイヤーの並行消費は claim_seq の主キー衝突で 1 件だけ通す
                if (redemptionCodeRepository.insertClaim(code, playerId, claimSeq, now) == 0) {
                    throw new LifecycleException(KarmaErrorCode.CONFLICT, "redemption already in progress");
                }
                final long balance = ledgerService.credit(
                        playerId,
                        consumed.karmaValue(),
                        "redemption:" + code + ":" + claimSeq,
                        LedgerEntryType.REDEMPTION,
                        now);
                logger.info("redemption code redeemed code={} playerId={} karmaValue={}",
                        code, playerId, consumed.karmaValue());
                return new RedemptionReceipt(code, playerId, consumed.karmaValue(), balance);
            }));
        } catch (LifecycleException ex) {
            return TransitionResult.from(ex);
        }
    }

    private String generateCode() {
        final StringBuilder builder = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            builder.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return builder.toString();
    }
}
