package com.nexusbounty.service;

import com.nexusbounty.config.SettlementProperties;
import com.nexusbounty.model.Payout;
import com.nexusbounty.model.PayoutStatus;
import com.nexusbounty.payment.PaymentExecutionException;
import com.nexusbounty.payment.PaymentGateway;
import com.nexusbounty.payment.PayoutInstruction;
import com.nexusbounty.payment.TransactionHandle;
import com.nexusbounty.repository.PayoutRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Executes pending payouts. A payout is claimed with a PENDING to PROCESSING compare-and-swap, so
 * overlapping runs never execute the same payout twice. Failures are retried with capped
 * exponential backoff until the attempt budget runs out. A claim held in PROCESSING past the
 * configured lease is treated as a failed attempt, so a crash between claim and record never
 * leaves the payout stranded.
 */
@Service
@RequiredArgsConstructor
public class PayoutProcessorService {

    private static final Logger log = LoggerFactory.getLogger(PayoutProcessorService.class);
    private static final int MAX_ERROR_LENGTH = 512;

    private final SettlementProperties settlementProperties;
    private final PayoutRepository payoutRepository;
    private final PaymentGateway paymentGateway;
    private final TransactionTemplate transactionTemplate;

    @Scheduled(
            fixedRateString = "${nexus.settlement.payment.poll-interval-ms:30000}",
            initialDelayString = "${nexus.settlement.payment.initial-delay-ms:15000}"
    )
    public void processPayoutTick() {
        if (!settlementProperties.getPayment().isEnabled()) {
            return;
        }
        PayoutTickSummary summary = processDuePayouts(OffsetDateTime.now());
        if (summary.hasWork()) {
            log.info(
                    "Payout tick: completed={}, rescheduled={}, failed={}, recovered={}",
                    summary.completed(),
                    summary.rescheduled(),
                    summary.failed(),
                    summary.recovered()
            );
        } else {
            log.debug("Payout tick completed with no due payouts");
        }
    }

    public PayoutTickSummary processDuePayouts(OffsetDateTime now) {
        int batchSize = Math.max(1, settlementProperties.getPayment().getBatchSize());
        int completed = 0;
        int rescheduled = 0;
        int failed = 0;
        int recovered = 0;

        OffsetDateTime leaseCutoff = now.minus(Duration.ofMillis(settlementProperties.getPayment().getProcessingLeaseMs()));
        for (Payout stale : payoutRepository.findStaleProcessing(leaseCutoff, PageRequest.of(0, batchSize))) {
            try {
                PayoutResult result = recoverStaleClaim(stale.getPayoutId(), leaseCutoff, now);
                if (result == PayoutResult.SKIPPED) {
                    continue;
                }
                recovered++;
                if (result == PayoutResult.FAILED) {
                    failed++;
                }
            } catch (RuntimeException ex) {
                log.error("Failed to recover stale payout claim {}", stale.getPayoutId(), ex);
            }
        }

        List<Payout> due = payoutRepository.findDuePending(now, PageRequest.of(0, batchSize));
        for (Payout payout : due) {
            try {
                switch (processPayout(payout, now)) {
                    case COMPLETED -> completed++;
                    case RESCHEDULED -> rescheduled++;
                    case FAILED -> failed++;
                    case SKIPPED -> {
                    }
                }
            } catch (RuntimeException ex) {
                log.error("Failed to process payout {}; will retry next cycle", payout.getPayoutId(), ex);
            }
        }
        return new PayoutTickSummary(completed, rescheduled, failed, recovered);
    }

    PayoutResult processPayout(Payout payout, OffsetDateTime now) {
        UUID payoutId = payout.getPayoutId();
        Integer claimed = transactionTemplate.execute(status ->
                payoutRepository.compareAndSetStatus(payoutId, PayoutStatus.PENDING, PayoutStatus.PROCESSING, now));
        if (claimed == null || claimed == 0) {
            log.debug("Payout {} was claimed by another worker", payoutId);
            return PayoutResult.SKIPPED;
        }

        if (!isValidRecipient(payout.getRecipient())) {
            return recordFailure(payoutId, "Invalid recipient address: " + payout.getRecipient(), false, now);
        }

        PayoutInstruction instruction = new PayoutInstruction(
                payoutId,
                payout.getIdempotencyKey(),
                payout.getRecipient(),
                payout.getAmount(),
                payout.getPayoutType()
        );
        TransactionHandle handle;
        try {
            handle = paymentGateway.execute(instruction);
        } catch (PaymentExecutionException ex) {
            return recordFailure(payoutId, ex.getMessage(), ex.isRetryable(), now);
        } catch (RuntimeException ex) {
            log.error("Payment gateway error for payout {}", payoutId, ex);
            return recordFailure(payoutId, "Gateway error: " + ex, true, now);
        }
        return recordSuccess(payoutId, handle, now);
    }

    /**
     * Charges an attempt to a payout whose PROCESSING claim outlived the lease. The idempotency key
     * sent with the retry keeps a payment that did go through from being executed twice.
     */
    PayoutResult recoverStaleClaim(UUID payoutId, OffsetDateTime leaseCutoff, OffsetDateTime now) {
        PayoutResult result = transactionTemplate.execute(status -> {
            Payout payout = payoutRepository.findById(payoutId).orElse(null);
            if (payout == null
                    || payout.getStatus() != PayoutStatus.PROCESSING
                    || payout.getUpdatedAt() == null
                    || !payout.getUpdatedAt().isBefore(leaseCutoff)) {
                return PayoutResult.SKIPPED;
            }
            return applyFailure(payout, "Processing lease expired", true, now);
        });
        if (result != PayoutResult.SKIPPED) {
            log.warn("Recovered stale claim on payout {}: {}", payoutId, result);
        }
        return result;
    }

    static boolean isValidRecipient(String address) {
        if (address == null || !address.startsWith("0x")) {
            return false;
        }
        String hex = Numeric.cleanHexPrefix(address);
        return hex.length() == Keys.ADDRESS_LENGTH_IN_HEX
                && hex.chars().allMatch(c -> Character.digit(c, 16) >= 0);
    }

    /**
     * Delay before the next attempt after {@code attempts} failures:
     * {@code initial * 2^(attempts - 1)}, capped at the configured maximum.
     */
    long backoffMillis(int attempts) {
        SettlementProperties.Payment payment = settlementProperties.getPayment();
        int exponent = Math.max(0, Math.min(attempts - 1, 30));
        long delay = payment.getInitialBackoffMs() * (1L << exponent);
        if (delay < 0 || delay > payment.getMaxBackoffMs()) {
            return payment.getMaxBackoffMs();
        }
        return delay;
    }

    private PayoutResult recordSuccess(UUID payoutId, TransactionHandle handle, OffsetDateTime now) {
        transactionTemplate.executeWithoutResult(status -> {
            Payout payout = payoutRepository.findById(payoutId)
                    .orElseThrow(() -> new IllegalStateException("Payout disappeared: " + payoutId));
            payout.setStatus(PayoutStatus.COMPLETED);
            payout.setTransactionHash(handle.transactionHash());
            payout.setAttempts(payout.getAttempts() + 1);
            payout.setLastError(null);
            payout.setNextAttemptAt(null);
            payout.setProcessedAt(now);
            payout.setUpdatedAt(now);
            payoutRepository.save(payout);
        });
        log.info("Payout {} completed with transaction {}", payoutId, handle.transactionHash());
        return PayoutResult.COMPLETED;
    }

    private PayoutResult recordFailure(UUID payoutId, String error, boolean retryable, OffsetDateTime now) {
        PayoutResult result = transactionTemplate.execute(status -> applyFailure(
                payoutRepository.findById(payoutId)
                        .orElseThrow(() -> new IllegalStateException("Payout disappeared: " + payoutId)),
                error, retryable, now));
        if (result == PayoutResult.FAILED) {
            log.warn("Payout {} failed permanently: {}", payoutId, error);
        } else {
            log.warn("Payout {} attempt failed, rescheduled: {}", payoutId, error);
        }
        return result;
    }

    private PayoutResult applyFailure(Payout payout, String error, boolean retryable, OffsetDateTime now) {
        int attempts = payout.getAttempts() + 1;
        payout.setAttempts(attempts);
        payout.setLastError(truncate(error));
        payout.setUpdatedAt(now);
        if (!retryable || attempts >= settlementProperties.getPayment().getMaxAttempts()) {
            payout.setStatus(PayoutStatus.FAILED);
            payout.setNextAttemptAt(null);
            payoutRepository.save(payout);
            return PayoutResult.FAILED;
        }
        payout.setStatus(PayoutStatus.PENDING);
        payout.setNextAttemptAt(now.plus(Duration.ofMillis(backoffMillis(attempts))));
        payoutRepository.save(payout);
        return PayoutResult.RESCHEDULED;
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }

    enum PayoutResult {
        COMPLETED,
        RESCHEDULED,
        FAILED,
        SKIPPED
    }

    /**
     * @param recovered stale PROCESSING claims returned to PENDING or failed by the lease sweep
     */
    public record PayoutTickSummary(int completed, int rescheduled, int failed, int recovered) {
        public boolean hasWork() {
            return completed > 0 || rescheduled > 0 || failed > 0 || recovered > 0;
        }
    }
}
