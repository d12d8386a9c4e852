package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One engine's verdict as seen by the aggregation engine. Inputs are assumed validated at ingestion.
 */
public record SubmissionVote(
        UUID submissionId,
        String engineId,
        Verdict verdict,
        BigDecimal confidence,
        BigDecimal stakeAmount,
        int reputationScore,
        OffsetDateTime submittedAt
) {
    public SubmissionVote {
        if (submissionId == null) {
            throw new IllegalArgumentException("submissionId is required");
        }
        if (engineId == null || engineId.isBlank()) {
            throw new IllegalArgumentException("engineId is required");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict is required");
        }
        if (confidence == null || confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        if (stakeAmount == null || stakeAmount.signum() < 0) {
            throw new IllegalArgumentException("stakeAmount must be non-negative: " + stakeAmount);
        }
    }
}
