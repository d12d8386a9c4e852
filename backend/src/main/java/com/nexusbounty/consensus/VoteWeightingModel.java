package com.nexusbounty.consensus;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns a vote into a bounded scalar weight.
 *
 * <pre>
 * weight = (reputation * Wr + confidence * Wc + time * Wt + stake * Ws) / (Wr + Wc + Wt + Ws)
 * </pre>
 *
 * Every factor lies in [0, 1], so the weight does too regardless of coefficient tuning.
 * Stateless and safe to share between threads.
 */
public class VoteWeightingModel {

    public static final int REPUTATION_CEILING = 10_000;
    public static final int WEIGHT_SCALE = 8;

    private static final BigDecimal HALF = new BigDecimal("0.5");

    private final WeightCoefficients coefficients;

    public VoteWeightingModel(WeightCoefficients coefficients) {
        if (coefficients == null) {
            throw new IllegalArgumentException("coefficients are required");
        }
        this.coefficients = coefficients;
    }

    public BigDecimal weight(SubmissionVote vote, VotingWindow window) {
        BigDecimal combined = reputationFactor(vote.reputationScore()).multiply(coefficients.reputationWeight())
                .add(vote.confidence().multiply(coefficients.confidenceWeight()))
                .add(timeFactor(vote, window).multiply(coefficients.timeWeight()))
                .add(stakeFactor(vote.stakeAmount()).multiply(coefficients.stakeWeight()));
        return combined.divide(coefficients.sum(), WEIGHT_SCALE, RoundingMode.HALF_UP);
    }

    BigDecimal reputationFactor(int reputationScore) {
        int bounded = Math.max(0, Math.min(reputationScore, REPUTATION_CEILING));
        return BigDecimal.valueOf(bounded).divide(BigDecimal.valueOf(REPUTATION_CEILING), WEIGHT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Constant 1.0 unless time decay is enabled, in which case the first half of the weight survives
     * at the close of the voting window.
     */
    BigDecimal timeFactor(SubmissionVote vote, VotingWindow window) {
        if (!coefficients.timeDecayEnabled() || window == null || !window.isBounded()) {
            return BigDecimal.ONE;
        }
        return BigDecimal.ONE.subtract(HALF.multiply(window.elapsedFraction(vote.submittedAt())));
    }

    BigDecimal stakeFactor(BigDecimal stakeAmount) {
        BigDecimal ratio = stakeAmount.divide(coefficients.stakeCeiling(), WEIGHT_SCALE, RoundingMode.HALF_UP);
        return ratio.min(BigDecimal.ONE);
    }
}
