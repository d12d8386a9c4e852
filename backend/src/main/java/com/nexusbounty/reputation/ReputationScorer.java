package com.nexusbounty.reputation;

import com.nexusbounty.config.ReputationProperties;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Integer reputation arithmetic. Fractional points are truncated towards zero at each step,
 * and every stored score is clamped to the configured range.
 */
public class ReputationScorer {

    private static final BigDecimal STREAK_STEP = new BigDecimal("0.1");
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final ReputationProperties properties;

    public ReputationScorer(ReputationProperties properties) {
        this.properties = properties;
    }

    /**
     * @param currentStreak consecutive correct calls before this outcome
     */
    public int scoreChange(int currentStreak, ReputationOutcome outcome) {
        BigDecimal change = BigDecimal.valueOf(
                outcome.correct() ? properties.getCorrectPoints() : properties.getIncorrectPenalty());

        if (outcome.correct() && currentStreak > 0) {
            BigDecimal multiplier = BigDecimal.ONE
                    .add(STREAK_STEP.multiply(BigDecimal.valueOf(currentStreak)))
                    .min(properties.getStreakBonusCap());
            change = change.multiply(multiplier).setScale(0, RoundingMode.DOWN);
        }
        if (outcome.inConsensus()) {
            change = change.add(BigDecimal.valueOf(properties.getConsensusBonus()));
        }
        if (outcome.wasEarly()) {
            change = change.add(BigDecimal.valueOf(properties.getEarlyBonus()));
        }
        return change.multiply(outcome.confidence()).setScale(0, RoundingMode.DOWN).intValueExact();
    }

    public int applyChange(int currentScore, int change) {
        return clamp((long) currentScore + change);
    }

    /**
     * Linear decay, {@code score * (1 - rate * days)}, never below the configured minimum.
     */
    public int applyDecay(int currentScore, BigDecimal daysInactive) {
        if (daysInactive == null || daysInactive.signum() <= 0) {
            return clamp(currentScore);
        }
        BigDecimal factor = BigDecimal.ONE
                .subtract(properties.getDecayRatePerDay().multiply(daysInactive))
                .max(BigDecimal.ZERO);
        long decayed = BigDecimal.valueOf(currentScore).multiply(factor).setScale(0, RoundingMode.DOWN).longValue();
        return clamp(decayed);
    }

    public int clamp(long score) {
        return (int) Math.max(properties.getMinScore(), Math.min(properties.getMaxScore(), score));
    }

    public int baseScore() {
        return clamp(properties.getBaseScore());
    }

    public static BigDecimal accuracyRate(int correct, int total) {
        if (total <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(correct).divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_UP);
    }

    /**
     * Rank 1 of N is the 100th percentile.
     */
    public static BigDecimal percentile(int rank, int total) {
        if (total <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf((long) total - rank + 1)
                .multiply(ONE_HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}
