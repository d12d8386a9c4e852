package com.nexusbounty.consensus;

import java.math.BigDecimal;

public record WeightCoefficients(
        BigDecimal reputationWeight,
        BigDecimal confidenceWeight,
        BigDecimal timeWeight,
        BigDecimal stakeWeight,
        BigDecimal stakeCeiling,
        boolean timeDecayEnabled
) {
    public WeightCoefficients {
        requireNonNegative("reputationWeight", reputationWeight);
        requireNonNegative("confidenceWeight", confidenceWeight);
        requireNonNegative("timeWeight", timeWeight);
        requireNonNegative("stakeWeight", stakeWeight);
        if (stakeCeiling == null || stakeCeiling.signum() <= 0) {
            throw new IllegalArgumentException("stakeCeiling must be positive");
        }
        if (reputationWeight.add(confidenceWeight).add(timeWeight).add(stakeWeight).signum() == 0) {
            throw new IllegalArgumentException("at least one weight coefficient must be positive");
        }
    }

    public BigDecimal sum() {
        return reputationWeight.add(confidenceWeight).add(timeWeight).add(stakeWeight);
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
