package com.nexusbounty.consensus;

import java.math.BigDecimal;

public record ConsensusPolicy(
        BigDecimal threshold,
        int minSubmissions,
        boolean weightedVoting,
        BigDecimal disputeThreshold,
        VotingWindow window
) {
    public ConsensusPolicy {
        if (threshold == null || threshold.signum() < 0 || threshold.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        if (minSubmissions < 1) {
            throw new IllegalArgumentException("minSubmissions must be at least 1");
        }
        if (disputeThreshold == null || disputeThreshold.signum() < 0) {
            throw new IllegalArgumentException("disputeThreshold must be non-negative");
        }
        window = window == null ? VotingWindow.UNBOUNDED : window;
    }
}
