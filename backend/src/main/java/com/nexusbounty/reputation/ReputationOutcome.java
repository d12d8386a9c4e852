package com.nexusbounty.reputation;

import java.math.BigDecimal;

/**
 * Result of one scored submission as seen by the reputation scorer.
 *
 * @param inConsensus the submission was correct and the bounty reached consensus
 * @param wasEarly the submission arrived inside the early part of the voting window
 */
public record ReputationOutcome(boolean correct, BigDecimal confidence, boolean inConsensus, boolean wasEarly) {

    public ReputationOutcome {
        if (confidence == null || confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }
}
