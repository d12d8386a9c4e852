package com.nexusbounty.model;

/**
 * Classification of an analysed artifact.
 * Declaration order is the canonical category order used for output and tie-breaks.
 */
public enum Verdict {
    MALICIOUS,
    BENIGN,
    SUSPICIOUS,
    UNKNOWN;

    /**
     * Unknown carries no signal and can never win a bounty by crossing the consensus threshold.
     */
    public boolean isThresholdEligible() {
        return this != UNKNOWN;
    }
}
