package com.nexusbounty.consensus;

import java.math.BigDecimal;

/**
 * Agreement is the dominant category's share. A fragmented vote (low agreement) is open to dispute.
 */
public class AgreementEvaluator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public BigDecimal agreement(VerdictDistribution distribution) {
        return distribution.categories().values().stream()
                .map(VoteStats::percentage)
                .reduce(BigDecimal.ZERO, BigDecimal::max);
    }

    public boolean canDispute(BigDecimal agreementScore, BigDecimal disputeThreshold) {
        return agreementScore.compareTo(disputeThreshold.multiply(ONE_HUNDRED)) < 0;
    }
}
