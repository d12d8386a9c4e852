package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;

/**
 * Outcome of one evaluation pass. Recomputed on demand; the latest copy is cached on the bounty.
 *
 * @param confidence average confidence of the submissions matching the final verdict
 * @param weightedScore winning category's share of the total weight, 0..1
 * @param agreementScore dominant category's percentage, 0..100
 */
public record ConsensusResult(
        Verdict finalVerdict,
        BigDecimal confidence,
        int totalSubmissions,
        VerdictDistribution verdictDistribution,
        BigDecimal weightedScore,
        boolean consensusReached,
        BigDecimal agreementScore,
        boolean disputeEligible
) {
}
