package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;
import java.util.List;

/**
 * Picks the final verdict from a distribution.
 * <p>
 * Threshold check order is Malicious, Benign, Suspicious: ties lean towards flagging content.
 * Unknown never wins on threshold. Without a threshold winner the highest weighted category wins,
 * ties going to the earlier category; an all-zero distribution yields Unknown with zero confidence.
 */
public class ConsensusResolver {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final List<Verdict> THRESHOLD_PRIORITY = List.of(
            Verdict.MALICIOUS,
            Verdict.BENIGN,
            Verdict.SUSPICIOUS
    );

    public ResolvedVerdict resolve(VerdictDistribution distribution, BigDecimal threshold) {
        BigDecimal thresholdPercent = threshold.multiply(ONE_HUNDRED);
        for (Verdict verdict : THRESHOLD_PRIORITY) {
            VoteStats stats = distribution.statsFor(verdict);
            if (stats.count() > 0 && stats.percentage().compareTo(thresholdPercent) >= 0) {
                return new ResolvedVerdict(verdict, stats.avgConfidence(), true);
            }
        }

        Verdict leader = null;
        BigDecimal leaderWeight = BigDecimal.ZERO;
        for (Verdict verdict : Verdict.values()) {
            BigDecimal weight = distribution.statsFor(verdict).weightedCount();
            if (weight.compareTo(leaderWeight) > 0) {
                leader = verdict;
                leaderWeight = weight;
            }
        }
        if (leader == null) {
            return new ResolvedVerdict(Verdict.UNKNOWN, BigDecimal.ZERO, false);
        }
        return new ResolvedVerdict(leader, distribution.statsFor(leader).avgConfidence(), false);
    }

    /**
     * Both conditions are required: a percentage-only result never counts as consensus.
     */
    public boolean isConsensusReached(ResolvedVerdict resolved, int eligibleSubmissions, int minSubmissions) {
        return resolved.thresholdMet() && eligibleSubmissions > 0 && eligibleSubmissions >= minSubmissions;
    }
}
