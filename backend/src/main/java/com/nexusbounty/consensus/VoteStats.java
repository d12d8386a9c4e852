package com.nexusbounty.consensus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate for one verdict category.
 *
 * @param percentage share of the total weight, 0..100
 * @param voters engine ids in input order
 */
public record VoteStats(
        int count,
        BigDecimal weightedCount,
        BigDecimal percentage,
        BigDecimal avgConfidence,
        List<String> voters
) {
    public VoteStats {
        voters = List.copyOf(voters);
    }

    public static VoteStats empty() {
        return new VoteStats(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, List.of());
    }
}
