package com.nexusbounty.consensus;

import com.nexusbounty.model.Verdict;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-category vote aggregates. All four categories are always present and iterate in canonical order.
 */
public record VerdictDistribution(Map<Verdict, VoteStats> categories) {

    public VerdictDistribution {
        Map<Verdict, VoteStats> ordered = new LinkedHashMap<>();
        for (Verdict verdict : Verdict.values()) {
            VoteStats stats = categories == null ? null : categories.get(verdict);
            ordered.put(verdict, stats == null ? VoteStats.empty() : stats);
        }
        categories = Collections.unmodifiableMap(ordered);
    }

    public static VerdictDistribution empty() {
        return new VerdictDistribution(Map.of());
    }

    public VoteStats statsFor(Verdict verdict) {
        return categories.get(verdict);
    }

    public int totalCount() {
        return categories.values().stream().mapToInt(VoteStats::count).sum();
    }

    public BigDecimal totalWeight() {
        return categories.values().stream()
                .map(VoteStats::weightedCount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
