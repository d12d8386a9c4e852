package com.nexusbounty.consensus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;

public record VotingWindow(OffsetDateTime opensAt, OffsetDateTime closesAt) {

    public static final VotingWindow UNBOUNDED = new VotingWindow(null, null);

    public boolean isBounded() {
        return opensAt != null && closesAt != null && closesAt.isAfter(opensAt);
    }

    /**
     * Fraction of the window elapsed at the given instant, clamped to [0, 1]. Zero for unbounded windows.
     */
    public BigDecimal elapsedFraction(OffsetDateTime at) {
        if (!isBounded() || at == null || !at.isAfter(opensAt)) {
            return BigDecimal.ZERO;
        }
        if (!at.isBefore(closesAt)) {
            return BigDecimal.ONE;
        }
        long elapsedMillis = Duration.between(opensAt, at).toMillis();
        long totalMillis = Duration.between(opensAt, closesAt).toMillis();
        return BigDecimal.valueOf(elapsedMillis)
                .divide(BigDecimal.valueOf(totalMillis), 8, RoundingMode.HALF_UP);
    }
}
