package com.nexusbounty.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Settlement and payout execution settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "nexus.settlement")
public class SettlementProperties {

    /**
     * Share of an incorrect stake sent to the treasury. The remainder is returned.
     */
    private BigDecimal slashFraction = BigDecimal.ONE;

    /**
     * Share of the reward pool kept by the platform before distribution.
     */
    private BigDecimal platformFeeRate = BigDecimal.ZERO;

    private String treasuryAddress = "0x000000000000000000000000000000000000dEaD";
    private BigDecimal minDisputeStake = new BigDecimal("10");

    private Payment payment = new Payment();

    @Getter
    @Setter
    public static class Payment {
        private String mode = "mock";
        private boolean enabled = true;
        private long initialDelayMs = 15_000;
        private long pollIntervalMs = 30_000;
        private int batchSize = 50;
        private int maxAttempts = 5;
        private long initialBackoffMs = 30_000;
        private long maxBackoffMs = 3_600_000;

        /**
         * How long a payout may sit in PROCESSING before the sweep charges it a failed attempt.
         */
        private long processingLeaseMs = 900_000;
    }
}
