package com.nexusbounty.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "nexus.reputation")
public class ReputationProperties {

    private int baseScore = 1000;
    private int correctPoints = 50;
    private int incorrectPenalty = -100;
    private int consensusBonus = 25;
    private int earlyBonus = 10;

    /**
     * Upper bound of the streak multiplier; each consecutive correct call adds 0.1.
     */
    private BigDecimal streakBonusCap = new BigDecimal("1.2");

    private BigDecimal decayRatePerDay = new BigDecimal("0.001");
    private int minScore = 0;
    private int maxScore = 10_000;

    private Decay decay = new Decay();

    @Getter
    @Setter
    public static class Decay {
        private boolean enabled = true;
        private long initialDelayMs = 60_000;
        private long intervalMs = 86_400_000;

        /**
         * Days without a submission before decay starts to apply.
         */
        private int inactivityGraceDays = 7;
    }
}
