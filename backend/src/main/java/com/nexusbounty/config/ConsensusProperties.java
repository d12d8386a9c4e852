package com.nexusbounty.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Consensus engine defaults. Bounties may override threshold, minimum submissions and voting mode.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "nexus.consensus")
public class ConsensusProperties {

    private int minSubmissions = 3;
    private BigDecimal threshold = new BigDecimal("0.66");
    private boolean weightedVoting = true;

    /**
     * Results whose dominant category share stays below this fraction are open to dispute.
     */
    private BigDecimal disputeThreshold = new BigDecimal("0.40");

    /**
     * Submissions in this leading fraction of the voting window earn the early bonus.
     */
    private BigDecimal earlySubmissionWindowFraction = new BigDecimal("0.20");

    private Weights weights = new Weights();
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Weights {
        private BigDecimal reputation = new BigDecimal("0.5");
        private BigDecimal confidence = new BigDecimal("0.3");
        private BigDecimal time = new BigDecimal("0.2");
        private BigDecimal stake = new BigDecimal("0.2");
        private BigDecimal stakeCeiling = new BigDecimal("10000");
        private boolean timeDecayEnabled = false;
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        private long initialDelayMs = 10_000;
        private long intervalMs = 60_000;
    }
}
