package com.nexusbounty.service;

import com.nexusbounty.config.ReputationProperties;
import com.nexusbounty.model.EngineReputation;
import com.nexusbounty.repository.EngineReputationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Decays the reputation of engines that stopped submitting. Inactive days are counted from the end of
 * the grace period after the last submission, so an engine back within the grace window never decays.
 */
@Service
@RequiredArgsConstructor
public class ReputationDecayService {

    private static final Logger log = LoggerFactory.getLogger(ReputationDecayService.class);
    private static final BigDecimal MILLIS_PER_DAY = BigDecimal.valueOf(Duration.ofDays(1).toMillis());

    private final ReputationProperties reputationProperties;
    private final EngineReputationRepository engineReputationRepository;
    private final ReputationService reputationService;

    @Scheduled(
            fixedRateString = "${nexus.reputation.decay.interval-ms:86400000}",
            initialDelayString = "${nexus.reputation.decay.initial-delay-ms:60000}"
    )
    public void processDecayTick() {
        if (!reputationProperties.getDecay().isEnabled()) {
            return;
        }
        try {
            int decayed = applyDecay(OffsetDateTime.now());
            if (decayed > 0) {
                log.info("Reputation decay tick: enginesDecayed={}", decayed);
            } else {
                log.debug("Reputation decay tick completed with no score changes");
            }
        } catch (RuntimeException ex) {
            log.error("Reputation decay tick failed; will retry next cycle", ex);
        }
    }

    public int applyDecay(OffsetDateTime now) {
        int graceDays = reputationProperties.getDecay().getInactivityGraceDays();
        OffsetDateTime cutoff = now.minusDays(graceDays);
        List<EngineReputation> inactive = engineReputationRepository.findByLastActivityAtBefore(cutoff);

        int decayed = 0;
        for (EngineReputation reputation : inactive) {
            BigDecimal days = daysBetween(reputation.getLastActivityAt().plusDays(graceDays), now);
            if (days.signum() <= 0) {
                continue;
            }
            try {
                if (reputationService.applyDecay(reputation.getEngineId(), days, now)) {
                    decayed++;
                }
            } catch (RuntimeException ex) {
                log.error("Failed to decay reputation of engine {}", reputation.getEngineId(), ex);
            }
        }
        if (decayed > 0) {
            reputationService.refreshRankings();
        }
        return decayed;
    }

    static BigDecimal daysBetween(OffsetDateTime from, OffsetDateTime to) {
        if (from == null || !to.isAfter(from)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(Duration.between(from, to).toMillis())
                .divide(MILLIS_PER_DAY, 6, RoundingMode.DOWN);
    }
}
