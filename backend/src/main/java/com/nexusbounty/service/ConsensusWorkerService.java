package com.nexusbounty.service;

import com.nexusbounty.config.ConsensusProperties;
import com.nexusbounty.model.Bounty;
import com.nexusbounty.model.BountyStatus;
import com.nexusbounty.repository.BountyRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Periodic consensus loop. Every open bounty is evaluated in its own transaction; a failure on one
 * bounty is logged and the loop moves on, leaving that bounty open for the next tick.
 */
@Service
@RequiredArgsConstructor
public class ConsensusWorkerService {

    private static final Logger log = LoggerFactory.getLogger(ConsensusWorkerService.class);

    private final ConsensusProperties consensusProperties;
    private final BountyRepository bountyRepository;
    private final BountyResolutionService bountyResolutionService;
    private final TransactionTemplate transactionTemplate;

    @Scheduled(
            fixedRateString = "${nexus.consensus.worker.interval-ms:60000}",
            initialDelayString = "${nexus.consensus.worker.initial-delay-ms:10000}"
    )
    public void runScheduledTick() {
        if (!consensusProperties.getWorker().isEnabled()) {
            return;
        }
        TickSummary tickSummary = processConsensusTick(OffsetDateTime.now());
        if (tickSummary.hasWork()) {
            log.info(
                    "Consensus worker tick: evaluated={}, resolved={}, expired={}, waiting={}, failed={}",
                    tickSummary.evaluated(),
                    tickSummary.resolved(),
                    tickSummary.expired(),
                    tickSummary.waiting(),
                    tickSummary.failed()
            );
        } else {
            log.debug("Consensus worker tick completed with no open bounties");
        }
    }

    public TickSummary processConsensusTick(OffsetDateTime now) {
        List<UUID> openBountyIds = bountyRepository.findByStatusOrderByCreatedAtAsc(BountyStatus.OPEN).stream()
                .map(Bounty::getBountyId)
                .toList();

        int resolved = 0;
        int expired = 0;
        int waiting = 0;
        int failed = 0;
        for (UUID bountyId : openBountyIds) {
            try {
                BountyResolutionService.BountyEvaluation evaluation = transactionTemplate.execute(
                        status -> bountyResolutionService.evaluateBounty(bountyId, now));
                if (evaluation == null) {
                    continue;
                }
                switch (evaluation.outcome()) {
                    case RESOLVED -> resolved++;
                    case EXPIRED -> expired++;
                    case WAITING -> waiting++;
                    case SKIPPED, LOST_RACE -> {
                    }
                }
            } catch (RuntimeException ex) {
                failed++;
                log.error("Failed to evaluate bounty {}; will retry next cycle", bountyId, ex);
            }
        }
        return new TickSummary(openBountyIds.size(), resolved, expired, waiting, failed);
    }

    public record TickSummary(int evaluated, int resolved, int expired, int waiting, int failed) {
        public boolean hasWork() {
            return resolved > 0 || expired > 0 || failed > 0;
        }
    }
}
