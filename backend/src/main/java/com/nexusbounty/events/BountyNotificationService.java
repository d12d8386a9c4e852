package com.nexusbounty.events;

import com.nexusbounty.config.EventProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drains bounty events and fans them out to participants. Delivery is best effort.
 */
@Service
@RequiredArgsConstructor
public class BountyNotificationService {

    private static final Logger log = LoggerFactory.getLogger(BountyNotificationService.class);

    private final BountyEventQueue bountyEventQueue;
    private final EventProperties eventProperties;

    @Scheduled(fixedDelayString = "${nexus.events.dispatch-interval-ms:1000}")
    public void dispatchPending() {
        int delivered = bountyEventQueue.drainTo(this::deliver, Math.max(1, eventProperties.getDispatchBatchSize()));
        if (delivered > 0) {
            log.debug("Dispatched {} bounty events", delivered);
        }
    }

    void deliver(BountyEvent event) {
        log.info("Bounty {} {}: verdict={}, confidence={}, participants={}",
                event.bountyId(), event.eventType(), event.finalVerdict(), event.confidence(),
                event.participantIds().size());
        for (String participantId : event.participantIds()) {
            try {
                notifyParticipant(participantId, event);
            } catch (RuntimeException ex) {
                log.warn("Failed to notify participant {} about bounty {}", participantId, event.bountyId(), ex);
            }
        }
    }

    private void notifyParticipant(String participantId, BountyEvent event) {
        log.debug("Notified {} of {} for bounty {}", participantId, event.eventType(), event.bountyId());
    }
}
