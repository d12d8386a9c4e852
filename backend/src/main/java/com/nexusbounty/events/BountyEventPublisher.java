package com.nexusbounty.events;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;

/**
 * Hands events to the queue once the surrounding transaction commits. A rolled back
 * resolution therefore never notifies anyone.
 */
@Service
@RequiredArgsConstructor
public class BountyEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(BountyEventPublisher.class);

    private final BountyEventQueue bountyEventQueue;

    public void publish(BountyEvent event) {
        BountyEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishImmediately(requiredEvent);
                }
            });
            return;
        }
        publishImmediately(requiredEvent);
    }

    private void publishImmediately(BountyEvent event) {
        try {
            bountyEventQueue.enqueue(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to enqueue {} event for bounty {}", event.eventType(), event.bountyId(), ex);
        }
    }
}
