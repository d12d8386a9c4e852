package com.nexusbounty.events;

import com.nexusbounty.model.Verdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BountyEventPublisherTest {

    @Mock
    private BountyEventQueue bountyEventQueue;

    @InjectMocks
    private BountyEventPublisher bountyEventPublisher;

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void publishesImmediatelyOutsideTransaction() {
        BountyEvent event = event();

        bountyEventPublisher.publish(event);

        verify(bountyEventQueue).enqueue(event);
    }

    @Test
    void defersPublicationUntilCommit() {
        BountyEvent event = event();
        TransactionSynchronizationManager.initSynchronization();

        bountyEventPublisher.publish(event);

        verifyNoInteractions(bountyEventQueue);
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        verify(bountyEventQueue).enqueue(event);
    }

    @Test
    void queueFailureDoesNotPropagate() {
        BountyEvent event = event();
        doThrow(new IllegalStateException("Bounty event queue is not running")).when(bountyEventQueue).enqueue(event);

        bountyEventPublisher.publish(event);

        verify(bountyEventQueue).enqueue(event);
    }

    private static BountyEvent event() {
        return new BountyEvent(
                BountyEventType.BOUNTY_EXPIRED,
                UUID.randomUUID(),
                Verdict.UNKNOWN,
                BigDecimal.ZERO,
                List.of("engine-a"),
                null,
                OffsetDateTime.parse("2026-03-02T10:15:30Z")
        );
    }
}
