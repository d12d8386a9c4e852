package com.nexusbounty.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local queue with one FIFO per event type. Events are lost on restart.
 */
@Service
@ConditionalOnProperty(
        prefix = "nexus.events",
        name = "queue-mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryBountyEventQueue implements BountyEventQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBountyEventQueue.class);

    private final Map<BountyEventType, Queue<BountyEvent>> queues = new EnumMap<>(BountyEventType.class);

    public InMemoryBountyEventQueue() {
        for (BountyEventType type : BountyEventType.values()) {
            queues.put(type, new ConcurrentLinkedQueue<>());
        }
    }

    @Override
    public void enqueue(BountyEvent event) {
        BountyEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        queues.get(Objects.requireNonNull(requiredEvent.eventType(), "eventType is required")).offer(requiredEvent);
    }

    @Override
    public int drainTo(BountyEventConsumer consumer, int maxEvents) {
        int delivered = 0;
        for (Map.Entry<BountyEventType, Queue<BountyEvent>> entry : queues.entrySet()) {
            for (int i = 0; i < maxEvents; i++) {
                BountyEvent event = entry.getValue().poll();
                if (event == null) {
                    break;
                }
                try {
                    consumer.accept(event);
                    delivered++;
                } catch (RuntimeException ex) {
                    log.error("Dropping {} event for bounty {} after consumer failure",
                            entry.getKey(), event.bountyId(), ex);
                }
            }
        }
        return delivered;
    }

    int pendingCount() {
        return queues.values().stream().mapToInt(Queue::size).sum();
    }
}
