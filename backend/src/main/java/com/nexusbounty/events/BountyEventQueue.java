package com.nexusbounty.events;

/**
 * Outbound bounty events waiting for fan-out. Producers enqueue; {@link BountyNotificationService}
 * drains on a fixed delay.
 */
public interface BountyEventQueue {

    void enqueue(BountyEvent event);

    /**
     * Hands queued events to {@code consumer}, at most {@code maxEvents} per event type.
     * A consumer failure is logged and the event is not redelivered.
     *
     * @return number of events the consumer accepted
     */
    int drainTo(BountyEventConsumer consumer, int maxEvents);
}
