package com.nexusbounty.events;

@FunctionalInterface
public interface BountyEventConsumer {

    void accept(BountyEvent event);
}
