package com.nexusbounty.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "nexus.events")
public class EventProperties {

    /**
     * {@code in_memory} or {@code redis}.
     */
    private String queueMode = "in_memory";

    /**
     * Each event type gets its own list under this prefix.
     */
    private String redisKeyPrefix = "nexus:bounty:events";

    private long dispatchIntervalMs = 1_000;
    private int dispatchBatchSize = 100;

    /**
     * Events held locally while Redis is unreachable; the oldest are dropped beyond this.
     */
    private int maxUnpublishedEvents = 10_000;
}
