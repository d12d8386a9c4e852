package com.nexusbounty.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nexusbounty.config.EventProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event queue shared by every instance through one Redis list per event type
 * ({@code <prefix>:bounty_completed}, {@code <prefix>:dispute_resolved}, ...).
 * <p>
 * Events that cannot be pushed are held in a bounded local buffer and pushed again, in order, before
 * the next drain reads from Redis. Payloads that no longer deserialize are moved to {@code <prefix>:dead}.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "nexus.events",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisBountyEventQueue implements BountyEventQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisBountyEventQueue.class);
    private static final ObjectMapper EVENT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private final StringRedisTemplate stringRedisTemplate;
    private final EventProperties eventProperties;

    private final Deque<BountyEvent> unpublished = new ConcurrentLinkedDeque<>();
    private final AtomicInteger unpublishedCount = new AtomicInteger();

    @Override
    public void enqueue(BountyEvent event) {
        BountyEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        String listKey = listKey(requiredEvent.eventType());
        // Keep publish order: nothing jumps ahead of events still waiting for Redis.
        if (unpublishedCount.get() > 0 || !push(listKey, requiredEvent)) {
            hold(requiredEvent);
        }
    }

    @Override
    public int drainTo(BountyEventConsumer consumer, int maxEvents) {
        if (!republishHeldEvents()) {
            return 0;
        }
        int delivered = 0;
        for (BountyEventType type : BountyEventType.values()) {
            String listKey = listKey(type);
            for (int i = 0; i < maxEvents; i++) {
                String payload;
                try {
                    payload = stringRedisTemplate.opsForList().leftPop(listKey);
                } catch (RuntimeException ex) {
                    log.warn("Redis unavailable while draining {}: {}", listKey, ex.getMessage());
                    return delivered;
                }
                if (payload == null) {
                    break;
                }
                BountyEvent event = decode(payload);
                if (event == null) {
                    continue;
                }
                try {
                    consumer.accept(event);
                    delivered++;
                } catch (RuntimeException ex) {
                    log.error("Dropping {} event for bounty {} after consumer failure", type, event.bountyId(), ex);
                }
            }
        }
        return delivered;
    }

    int unpublishedCount() {
        return unpublishedCount.get();
    }

    String listKey(BountyEventType type) {
        return keyPrefix() + ":" + Objects.requireNonNull(type, "eventType is required").name().toLowerCase(Locale.ROOT);
    }

    String deadLetterKey() {
        return keyPrefix() + ":dead";
    }

    private boolean republishHeldEvents() {
        BountyEvent next;
        while ((next = unpublished.peekFirst()) != null) {
            if (!push(listKey(next.eventType()), next)) {
                return false;
            }
            unpublished.pollFirst();
            unpublishedCount.decrementAndGet();
        }
        return true;
    }

    private boolean push(String listKey, BountyEvent event) {
        try {
            return stringRedisTemplate.opsForList().rightPush(listKey, encode(event)) != null;
        } catch (RuntimeException ex) {
            log.warn("Redis push to {} failed for bounty {}: {}", listKey, event.bountyId(), ex.getMessage());
            return false;
        }
    }

    private void hold(BountyEvent event) {
        int limit = Math.max(1, eventProperties.getMaxUnpublishedEvents());
        while (unpublishedCount.get() >= limit) {
            BountyEvent dropped = unpublished.pollFirst();
            if (dropped == null) {
                break;
            }
            unpublishedCount.decrementAndGet();
            log.error("Unpublished event buffer is full; dropping {} event for bounty {}",
                    dropped.eventType(), dropped.bountyId());
        }
        unpublished.offerLast(event);
        unpublishedCount.incrementAndGet();
    }

    private BountyEvent decode(String payload) {
        try {
            return EVENT_MAPPER.readValue(payload, BountyEvent.class);
        } catch (JsonProcessingException ex) {
            log.warn("Moving unreadable bounty event payload to {}: {}", deadLetterKey(), ex.getOriginalMessage());
            try {
                stringRedisTemplate.opsForList().rightPush(deadLetterKey(), payload);
            } catch (RuntimeException pushFailure) {
                log.error("Failed to dead-letter unreadable bounty event payload: {}", payload, pushFailure);
            }
            return null;
        }
    }

    private static String encode(BountyEvent event) {
        try {
            return EVENT_MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize bounty event", ex);
        }
    }

    private String keyPrefix() {
        String prefix = eventProperties.getRedisKeyPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException("nexus.events.redis-key-prefix must not be blank");
        }
        return prefix.trim();
    }
}
