package com.driftmonitor.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory drop box an upstream step publishes drift data into. Each publication
 * is consumed by at most one cycle.
 */
@Slf4j
@Component
public class HandoffChannel {

    private final ConcurrentHashMap<String, Publication> slots = new ConcurrentHashMap<>();

    public void publish(String channelRef, JsonNode payload) {
        slots.put(channelRef, new Publication(payload, Instant.now()));
        log.info("Handoff published | channel={}", channelRef);
    }

    public Optional<Publication> take(String channelRef) {
        return Optional.ofNullable(slots.remove(channelRef));
    }

    public boolean isPending(String channelRef) {
        return slots.containsKey(channelRef);
    }

    public record Publication(JsonNode payload, Instant publishedAt) {}
}
