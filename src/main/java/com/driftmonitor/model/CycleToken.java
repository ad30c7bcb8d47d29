package com.driftmonitor.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Scopes a single coordinator run. {@code runKey} is the nominal run identity
 * shared by every instance that fires for the same schedule slot.
 */
public record CycleToken(UUID id, String runKey, Instant issuedAt) {

    public static CycleToken issue(String runKey) {
        return new CycleToken(UUID.randomUUID(), runKey, Instant.now());
    }
}
