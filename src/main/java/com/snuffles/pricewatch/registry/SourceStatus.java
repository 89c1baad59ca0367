package com.snuffles.pricewatch.registry;

import java.time.Instant;

/**
 * Read-only view of a source's breaker state.
 */
public record SourceStatus(
    String name,
    String type,
    boolean enabled,
    int failCount,
    Instant muteUntil,
    boolean muted
) {
}
