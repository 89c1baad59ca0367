package com.snuffles.pricewatch.cache;

import java.time.Duration;

/**
 * Fresh and stale-max bounds for one cached value type; {@code fresh} must not exceed {@code staleMax}.
 */
public record CacheTtl(Duration fresh, Duration staleMax) {

    public CacheTtl {
        if (fresh == null || staleMax == null) {
            throw new IllegalArgumentException("TTL bounds are required");
        }
        if (fresh.compareTo(staleMax) > 0) {
            throw new IllegalArgumentException("fresh TTL " + fresh + " exceeds stale-max " + staleMax);
        }
    }
}
