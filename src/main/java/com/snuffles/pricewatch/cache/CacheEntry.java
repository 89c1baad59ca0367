package com.snuffles.pricewatch.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with the instant it was fetched.
 */
public record CacheEntry<V>(V value, Instant fetchedAt) {

    public Duration age(Instant now) {
        Duration age = Duration.between(fetchedAt, now);
        // clock stepped backwards
        return age.isNegative() ? Duration.ZERO : age;
    }

    public Freshness classify(Instant now, CacheTtl ttl) {
        Duration age = age(now);
        if (age.compareTo(ttl.fresh()) < 0) {
            return Freshness.FRESH;
        }
        if (age.compareTo(ttl.staleMax()) < 0) {
            return Freshness.STALE;
        }
        return Freshness.EXPIRED;
    }
}
