package com.snuffles.pricewatch.registry;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * A configured upstream data source. Identity and timeout are fixed at startup; the breaker
 * fields are only changed by {@link SourceRegistry} while holding the market state lock.
 */
@Getter
@ToString
public class SourceDescriptor {

    private final String name;
    private final String type;
    private final boolean enabled;
    private final Duration timeout;

    @Setter(AccessLevel.PACKAGE)
    private int failCount;

    @Setter(AccessLevel.PACKAGE)
    private Instant muteUntil = Instant.EPOCH;

    public SourceDescriptor(String name, String type, boolean enabled, Duration timeout) {
        this.name = name;
        this.type = type;
        this.enabled = enabled;
        this.timeout = timeout;
    }
}
