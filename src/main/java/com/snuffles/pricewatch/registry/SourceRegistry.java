package com.snuffles.pricewatch.registry;

import com.snuffles.pricewatch.state.MarketStateLock;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Priority-ordered data sources with per-source circuit breaking.
 * <p>
 * After {@code maxFailCount} consecutive failures a source is muted for {@code muteDuration}
 * and its failure count starts over, so it has to fail a full run again after cooling down.
 * There is no separate half-open state: the first call after the mute window is the probe.
 */
@Slf4j
public class SourceRegistry {

    private final String scope;
    private final List<SourceDescriptor> sources;
    private final int maxFailCount;
    private final Duration muteDuration;
    private final MarketStateLock lock;
    private final Clock clock;

    public SourceRegistry(
        String scope,
        List<SourceDescriptor> sources,
        int maxFailCount,
        Duration muteDuration,
        MarketStateLock lock,
        Clock clock
    ) {
        if (maxFailCount < 1) {
            throw new IllegalArgumentException("maxFailCount must be at least 1");
        }
        this.scope = scope;
        this.sources = List.copyOf(sources);
        this.maxFailCount = maxFailCount;
        this.muteDuration = muteDuration;
        this.lock = lock;
        this.clock = clock;
    }

    public String getScope() {
        return scope;
    }

    public List<SourceDescriptor> getEnabledSources() {
        return Collections.unmodifiableList(sources.stream()
            .filter(SourceDescriptor::isEnabled)
            .collect(Collectors.toList()));
    }

    public boolean isMuted(SourceDescriptor source) {
        return lock.withLock(() -> clock.instant().isBefore(source.getMuteUntil()));
    }

    public void recordSuccess(SourceDescriptor source) {
        lock.runLocked(() -> {
            if (source.getFailCount() > 0 || !Instant.EPOCH.equals(source.getMuteUntil())) {
                log.debug("[{}] {} recovered after {} failure(s)", scope, source.getName(), source.getFailCount());
            }
            source.setFailCount(0);
            source.setMuteUntil(Instant.EPOCH);
        });
    }

    public void recordFailure(SourceDescriptor source) {
        lock.runLocked(() -> {
            int failures = source.getFailCount() + 1;
            if (failures >= maxFailCount) {
                Instant muteUntil = clock.instant().plus(muteDuration);
                source.setMuteUntil(muteUntil);
                source.setFailCount(0);
                log.warn("[{}] {} failed {} times in a row; muted for {}s until {}",
                    scope, source.getName(), failures, muteDuration.toSeconds(), muteUntil);
            } else {
                source.setFailCount(failures);
                log.debug("[{}] {} failure {}/{}", scope, source.getName(), failures, maxFailCount);
            }
        });
    }

    public List<SourceStatus> describe() {
        return lock.withLock(() -> {
            Instant now = clock.instant();
            return sources.stream()
                .map(s -> new SourceStatus(
                    s.getName(),
                    s.getType(),
                    s.isEnabled(),
                    s.getFailCount(),
                    s.getMuteUntil(),
                    now.isBefore(s.getMuteUntil())
                ))
                .collect(Collectors.toList());
        });
    }
}
