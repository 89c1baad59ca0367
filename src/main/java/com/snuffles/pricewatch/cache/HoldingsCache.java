package com.snuffles.pricewatch.cache;

import com.snuffles.pricewatch.service.HoldingsReport;
import com.snuffles.pricewatch.state.MarketStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Memoized holdings report. Every edit bumps the generation so a recompute that started
 * before the edit cannot store its result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HoldingsCache {

    private final MarketStateLock lock;

    private CacheEntry<HoldingsReport> entry;
    private long generation;

    public Optional<CacheEntry<HoldingsReport>> get() {
        return lock.withLock(() -> Optional.ofNullable(entry));
    }

    public long generation() {
        return lock.withLock(() -> generation);
    }

    public boolean storeIfCurrent(HoldingsReport report, Instant at, long expectedGeneration) {
        return lock.withLock(() -> {
            if (generation != expectedGeneration) {
                log.debug("Discarding holdings report computed for generation {} (now {})", expectedGeneration, generation);
                return false;
            }
            entry = new CacheEntry<>(report, at);
            return true;
        });
    }

    public void invalidate() {
        lock.runLocked(() -> {
            generation++;
            entry = null;
        });
    }
}
