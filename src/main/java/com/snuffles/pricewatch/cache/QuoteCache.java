package com.snuffles.pricewatch.cache;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.state.MarketStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last good fund quote per code. Only valid quotes are stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuoteCache {

    private final MarketStateLock lock;
    private final Map<String, CacheEntry<Quote>> entries = new HashMap<>();

    public Optional<CacheEntry<Quote>> get(String code) {
        return lock.withLock(() -> Optional.ofNullable(entries.get(code)));
    }

    public void put(String code, Quote quote, Instant fetchedAt) {
        if (quote == null || !quote.isValid()) {
            log.debug("Refusing to cache invalid quote for {}", code);
            return;
        }
        lock.runLocked(() -> entries.put(code, new CacheEntry<>(quote, fetchedAt)));
    }

    public void remove(String code) {
        lock.runLocked(() -> entries.remove(code));
    }

    public int size() {
        return lock.withLock(entries::size);
    }
}
