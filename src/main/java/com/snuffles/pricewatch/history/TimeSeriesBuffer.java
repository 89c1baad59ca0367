package com.snuffles.pricewatch.history;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.state.MarketStateLock;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bounded, insertion-ordered gold price history. When full, appending evicts the oldest point.
 */
@Slf4j
public class TimeSeriesBuffer {

    private final int capacity;
    private final MarketStateLock lock;
    private final Deque<Quote> points;

    public TimeSeriesBuffer(int capacity, MarketStateLock lock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.lock = lock;
        this.points = new ArrayDeque<>(capacity);
    }

    public int getCapacity() {
        return capacity;
    }

    public void append(Quote quote) {
        if (quote == null || !quote.isValid()) {
            log.debug("Ignoring invalid price point {}", quote);
            return;
        }
        lock.runLocked(() -> {
            if (points.size() == capacity) {
                points.removeFirst();
            }
            points.addLast(quote);
        });
    }

    public Optional<Quote> latest() {
        return lock.withLock(() -> Optional.ofNullable(points.peekLast()));
    }

    public List<Quote> snapshot() {
        return lock.withLock(() -> List.copyOf(points));
    }

    public int size() {
        return lock.withLock(points::size);
    }

    public Optional<PriceSummary> summarize() {
        return PriceSummary.of(snapshot());
    }

    /**
     * Drops every point stamped before {@code cutoff}. Points without a timestamp are dropped too.
     */
    public int pruneBefore(Instant cutoff) {
        return lock.withLock(() -> {
            int before = points.size();
            points.removeIf(q -> q.getTimestamp() == null || q.getTimestamp().isBefore(cutoff));
            return before - points.size();
        });
    }

    public void replaceAll(Collection<Quote> restored) {
        List<Quote> valid = restored.stream().filter(Quote::isValid).collect(Collectors.toList());
        List<Quote> kept = valid.subList(Math.max(0, valid.size() - capacity), valid.size());
        lock.runLocked(() -> {
            points.clear();
            points.addAll(kept);
        });
    }
}
