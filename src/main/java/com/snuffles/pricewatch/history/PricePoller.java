package com.snuffles.pricewatch.history;

import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.fetch.FailoverFetcher;
import com.snuffles.pricewatch.fetch.FetchOutcome;
import com.snuffles.pricewatch.persistence.StatePersistenceService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the gold price on a single scheduler thread and feeds the history buffer.
 * Each tick schedules the next one, after the normal interval or, when the tick blew up,
 * after the error backoff. Errors never stop the loop; only {@link #stop()} does.
 */
@Component
@Slf4j
public class PricePoller {

    private final FailoverFetcher fetcher;
    private final TimeSeriesBuffer buffer;
    private final StatePersistenceService persistence;
    private final ScheduledExecutorService scheduler;
    private final String code;
    private final Duration interval;
    private final Duration errorBackoff;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> next;

    public PricePoller(
        @Qualifier("goldFetcher") FailoverFetcher fetcher,
        TimeSeriesBuffer buffer,
        StatePersistenceService persistence,
        @Qualifier("pollerScheduler") ScheduledExecutorService scheduler,
        PriceWatchProperties properties
    ) {
        this.fetcher = fetcher;
        this.buffer = buffer;
        this.persistence = persistence;
        this.scheduler = scheduler;
        this.code = properties.getGold().getCode();
        this.interval = properties.getPoller().getInterval();
        this.errorBackoff = properties.getPoller().getErrorBackoff();
    }

    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        log.info("Starting price poller for {} every {}s", code, interval.toSeconds());
        scheduleNext(Duration.ZERO);
        return true;
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> pending = next;
        if (pending != null) {
            pending.cancel(false);
        }
        scheduler.shutdownNow();
        log.info("Price poller stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    void tick() {
        if (!running.get()) {
            return;
        }
        Duration delay = interval;
        try {
            pollOnce();
        } catch (RuntimeException ex) {
            log.error("Price poll failed; retrying in {}s: {}", errorBackoff.toSeconds(), ex.toString(), ex);
            delay = errorBackoff;
        }
        if (running.get()) {
            scheduleNext(delay);
        }
    }

    /**
     * One poll: fetch, append on success and persist. A failed fetch is not an error.
     */
    public boolean pollOnce() {
        FetchOutcome outcome = fetcher.fetch(code);
        if (!outcome.isSuccess()) {
            log.debug("Price poll for {} got nothing: {}", code, outcome.getErrorMessage());
            return false;
        }
        buffer.append(outcome.getQuote());
        persistence.persist();
        return true;
    }

    private void scheduleNext(Duration delay) {
        try {
            next = scheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            running.set(false);
            log.warn("Price poller scheduler rejected the next tick; poller stopped");
        }
    }
}
