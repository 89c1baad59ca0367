package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.fetch.FailoverFetcher;
import com.snuffles.pricewatch.fetch.FetchOutcome;
import com.snuffles.pricewatch.history.TimeSeriesBuffer;
import com.snuffles.pricewatch.persistence.StatePersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class PriceService {

    private final FailoverFetcher goldFetcher;
    private final TimeSeriesBuffer buffer;
    private final StatePersistenceService persistence;
    private final String code;
    private final Duration staleThreshold;
    private final Clock clock;

    public PriceService(
        @Qualifier("goldFetcher") FailoverFetcher goldFetcher,
        TimeSeriesBuffer buffer,
        StatePersistenceService persistence,
        PriceWatchProperties properties,
        Clock clock
    ) {
        this.goldFetcher = goldFetcher;
        this.buffer = buffer;
        this.persistence = persistence;
        this.code = properties.getGold().getCode();
        this.staleThreshold = properties.getGold().getStaleThreshold();
        this.clock = clock;
    }

    /**
     * Latest buffered price with its history summary. A point older than the stale threshold
     * means the poller has fallen behind, so one live fetch is tried first.
     */
    public QueryResult<PriceView> getPrice() {
        Optional<Quote> latest = buffer.latest();
        if (latest.isEmpty()) {
            FetchOutcome outcome = goldFetcher.fetch(code);
            if (!outcome.isSuccess()) {
                return QueryResult.error(outcome.getErrorMessage());
            }
            appendAndPersist(outcome.getQuote());
            return QueryResult.ok(new PriceView(outcome.getQuote(), buffer.summarize().orElse(null)));
        }

        Quote current = latest.get();
        if (isStale(current)) {
            log.info("Latest {} price is older than {}s; fetching live", code, staleThreshold.toSeconds());
            FetchOutcome outcome = goldFetcher.fetch(code);
            if (outcome.isSuccess()) {
                appendAndPersist(outcome.getQuote());
                current = outcome.getQuote();
            } else {
                log.warn("Live fetch failed, serving buffered price: {}", outcome.getErrorMessage());
            }
        }
        return QueryResult.ok(new PriceView(current, buffer.summarize().orElse(null)));
    }

    public QueryResult<List<Quote>> getHistory() {
        return QueryResult.ok(buffer.snapshot());
    }

    private boolean isStale(Quote quote) {
        return quote.getTimestamp() == null
            || Duration.between(quote.getTimestamp(), clock.instant()).compareTo(staleThreshold) > 0;
    }

    private void appendAndPersist(Quote quote) {
        buffer.append(quote);
        persistence.persist();
    }
}
