package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.cache.CacheEntry;
import com.snuffles.pricewatch.cache.CacheTtl;
import com.snuffles.pricewatch.cache.Freshness;
import com.snuffles.pricewatch.cache.QuoteCache;
import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.fetch.FetchOutcome;
import com.snuffles.pricewatch.refresh.BatchQuoteFetcher;
import com.snuffles.pricewatch.refresh.RefreshCoordinator;
import com.snuffles.pricewatch.refresh.RefreshScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fund quotes through the two-tier cache.
 * <p>
 * Per code: a fresh entry is reused; in fast mode a stale entry is served tagged
 * {@value Quote#STALE_MARKER} and refreshed in the background; anything else is fetched now
 * on the fetch pool. A failed fetch falls back to the last cached quote tagged
 * {@value Quote#EXPIRED_MARKER}, or to a {@link Quote#failed(String) placeholder}.
 */
@Service
@Slf4j
public class FundQuoteService {

    private final QuoteCache cache;
    private final BatchQuoteFetcher batchFetcher;
    private final RefreshCoordinator coordinator;
    private final CacheTtl ttl;
    private final Clock clock;

    public FundQuoteService(
        QuoteCache cache,
        BatchQuoteFetcher batchFetcher,
        RefreshCoordinator coordinator,
        PriceWatchProperties properties,
        Clock clock
    ) {
        this.cache = cache;
        this.batchFetcher = batchFetcher;
        this.coordinator = coordinator;
        this.ttl = properties.getFund().getCache().toCacheTtl();
        this.clock = clock;
    }

    /**
     * Quotes for every requested code, in request order. Never omits a code.
     */
    public Map<String, Quote> getMany(List<String> codes, boolean fastMode) {
        Instant now = clock.instant();
        Map<String, Quote> result = new LinkedHashMap<>();
        List<String> toFetch = new ArrayList<>();
        List<String> toRefresh = new ArrayList<>();

        for (String code : codes) {
            if (result.containsKey(code)) {
                continue;
            }
            Optional<CacheEntry<Quote>> entry = cache.get(code);
            if (entry.isEmpty()) {
                result.put(code, null);
                toFetch.add(code);
                continue;
            }
            Freshness freshness = entry.get().classify(now, ttl);
            if (freshness == Freshness.FRESH) {
                log.debug("Fresh cache hit for {}", code);
                result.put(code, entry.get().value());
            } else if (freshness == Freshness.STALE && fastMode) {
                result.put(code, entry.get().value().withSourceMarker(Quote.STALE_MARKER));
                toRefresh.add(code);
            } else {
                result.put(code, null);
                toFetch.add(code);
            }
        }

        if (!toFetch.isEmpty()) {
            fetchAndStore(toFetch).forEach((code, quote) ->
                result.put(code, quote.orElseGet(() -> Quote.failed(code))));
        }
        if (!toRefresh.isEmpty()) {
            refreshAsync(toRefresh);
        }
        return result;
    }

    /**
     * Fetches the codes on the pool and caches every success. A failed code maps to its last
     * cached quote tagged expired, or to empty when it was never cached.
     */
    public Map<String, Optional<Quote>> fetchAndStore(Collection<String> codes) {
        Map<String, FetchOutcome> outcomes = batchFetcher.fetchAll(codes);
        Map<String, Optional<Quote>> result = new LinkedHashMap<>();
        outcomes.forEach((code, outcome) -> {
            if (outcome.isSuccess()) {
                cache.put(code, outcome.getQuote(), clock.instant());
                result.put(code, Optional.of(outcome.getQuote()));
            } else {
                Optional<Quote> previous = cache.get(code).map(CacheEntry::value);
                if (previous.isPresent()) {
                    log.warn("Fetch failed for {} ({}); serving expired cache", code, outcome.getErrorMessage());
                } else {
                    log.warn("Fetch failed for {} with nothing cached: {}", code, outcome.getErrorMessage());
                }
                result.put(code, previous.map(q -> q.withSourceMarker(Quote.EXPIRED_MARKER)));
            }
        });
        return result;
    }

    public boolean refreshAsync(Collection<String> codes) {
        List<String> snapshot = List.copyOf(codes);
        return coordinator.schedule(RefreshScope.FUNDS, () -> {
            fetchAndStore(snapshot);
            log.debug("Background refresh of {} fund quote(s) done", snapshot.size());
        });
    }

    /**
     * Single live fetch, cached on success.
     */
    public FetchOutcome fetchAndCache(String code) {
        FetchOutcome outcome = batchFetcher.fetchOne(code);
        if (outcome.isSuccess()) {
            cache.put(code, outcome.getQuote(), clock.instant());
        }
        return outcome;
    }

    public void evict(String code) {
        cache.remove(code);
    }
}
