package com.snuffles.pricewatch.refresh;

import com.snuffles.pricewatch.fetch.FailoverFetcher;
import com.snuffles.pricewatch.fetch.FetchFailure;
import com.snuffles.pricewatch.fetch.FetchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fetches many fund codes concurrently on the bounded fetch pool and waits for all of them.
 * Must not be called while holding the market state lock.
 */
@Component
@Slf4j
public class BatchQuoteFetcher {

    private final FailoverFetcher fetcher;
    private final ExecutorService executor;

    public BatchQuoteFetcher(
        @Qualifier("fundFetcher") FailoverFetcher fetcher,
        @Qualifier("fetchExecutor") ExecutorService executor
    ) {
        this.fetcher = fetcher;
        this.executor = executor;
    }

    public FetchOutcome fetchOne(String code) {
        return fetcher.fetch(code);
    }

    public Map<String, FetchOutcome> fetchAll(Collection<String> codes) {
        Map<String, Future<FetchOutcome>> pending = new LinkedHashMap<>();
        Map<String, FetchOutcome> results = new LinkedHashMap<>();
        for (String code : new LinkedHashSet<>(codes)) {
            try {
                pending.put(code, executor.submit(() -> fetcher.fetch(code)));
            } catch (RejectedExecutionException ex) {
                log.warn("Fetch pool rejected {}; fetching inline", code);
                pending.put(code, null);
            }
        }

        for (Map.Entry<String, Future<FetchOutcome>> e : pending.entrySet()) {
            String code = e.getKey();
            Future<FetchOutcome> future = e.getValue();
            if (future == null) {
                results.put(code, fetcher.fetch(code));
                continue;
            }
            try {
                results.put(code, future.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted waiting for {}", code);
                results.put(code, FetchOutcome.failure(FetchFailure.ALL_SOURCES_FAILED, 0));
            } catch (ExecutionException ex) {
                log.error("Fetch task for {} failed: {}", code, ex.getCause() != null ? ex.getCause().toString() : ex.toString());
                results.put(code, FetchOutcome.failure(FetchFailure.ALL_SOURCES_FAILED, 0));
            }
        }
        log.debug("Batch fetched {} code(s)", results.size());
        return results;
    }
}
