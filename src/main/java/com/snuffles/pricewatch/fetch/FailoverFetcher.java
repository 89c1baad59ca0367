package com.snuffles.pricewatch.fetch;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.provider.QuoteAdapter;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import com.snuffles.pricewatch.registry.SourceRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tries the registry's enabled sources in priority order and returns the first valid quote.
 * Every attempt is recorded against the source's breaker. Never throws.
 */
@Slf4j
public class FailoverFetcher {

    private final SourceRegistry registry;
    private final Map<String, QuoteAdapter> adapters;

    public FailoverFetcher(SourceRegistry registry, Map<String, QuoteAdapter> adapters) {
        this.registry = registry;
        this.adapters = Map.copyOf(adapters);
    }

    public SourceRegistry getRegistry() {
        return registry;
    }

    public FetchOutcome fetch(String code) {
        List<SourceDescriptor> sources = registry.getEnabledSources();
        if (sources.isEmpty()) {
            log.warn("[{}] No enabled sources configured", registry.getScope());
            return FetchOutcome.failure(FetchFailure.NO_ENABLED_SOURCES, 0);
        }

        int muted = 0;
        for (SourceDescriptor source : sources) {
            if (registry.isMuted(source)) {
                muted++;
                log.debug("[{}] Skipping muted source {} until {}", registry.getScope(), source.getName(), source.getMuteUntil());
                continue;
            }
            QuoteAdapter adapter = adapters.get(source.getType());
            if (adapter == null) {
                log.warn("[{}] No adapter for source {} of type '{}'", registry.getScope(), source.getName(), source.getType());
                continue;
            }

            Optional<Quote> quote;
            try {
                quote = adapter.fetch(source, code);
            } catch (Exception ex) {
                log.error("[{}] Adapter {} threw for {}: {}", registry.getScope(), source.getName(), code, ex.toString());
                quote = Optional.empty();
            }

            if (quote.isPresent() && quote.get().isValid()) {
                registry.recordSuccess(source);
                log.debug("[{}] {} served {} at {}", registry.getScope(), source.getName(), code, quote.get().getPrice());
                return FetchOutcome.success(quote.get(), muted);
            }
            registry.recordFailure(source);
        }

        if (muted == sources.size()) {
            log.warn("[{}] All {} sources muted for {}", registry.getScope(), muted, code);
            return FetchOutcome.failure(FetchFailure.ALL_SOURCES_MUTED, muted);
        }
        log.warn("[{}] All available sources failed for {}", registry.getScope(), code);
        return FetchOutcome.failure(FetchFailure.ALL_SOURCES_FAILED, muted);
    }
}
