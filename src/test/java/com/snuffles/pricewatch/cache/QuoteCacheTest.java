package com.snuffles.pricewatch.cache;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.state.MarketStateLock;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class QuoteCacheTest {

    private final QuoteCache cache = new QuoteCache(new MarketStateLock());

    @Test
    void storesAndEvictsValidQuotes() {
        Instant at = Instant.parse("2024-03-01T02:00:00Z");
        Quote quote = Quote.builder().code("161725").price(new BigDecimal("1.0631")).source("Tiantian Fund").build();

        cache.put("161725", quote, at);

        assertThat(cache.get("161725")).hasValueSatisfying(e -> {
            assertThat(e.value()).isEqualTo(quote);
            assertThat(e.fetchedAt()).isEqualTo(at);
        });

        cache.remove("161725");
        assertThat(cache.get("161725")).isEmpty();
    }

    @Test
    void neverCachesFailurePlaceholder() {
        cache.put("161725", Quote.failed("161725"), Instant.now());

        assertThat(cache.get("161725")).isEmpty();
        assertThat(cache.size()).isZero();
    }
}
