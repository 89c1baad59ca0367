package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.history.PriceSummary;

/**
 * Latest gold quote with the summary of the buffered history; {@code summary} may be null.
 */
public record PriceView(Quote quote, PriceSummary summary) {
}
