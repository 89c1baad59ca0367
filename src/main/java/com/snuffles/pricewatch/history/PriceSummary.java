package com.snuffles.pricewatch.history;

import com.snuffles.pricewatch.domain.Quote;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * High, low, mean and range of the buffered prices. Volatility is the high-low range.
 */
public record PriceSummary(BigDecimal high, BigDecimal low, BigDecimal average, BigDecimal volatility, int count) {

    public static Optional<PriceSummary> of(List<Quote> points) {
        if (points.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal high = null;
        BigDecimal low = null;
        BigDecimal sum = BigDecimal.ZERO;
        for (Quote q : points) {
            BigDecimal p = q.getPrice();
            high = high == null || p.compareTo(high) > 0 ? p : high;
            low = low == null || p.compareTo(low) < 0 ? p : low;
            sum = sum.add(p);
        }
        BigDecimal average = sum.divide(BigDecimal.valueOf(points.size()), 2, RoundingMode.HALF_UP);
        return Optional.of(new PriceSummary(
            high.setScale(2, RoundingMode.HALF_UP),
            low.setScale(2, RoundingMode.HALF_UP),
            average,
            high.subtract(low).setScale(2, RoundingMode.HALF_UP),
            points.size()
        ));
    }
}
