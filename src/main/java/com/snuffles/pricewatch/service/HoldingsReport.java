package com.snuffles.pricewatch.service;

import java.util.List;

/**
 * The aggregated holdings response as cached. {@code stale} is only set on copies served from
 * a stale cache entry.
 */
public record HoldingsReport(List<HoldingLine> lines, HoldingsSummary summary, String lastUpdate, boolean stale) {

    public static HoldingsReport empty(String lastUpdate) {
        return new HoldingsReport(List.of(), HoldingsSummary.empty(), lastUpdate, false);
    }

    public HoldingsReport asStale() {
        return new HoldingsReport(lines, summary, lastUpdate, true);
    }
}
