package com.snuffles.pricewatch.persistence;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.snuffles.pricewatch.domain.AlertSettings;
import com.snuffles.pricewatch.domain.FundHolding;
import com.snuffles.pricewatch.domain.FundPortfolio;
import com.snuffles.pricewatch.domain.ManualRecord;
import com.snuffles.pricewatch.domain.Quote;

import java.util.List;
import java.util.Map;

/**
 * Everything written to the data file. Missing sections load as empty. The snake_case keys of
 * the legacy data file are accepted on read.
 */
public record StateSnapshot(
    @JsonAlias("price_history") List<Quote> priceHistory,
    @JsonAlias("manual_records") List<ManualRecord> manualRecords,
    @JsonAlias("alert_settings") AlertSettings alertSettings,
    @JsonAlias("fund_watchlist") List<String> fundWatchlist,
    @JsonAlias("fund_holdings") List<FundHolding> fundHoldings,
    @JsonAlias("fund_portfolios") Map<String, FundPortfolio> fundPortfolios
) {

    public StateSnapshot {
        priceHistory = priceHistory != null ? priceHistory : List.of();
        manualRecords = manualRecords != null ? manualRecords : List.of();
        alertSettings = alertSettings != null ? alertSettings : AlertSettings.defaults();
        fundWatchlist = fundWatchlist != null ? fundWatchlist : List.of();
        fundHoldings = fundHoldings != null ? fundHoldings : List.of();
        fundPortfolios = fundPortfolios != null ? fundPortfolios : Map.of();
    }
}
