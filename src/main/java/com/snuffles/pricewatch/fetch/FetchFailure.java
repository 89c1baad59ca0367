package com.snuffles.pricewatch.fetch;

/**
 * Why a failover fetch produced no quote.
 */
public enum FetchFailure {
    NO_ENABLED_SOURCES("No enabled data sources"),
    ALL_SOURCES_MUTED("All data sources are cooling down, try again later"),
    ALL_SOURCES_FAILED("All available data sources failed, check the network or retry later");

    private final String message;

    FetchFailure(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
