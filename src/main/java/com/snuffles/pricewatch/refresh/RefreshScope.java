package com.snuffles.pricewatch.refresh;

public enum RefreshScope {
    FUNDS,
    HOLDINGS
}
