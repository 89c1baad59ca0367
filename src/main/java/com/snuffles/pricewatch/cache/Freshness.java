package com.snuffles.pricewatch.cache;

public enum Freshness {
    FRESH,
    STALE,
    EXPIRED
}
