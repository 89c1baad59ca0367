package com.snuffles.pricewatch.provider;

/**
 * Raised inside adapters for rejected HTTP responses and unusable payloads. It never leaves
 * the adapter.
 */
public class QuoteFetchException extends Exception {

    public QuoteFetchException(String message) {
        super(message);
    }
}
