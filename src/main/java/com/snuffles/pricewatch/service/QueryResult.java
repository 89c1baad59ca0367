package com.snuffles.pricewatch.service;

/**
 * Outcome of a read: data, or the user-facing reason there is none.
 */
public record QueryResult<T>(T data, String error) {

    public static <T> QueryResult<T> ok(T data) {
        return new QueryResult<>(data, null);
    }

    public static <T> QueryResult<T> error(String message) {
        return new QueryResult<>(null, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
