package com.snuffles.pricewatch.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Response wrapper used by every {@code /api} endpoint: {@code {success, data, message}}.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiEnvelope<T> {
    private boolean success;
    private T data;
    private String message;

    public static <T> ApiEnvelope<T> ok(T data) {
        return new ApiEnvelope<>(true, data, null);
    }

    public static <T> ApiEnvelope<T> ok(T data, String message) {
        return new ApiEnvelope<>(true, data, message);
    }

    public static <T> ApiEnvelope<T> failure(String message) {
        return new ApiEnvelope<>(false, null, message);
    }
}
