package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.service.exception.ResourceNotFoundException;
import com.snuffles.pricewatch.service.exception.ValidationException;
import com.snuffles.pricewatch.web.dto.ApiEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiEnvelope<Void> handleValidation(ValidationException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ApiEnvelope.failure(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiEnvelope<Void> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ApiEnvelope.failure(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiEnvelope<Void> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ApiEnvelope.failure("Malformed request body");
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiEnvelope<Void> handleNotFound(ResourceNotFoundException ex) {
        return ApiEnvelope.failure(ex.getMessage());
    }
}
