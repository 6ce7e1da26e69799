package com.cred.freestyle.arbitrage.api.dto;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every endpoint. {@code details} carries handler-specific context
 * such as field errors or rule violations.
 *
 * @author Arbitrage Team
 */
@Getter
public class ErrorResponse {

    private final Instant timestamp = Instant.now();
    private final int status;
    private final String error;
    private final String message;
    private final String path;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ErrorResponse(HttpStatus status, String error, String message, String path) {
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path);
    }

    /**
     * Null values are left out of the body.
     */
    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }
}
