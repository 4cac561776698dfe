package com.techStack.geoVault.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Envelope for every successful JSON response. Failures are rendered as {@link ErrorResponse}
 * by the exception handler and the security handlers, never through this type.
 *
 * @param <T> type of the payload
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "message", "data", "timestamp"})
public class ApiResponse<T> {

    private static final String DEFAULT_MESSAGE = "Operation successful";

    boolean success;
    String message;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> success(T data) {
        return success(DEFAULT_MESSAGE, data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Instant.now());
    }

    /** Acknowledgement without a payload (logout, delete, password changes). */
    public static ApiResponse<Void> success(String message) {
        return new ApiResponse<>(true, message, null, Instant.now());
    }
}
