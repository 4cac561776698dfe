package com.techStack.geoVault.dto.response;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Error body written by the exception handler and the security entry points.
 * Entries in {@code details} are rendered as top-level properties, so a policy denial
 * reads {@code {..., "allowed": false, "reason": ..., "validations": {...}}}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "status", "errorCode", "message", "field", "path", "timestamp"})
public class ErrorResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    boolean success;
    int status;
    String errorCode;
    String message;
    String field;
    String path;
    Instant timestamp;

    @Singular
    @Getter(onMethod_ = @JsonAnyGetter)
    Map<String, Object> details;

    public static ErrorResponse of(int status, String errorCode, String message, String path, Instant timestamp) {
        return base(status, errorCode, message, path, timestamp).build();
    }

    /**
     * Builder pre-filled with the fields every error carries.
     */
    public static ErrorResponseBuilder base(int status, String errorCode, String message, String path,
                                            Instant timestamp) {
        return ErrorResponse.builder()
                .success(false)
                .status(status)
                .errorCode(errorCode)
                .message(message)
                .path(path)
                .timestamp(timestamp);
    }
}
