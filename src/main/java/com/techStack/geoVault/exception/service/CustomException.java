package com.techStack.geoVault.exception.service;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying the HTTP status it should be rendered with,
 * plus optional field-level details.
 */
@Getter
public class CustomException extends RuntimeException {
    private final HttpStatus status;
    private final String field;
    private final String code;

    public CustomException(HttpStatus status, String message) {
        this(status, message, null, null, null);
    }

    public CustomException(HttpStatus status, String message, Throwable cause) {
        this(status, message, cause, null, null);
    }

    public CustomException(HttpStatus status, String message, String field, String code) {
        this(status, message, null, field, code);
    }

    public CustomException(HttpStatus status, String message, Throwable cause, String field, String code) {
        super(message, cause);
        this.status = status;
        this.field = field;
        this.code = code != null ? code : status.name();
    }

    @Override
    public String toString() {
        return "CustomException{" +
                "status=" + status +
                ", field='" + field + '\'' +
                ", code='" + code + '\'' +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
