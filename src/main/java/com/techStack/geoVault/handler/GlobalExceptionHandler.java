package com.techStack.geoVault.handler;

import com.techStack.geoVault.dto.response.ErrorResponse;
import com.techStack.geoVault.exception.crypto.CryptoException;
import com.techStack.geoVault.exception.policy.PolicyDeniedException;
import com.techStack.geoVault.exception.security.RateLimitExceededException;
import com.techStack.geoVault.exception.service.CustomException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Global Exception Handler
 *
 * Renders every failure as an {@link ErrorResponse}, the same body the security handlers write. Internal details
 * (crypto failures, unexpected errors) are logged and never returned to the client.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final Clock clock;

    /* =========================
       Policy
       ========================= */

    @ExceptionHandler(PolicyDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePolicyDenied(
            PolicyDeniedException ex, ServerWebExchange exchange) {

        ErrorResponse body = baseBody(HttpStatus.FORBIDDEN, ex.getCode(), ex.getMessage(), exchange)
                .detail("allowed", false)
                .detail("reason", ex.getDecision().reason())
                .detail("validations", ex.getDecision().validations())
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN).body(body));
    }

    /* =========================
       Rate Limit
       ========================= */

    @ExceptionHandler(RateLimitExceededException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRateLimitExceeded(
            RateLimitExceededException ex, ServerWebExchange exchange) {

        ErrorResponse body = baseBody(HttpStatus.TOO_MANY_REQUESTS, ex.getCode(), ex.getMessage(), exchange)
                .detail("retryAfterSeconds", ex.getRetryAfterSeconds())
                .build();

        log.warn("Rate limit exceeded on {}", exchange.getRequest().getPath().value());

        return Mono.just(ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(body));
    }

    /* =========================
       Crypto
       ========================= */

    @ExceptionHandler(CryptoException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCryptoException(
            CryptoException ex, ServerWebExchange exchange) {

        log.error("🔐 Crypto failure ({}) on {}: {}", ex.getCode(),
                exchange.getRequest().getPath().value(), ex.getMessage(), ex);

        return Mono.just(ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(baseBody(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", INTERNAL_ERROR_MESSAGE, exchange)
                        .build()));
    }

    /* =========================
       Application Exceptions
       ========================= */

    @ExceptionHandler(CustomException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCustomException(
            CustomException ex, ServerWebExchange exchange) {

        HttpStatus status = ex.getStatus();
        ErrorResponse body = baseBody(status, ex.getCode(), ex.getMessage(), exchange)
                .field(ex.getField())
                .build();

        if (status.is5xxServerError()) {
            log.error("{} on {}: {}", status, exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        } else {
            log.debug("{} on {}: {}", status, exchange.getRequest().getPath().value(), ex.getMessage());
        }

        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {

        return Mono.just(ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(baseBody(HttpStatus.FORBIDDEN, "PERMISSION_DENIED",
                        "You do not have permission to access this resource", exchange).build()));
    }

    /* =========================
       Validation Exceptions
       ========================= */

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationExceptions(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        Map<String, String> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new
                ));

        ErrorResponse body = baseBody(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                "Please correct the following errors and try again", exchange)
                .detail("errors", fieldErrors)
                .build();

        log.debug("Bean validation errors: {}", fieldErrors.keySet());

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        return Mono.just(ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(baseBody(HttpStatus.BAD_REQUEST, "BAD_REQUEST",
                        ex.getReason() != null ? ex.getReason() : "Malformed request", exchange).build()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(
            ResponseStatusException ex, ServerWebExchange exchange) {

        HttpStatusCode status = ex.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String code = resolved != null ? resolved.name() : "ERROR";
        return Mono.just(ResponseEntity
                .status(status)
                .body(baseBody(status, code, ex.getReason() != null ? ex.getReason() : code, exchange).build()));
    }

    /* =========================
       Unexpected Exceptions
       ========================= */

    @ExceptionHandler(TimeoutException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTimeoutException(
            TimeoutException ex, ServerWebExchange exchange) {

        log.warn("Request timeout on {}: {}", exchange.getRequest().getPath().value(), ex.getMessage());

        return Mono.just(ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(baseBody(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE",
                        "Service temporarily unavailable", exchange).build()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error on {}", exchange.getRequest().getPath().value(), ex);

        return Mono.just(ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(baseBody(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", INTERNAL_ERROR_MESSAGE, exchange)
                        .build()));
    }

    /* =========================
       Helpers
       ========================= */

    private ErrorResponse.ErrorResponseBuilder baseBody(HttpStatusCode status, String errorCode, String message,
                                                       ServerWebExchange exchange) {
        return ErrorResponse.base(status.value(), errorCode, message,
                exchange.getRequest().getPath().value(), clock.instant());
    }
}
