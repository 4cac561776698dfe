package com.techStack.geoVault.security.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.geoVault.dto.response.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Writes JSON error bodies from filters and security handlers, which run outside the controller advice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Mono<Void> write(ServerWebExchange exchange, HttpStatus status, String errorCode, String message) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.empty();
        }
        response.setStatusCode(status);
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Content-Type-Options", "nosniff");
        headers.set("Cache-Control", "no-cache, no-store, must-revalidate");

        ErrorResponse body = ErrorResponse.of(status.value(), errorCode, message,
                exchange.getRequest().getPath().value(), clock.instant());
        return response.writeWith(Mono.just(response.bufferFactory().wrap(toJson(body))));
    }

    private byte[] toJson(ErrorResponse body) {
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error response: {}", e.getMessage());
            return "{\"success\":false,\"message\":\"Failed to generate error response\"}".getBytes(StandardCharsets.UTF_8);
        }
    }
}
