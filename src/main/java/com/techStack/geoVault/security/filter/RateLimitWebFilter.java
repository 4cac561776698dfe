package com.techStack.geoVault.security.filter;

import com.techStack.geoVault.exception.security.RateLimitExceededException;
import com.techStack.geoVault.security.support.SecurityResponseWriter;
import com.techStack.geoVault.service.security.RateLimiterService;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Per client IP sliding-window limit on {@code /api/**}. Runs ahead of the security chain.
 */
@Slf4j
@Component
@Order(-200)
@RequiredArgsConstructor
public class RateLimitWebFilter implements WebFilter {

    private final RateLimiterService rateLimiterService;
    private final SecurityResponseWriter responseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!exchange.getRequest().getPath().value().startsWith("/api/")) {
            return chain.filter(exchange);
        }

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return rateLimiterService.checkApiRateLimit(ip)
                .thenReturn(true)
                .onErrorResume(RateLimitExceededException.class, e -> {
                    log.warn("⚠️ API rate limit exceeded for {}", ip);
                    exchange.getResponse().getHeaders()
                            .set(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
                    return responseWriter.write(exchange, HttpStatus.TOO_MANY_REQUESTS, e.getCode(), e.getMessage())
                            .thenReturn(false);
                })
                .flatMap(allowed -> allowed ? chain.filter(exchange) : Mono.empty());
    }
}
