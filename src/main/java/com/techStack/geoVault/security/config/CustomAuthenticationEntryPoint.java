package com.techStack.geoVault.security.config;

import com.techStack.geoVault.security.support.SecurityResponseWriter;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import static com.techStack.geoVault.constants.SecurityConstants.MSG_AUTHENTICATION_FAILED;

/**
 * Answers 401 for protected paths reached without a valid access token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements ServerAuthenticationEntryPoint {

    private static final String REALM = "geoVault";

    private final SecurityResponseWriter responseWriter;

    @Override
    public Mono<Void> commence(ServerWebExchange exchange, AuthenticationException ex) {
        log.warn("🚫 Unauthorized {} {} from {}", exchange.getRequest().getMethod(),
                exchange.getRequest().getPath(), HelperUtils.clientIp(exchange.getRequest()));

        exchange.getResponse().getHeaders().set("WWW-Authenticate", "Bearer realm=\"" + REALM + "\"");
        return responseWriter.write(exchange, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", MSG_AUTHENTICATION_FAILED);
    }
}
