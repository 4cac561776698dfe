package com.techStack.geoVault.security.filter;

import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.security.authentication.AccessTokenResolver;
import com.techStack.geoVault.security.support.SecurityResponseWriter;
import com.techStack.geoVault.service.token.CsrfTokenService;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Set;

import static com.techStack.geoVault.constants.SecurityConstants.CSRF_HEADER;

/**
 * Requires a valid {@code X-CSRF-Token} on state-changing requests that authenticate through the
 * access-token cookie. Requests carrying an {@code Authorization} header are not exposed to CSRF.
 * <p>
 * Registered in the security chain only; not a standalone bean.
 */
@Slf4j
@RequiredArgsConstructor
public class CsrfProtectionWebFilter implements WebFilter {

    private static final Set<HttpMethod> STATE_CHANGING =
            Set.of(HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH, HttpMethod.DELETE);

    /** Endpoints used before a session (and so a CSRF token) exists. */
    private static final Set<String> EXEMPT_PATHS = Set.of(
            "/api/auth/login",
            "/api/auth/resend-otp",
            "/api/auth/verify-otp",
            "/api/auth/refresh-token",
            "/api/auth/forgot-password",
            "/api/auth/reset-password"
    );

    private final CsrfTokenService csrfTokenService;
    private final SecurityResponseWriter responseWriter;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (!requiresCheck(request)) {
            return chain.filter(exchange);
        }

        String presented = request.getHeaders().getFirst(CSRF_HEADER);
        return ReactiveSecurityContextHolder.getContext()
                .map(context -> context.getAuthentication() == null ? null : context.getAuthentication().getPrincipal())
                .ofType(AuthenticatedUser.class)
                .flatMap(user -> csrfTokenService.verify(user.username(), presented)
                        .flatMap(valid -> {
                            if (valid) {
                                return chain.filter(exchange);
                            }
                            log.warn("🛡️ CSRF check failed for {} on {} {}", HelperUtils.maskUsername(user.username()),
                                    request.getMethod(), request.getPath());
                            return responseWriter.write(exchange, HttpStatus.FORBIDDEN, "CSRF_INVALID",
                                    "Invalid or missing CSRF token");
                        }))
                // unauthenticated: authorization decides
                .switchIfEmpty(Mono.defer(() -> chain.filter(exchange)));
    }

    private static boolean requiresCheck(ServerHttpRequest request) {
        if (!STATE_CHANGING.contains(request.getMethod())) {
            return false;
        }
        if (EXEMPT_PATHS.contains(request.getPath().value())) {
            return false;
        }
        return AccessTokenResolver.resolve(request)
                .map(resolved -> resolved.source() == AccessTokenResolver.Source.COOKIE)
                .orElse(false);
    }
}
