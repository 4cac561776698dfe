package com.techStack.geoVault.security.authorization;

import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.security.support.SecurityResponseWriter;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.web.server.authorization.ServerAccessDeniedHandler;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import static com.techStack.geoVault.constants.SecurityConstants.MSG_ADMIN_REQUIRED;
import static com.techStack.geoVault.constants.SecurityConstants.MSG_EMPLOYEE_REQUIRED;

@Slf4j
@Component
@RequiredArgsConstructor
public class CustomAccessDeniedHandler implements ServerAccessDeniedHandler {

    private final SecurityResponseWriter responseWriter;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, AccessDeniedException ex) {
        return ReactiveSecurityContextHolder.getContext()
                .map(context -> context.getAuthentication().getPrincipal())
                .filter(AuthenticatedUser.class::isInstance)
                .map(principal -> HelperUtils.maskUsername(((AuthenticatedUser) principal).username()))
                .defaultIfEmpty("anonymous")
                .flatMap(user -> {
                    log.warn("⛔ Access denied: user={}, {} {}", user,
                            exchange.getRequest().getMethod(), exchange.getRequest().getPath());
                    return responseWriter.write(exchange, HttpStatus.FORBIDDEN, "PERMISSION_DENIED",
                            deniedMessage(exchange));
                });
    }

    private static String deniedMessage(ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/api/wfh-request")) {
            return MSG_EMPLOYEE_REQUIRED;
        }
        if (path.startsWith("/api/admin") || path.startsWith("/api/crypto") || path.startsWith("/api/files")) {
            return MSG_ADMIN_REQUIRED;
        }
        return "You do not have permission to access this resource";
    }
}
