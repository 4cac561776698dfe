package com.techStack.geoVault.security.authentication;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextImpl;
import org.springframework.security.web.server.context.ServerSecurityContextRepository;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@RequiredArgsConstructor
public class TokenSecurityContextRepository implements ServerSecurityContextRepository {

    private final TokenAuthenticationManager authenticationManager;

    @Override
    public Mono<Void> save(ServerWebExchange exchange, SecurityContext context) {
        return Mono.empty(); // stateless
    }

    @Override
    public Mono<SecurityContext> load(ServerWebExchange exchange) {
        return Mono.justOrEmpty(AccessTokenResolver.resolve(exchange.getRequest()))
                .flatMap(resolved -> authenticationManager.authenticate(
                        new UsernamePasswordAuthenticationToken(null, resolved.token())))
                .<SecurityContext>map(SecurityContextImpl::new)
                .doOnNext(context -> log.debug("Authenticated {} for {}",
                        context.getAuthentication().getAuthorities(), exchange.getRequest().getPath()))
                .onErrorResume(e -> {
                    // the entry point answers 401 for protected paths
                    log.debug("Token authentication failed for {} {}: {}",
                            exchange.getRequest().getMethod(), exchange.getRequest().getPath(), e.getMessage());
                    return Mono.empty();
                });
    }
}
