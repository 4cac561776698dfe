package com.techStack.geoVault.security.authentication;

import com.techStack.geoVault.exception.service.CustomException;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.service.auth.SessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Turns a raw access token (carried as the credentials) into an authenticated principal.
 */
@Component
@RequiredArgsConstructor
public class TokenAuthenticationManager implements ReactiveAuthenticationManager {

    private final SessionManager sessionManager;

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        String token = String.valueOf(authentication.getCredentials());
        return sessionManager.authenticate(token)
                .map(this::toAuthentication)
                .onErrorMap(CustomException.class, e -> new BadCredentialsException(e.getMessage(), e));
    }

    private Authentication toAuthentication(AuthenticatedUser user) {
        return new UsernamePasswordAuthenticationToken(user, null,
                List.of(new SimpleGrantedAuthority(user.role().authority())));
    }
}
