package com.techStack.geoVault.security.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.repository.security.InMemorySecurityStateStore;
import com.techStack.geoVault.security.support.SecurityResponseWriter;
import com.techStack.geoVault.service.token.CsrfTokenService;
import com.techStack.geoVault.support.MutableClock;
import com.techStack.geoVault.support.TestSecurity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.techStack.geoVault.constants.SecurityConstants.ACCESS_TOKEN_COOKIE;
import static com.techStack.geoVault.constants.SecurityConstants.CSRF_HEADER;
import static org.assertj.core.api.Assertions.assertThat;

class CsrfProtectionWebFilterTest {

    private static final AuthenticatedUser ALICE = new AuthenticatedUser("alice", Roles.EMPLOYEE, "jti", null);

    private CsrfTokenService csrfTokenService;
    private CsrfProtectionWebFilter filter;
    private AtomicBoolean passed;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        csrfTokenService = new CsrfTokenService(TestSecurity.jwtService(clock), new InMemorySecurityStateStore(clock));
        filter = new CsrfProtectionWebFilter(csrfTokenService,
                new SecurityResponseWriter(new ObjectMapper().findAndRegisterModules(), clock));
        passed = new AtomicBoolean();
        chain = exchange -> Mono.fromRunnable(() -> passed.set(true));
    }

    private Mono<Void> run(MockServerWebExchange exchange) {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                ALICE, null, List.of(new SimpleGrantedAuthority("ROLE_EMPLOYEE")));
        return filter.filter(exchange, chain)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }

    @Test
    void filter_shouldReject_cookieAuthenticatedPostWithoutToken() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/files/access")
                .cookie(new HttpCookie(ACCESS_TOKEN_COOKIE, "token")));

        StepVerifier.create(run(exchange)).verifyComplete();

        assertThat(passed).isFalse();
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void filter_shouldPass_cookieAuthenticatedPostWithCurrentToken() {
        String csrf = csrfTokenService.issue("alice").block();
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/files/access")
                .cookie(new HttpCookie(ACCESS_TOKEN_COOKIE, "token"))
                .header(CSRF_HEADER, csrf));

        StepVerifier.create(run(exchange)).verifyComplete();

        assertThat(passed).isTrue();
    }

    @Test
    void filter_shouldSkipCheck_forBearerAuthenticatedRequests() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/files/access")
                .header(HttpHeaders.AUTHORIZATION, "Bearer token")
                .cookie(new HttpCookie(ACCESS_TOKEN_COOKIE, "token")));

        StepVerifier.create(run(exchange)).verifyComplete();

        assertThat(passed).isTrue();
    }

    @Test
    void filter_shouldSkipCheck_forSafeMethodsAndExemptPaths() {
        MockServerWebExchange get = MockServerWebExchange.from(MockServerHttpRequest.get("/api/files")
                .cookie(new HttpCookie(ACCESS_TOKEN_COOKIE, "token")));
        StepVerifier.create(run(get)).verifyComplete();
        assertThat(passed).isTrue();

        passed.set(false);
        MockServerWebExchange login = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/verify-otp")
                .cookie(new HttpCookie(ACCESS_TOKEN_COOKIE, "token")));
        StepVerifier.create(run(login)).verifyComplete();
        assertThat(passed).isTrue();
    }
}
