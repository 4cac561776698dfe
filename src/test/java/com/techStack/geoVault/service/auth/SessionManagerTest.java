package com.techStack.geoVault.service.auth;

import com.techStack.geoVault.config.security.OtpProperties;
import com.techStack.geoVault.config.security.RateLimitProperties;
import com.techStack.geoVault.event.AuthFailureEvent;
import com.techStack.geoVault.event.AuthSuccessEvent;
import com.techStack.geoVault.exception.account.AccountDisabledException;
import com.techStack.geoVault.exception.auth.AuthenticationFailedException;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.exception.security.RateLimitExceededException;
import com.techStack.geoVault.exception.service.CustomException;
import com.techStack.geoVault.models.auth.IssuedTokens;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.security.InMemorySecurityStateStore;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.service.security.OtpService;
import com.techStack.geoVault.service.security.RateLimiterServiceImpl;
import com.techStack.geoVault.service.token.JwtService;
import com.techStack.geoVault.service.token.TokenRevocationService;
import com.techStack.geoVault.support.InMemoryAccessLogRepository;
import com.techStack.geoVault.support.InMemoryAuthEventRepository;
import com.techStack.geoVault.support.InMemoryUserRepository;
import com.techStack.geoVault.support.MutableClock;
import com.techStack.geoVault.support.RecordingNotificationSender;
import com.techStack.geoVault.support.TestSecurity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionManagerTest {

    private static final String IP = "10.0.0.7";
    private static final PasswordEncoder ENCODER = new BCryptPasswordEncoder(4);
    private static final String ALICE_HASH = ENCODER.encode("Correct#Horse1");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private InMemoryUserRepository userRepository;
    private RecordingNotificationSender notificationSender;
    private OtpProperties otpProperties;
    private JwtService jwtService;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        userRepository = new InMemoryUserRepository();
        notificationSender = new RecordingNotificationSender();
        otpProperties = new OtpProperties();
        otpProperties.setHashSecret("test-otp-hash-secret");
        jwtService = TestSecurity.jwtService(clock);

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        InMemorySecurityStateStore stateStore = new InMemorySecurityStateStore(clock);
        RateLimitProperties rateLimits = new RateLimitProperties();
        rateLimits.setLogin(new RateLimitProperties.Limit(true, 3, Duration.ofMinutes(15)));

        sessionManager = new SessionManager(
                userRepository,
                ENCODER,
                new OtpService(otpProperties),
                otpProperties,
                notificationSender,
                new RateLimiterServiceImpl(stateStore, rateLimits),
                jwtService,
                new TokenRevocationService(stateStore, meterRegistry, clock),
                new AuditLogService(new InMemoryAccessLogRepository(), new InMemoryAuthEventRepository(),
                        meterRegistry, clock),
                eventPublisher,
                meterRegistry,
                clock);

        userRepository.save(User.builder()
                .username("alice")
                .email("alice@example.com")
                .passwordHash(ALICE_HASH)
                .role(Roles.EMPLOYEE)
                .active(true)
                .createdAt(clock.instant())
                .build()).block();
    }

    private IssuedTokens loginAndVerify() {
        sessionManager.login("alice", "Correct#Horse1", IP).block();
        return sessionManager.verifyOtp("alice", notificationSender.lastCode("alice"), IP).block();
    }

    /* ===== Login ===== */

    @Test
    void login_shouldIssueOtpChallenge_whenValidCredentials() {
        StepVerifier.create(sessionManager.login("alice", "Correct#Horse1", IP))
                .assertNext(challenge -> {
                    assertThat(challenge.username()).isEqualTo("alice");
                    assertThat(challenge.role()).isEqualTo(Roles.EMPLOYEE);
                    assertThat(challenge.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
                })
                .verifyComplete();

        User stored = userRepository.get("alice");
        assertThat(notificationSender.lastCode("alice")).matches("\\d{6}");
        assertThat(stored.getOtpHash()).isNotBlank().isNotEqualTo(notificationSender.lastCode("alice"));
    }

    @Test
    void login_shouldFailGenerically_whenPasswordWrongOrUserUnknown() {
        StepVerifier.create(sessionManager.login("alice", "wrong", IP))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(AuthenticationFailedException.class)
                        .hasMessage("Authentication failed"))
                .verify();
        StepVerifier.create(sessionManager.login("mallory", "whatever", IP))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(AuthenticationFailedException.class)
                        .hasMessage("Authentication failed"))
                .verify();

        verify(eventPublisher, times(2)).publishEvent(any(AuthFailureEvent.class));
    }

    @Test
    void login_shouldRejectDisabledAccount_afterPasswordCheck() {
        userRepository.save(userRepository.get("alice").toBuilder().active(false).build()).block();

        StepVerifier.create(sessionManager.login("alice", "Correct#Horse1", IP))
                .expectError(AccountDisabledException.class)
                .verify();
    }

    @Test
    void login_shouldThrottle_afterTooManyAttempts() {
        for (int i = 0; i < 3; i++) {
            StepVerifier.create(sessionManager.login("alice", "wrong", IP))
                    .expectError(AuthenticationFailedException.class)
                    .verify();
        }

        StepVerifier.create(sessionManager.login("alice", "Correct#Horse1", IP))
                .expectError(RateLimitExceededException.class)
                .verify();
    }

    @Test
    void login_shouldFail_whenOtpDeliveryFails() {
        notificationSender.setFailing(true);

        StepVerifier.create(sessionManager.login("alice", "Correct#Horse1", IP))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(CustomException.class)
                        .hasMessageContaining("Failed to send OTP"))
                .verify();
    }

    /* ===== OTP ===== */

    @Test
    void verifyOtp_shouldIssueTokensAndClearOtp_whenCodeMatches() {
        sessionManager.login("alice", "Correct#Horse1", IP).block();
        String code = notificationSender.lastCode("alice");

        StepVerifier.create(sessionManager.verifyOtp("alice", code, IP))
                .assertNext(tokens -> {
                    assertThat(tokens.role()).isEqualTo(Roles.EMPLOYEE);
                    assertThat(tokens.accessExpiresIn()).isEqualTo(1800);
                    assertThat(tokens.refreshExpiresIn()).isEqualTo(604800);
                })
                .verifyComplete();

        assertThat(userRepository.get("alice").getOtpHash()).isNull();
        ArgumentCaptor<AuthSuccessEvent> captor = ArgumentCaptor.forClass(AuthSuccessEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getIpAddress()).isEqualTo(IP);
    }

    @Test
    void verifyOtp_shouldBeSingleUse() {
        sessionManager.login("alice", "Correct#Horse1", IP).block();
        String code = notificationSender.lastCode("alice");
        sessionManager.verifyOtp("alice", code, IP).block();

        StepVerifier.create(sessionManager.verifyOtp("alice", code, IP))
                .expectError(AuthenticationFailedException.class)
                .verify();
    }

    @Test
    void verifyOtp_shouldFail_whenCodeExpired() {
        sessionManager.login("alice", "Correct#Horse1", IP).block();
        String code = notificationSender.lastCode("alice");

        clock.advance(Duration.ofMinutes(5));

        StepVerifier.create(sessionManager.verifyOtp("alice", code, IP))
                .expectErrorSatisfies(e -> assertThat(((AuthenticationFailedException) e).getInternalReason())
                        .isEqualTo("OTP expired"))
                .verify();
    }

    @Test
    void verifyOtp_shouldFail_whenCodeWrong() {
        sessionManager.login("alice", "Correct#Horse1", IP).block();
        String wrong = "000000".equals(notificationSender.lastCode("alice")) ? "111111" : "000000";

        StepVerifier.create(sessionManager.verifyOtp("alice", wrong, IP))
                .expectError(AuthenticationFailedException.class)
                .verify();
        assertThat(userRepository.get("alice").getOtpHash()).isNotNull();
    }

    @Test
    void resendOtp_shouldRespectCooldown_thenReplaceCode() {
        sessionManager.login("alice", "Correct#Horse1", IP).block();
        String firstCode = notificationSender.lastCode("alice");

        StepVerifier.create(sessionManager.resendOtp("alice", IP))
                .expectError(RateLimitExceededException.class)
                .verify();

        clock.advance(Duration.ofSeconds(31));

        StepVerifier.create(sessionManager.resendOtp("alice", IP))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(userRepository.get("alice").getOtpSentAt()).isEqualTo(clock.instant());
        assertThat(notificationSender.lastCode("alice")).isNotNull();
        assertThat(firstCode).isNotNull();
    }

    @Test
    void resendOtp_shouldFail_whenNoOtpPending() {
        StepVerifier.create(sessionManager.resendOtp("alice", IP))
                .expectError(AuthenticationFailedException.class)
                .verify();
    }

    /* ===== Tokens ===== */

    @Test
    void authenticate_shouldResolvePrincipal_fromAccessToken() {
        IssuedTokens tokens = loginAndVerify();

        StepVerifier.create(sessionManager.authenticate(tokens.accessToken()))
                .assertNext(user -> {
                    assertThat(user.username()).isEqualTo("alice");
                    assertThat(user.isAdmin()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void authenticate_shouldReject_refreshTokenUsedAsAccessToken() {
        IssuedTokens tokens = loginAndVerify();

        StepVerifier.create(sessionManager.authenticate(tokens.refreshToken()))
                .expectError(InvalidTokenException.class)
                .verify();
    }

    @Test
    void refresh_shouldIssueNewAccessToken_andKeepRefreshToken() {
        IssuedTokens tokens = loginAndVerify();
        clock.advance(Duration.ofMinutes(10));

        StepVerifier.create(sessionManager.refresh(tokens.refreshToken()))
                .assertNext(refreshed -> {
                    assertThat(refreshed.accessToken()).isNotEqualTo(tokens.accessToken());
                    assertThat(refreshed.refreshToken()).isEqualTo(tokens.refreshToken());
                    assertThat(refreshed.refreshExpiresIn()).isEqualTo(604800 - 600);
                })
                .verifyComplete();
    }

    @Test
    void logout_shouldRevokeAccessAndRefreshTokens() {
        IssuedTokens tokens = loginAndVerify();

        StepVerifier.create(sessionManager.logout(tokens.accessToken(), tokens.refreshToken(), IP))
                .verifyComplete();

        StepVerifier.create(sessionManager.authenticate(tokens.accessToken()))
                .expectErrorSatisfies(e -> assertThat(e).hasMessage("Token has been revoked"))
                .verify();
        StepVerifier.create(sessionManager.refresh(tokens.refreshToken()))
                .expectError(InvalidTokenException.class)
                .verify();
    }

    @Test
    void refresh_shouldFail_whenUserDisabledAfterLogin() {
        IssuedTokens tokens = loginAndVerify();
        userRepository.save(userRepository.get("alice").toBuilder().active(false).build()).block();

        StepVerifier.create(sessionManager.refresh(tokens.refreshToken()))
                .expectError(AccountDisabledException.class)
                .verify();
    }

    @Test
    void verifyOtp_shouldThrottle_afterMaxAttempts() {
        otpProperties.setMaxVerifyAttempts(2);
        sessionManager.login("alice", "Correct#Horse1", IP).block();

        sessionManager.verifyOtp("alice", "999999", IP).onErrorResume(e -> Mono.empty()).block();
        sessionManager.verifyOtp("alice", "999998", IP).onErrorResume(e -> Mono.empty()).block();

        StepVerifier.create(sessionManager.verifyOtp("alice", notificationSender.lastCode("alice"), IP))
                .expectError(RateLimitExceededException.class)
                .verify();
        verify(eventPublisher, never()).publishEvent(any(AuthSuccessEvent.class));
    }
}
