package com.techStack.geoVault.service.user;

import com.techStack.geoVault.config.notification.NotificationProperties;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.security.InMemorySecurityStateStore;
import com.techStack.geoVault.service.observability.AuditLogService;
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
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class PasswordResetServiceTest {

    private static final PasswordEncoder ENCODER = new BCryptPasswordEncoder(4);

    private MutableClock clock;
    private InMemoryUserRepository userRepository;
    private InMemoryAuthEventRepository authEvents;
    private RecordingNotificationSender notificationSender;
    private PasswordResetService passwordResetService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        userRepository = new InMemoryUserRepository();
        authEvents = new InMemoryAuthEventRepository();
        notificationSender = new RecordingNotificationSender();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        InMemorySecurityStateStore stateStore = new InMemorySecurityStateStore(clock);
        JwtService jwtService = TestSecurity.jwtService(clock);

        passwordResetService = new PasswordResetService(
                userRepository,
                jwtService,
                stateStore,
                new TokenRevocationService(stateStore, meterRegistry, clock),
                notificationSender,
                new NotificationProperties(),
                ENCODER,
                new AuditLogService(new InMemoryAccessLogRepository(), authEvents, meterRegistry, clock));

        userRepository.save(User.builder()
                .username("alice")
                .email("alice@example.com")
                .passwordHash(ENCODER.encode("OldPassword1"))
                .role(Roles.EMPLOYEE)
                .active(true)
                .build()).block();
    }

    private String requestToken() {
        passwordResetService.requestReset("Alice@Example.com", "10.0.0.1").block();
        String link = notificationSender.lastResetLink("alice");
        assertThat(link).startsWith("http://localhost:3000/reset-password?token=");
        return link.substring(link.indexOf("token=") + "token=".length());
    }

    @Test
    void completeReset_shouldChangePassword_whenTokenValid() {
        String token = requestToken();

        StepVerifier.create(passwordResetService.completeReset(token, "BrandNew#Pass", "10.0.0.1"))
                .verifyComplete();

        assertThat(ENCODER.matches("BrandNew#Pass", userRepository.get("alice").getPasswordHash())).isTrue();
        assertThat(authEvents.events()).extracting(e -> e.getEventType().name()).contains("PASSWORD_RESET");
    }

    @Test
    void completeReset_shouldRejectSecondUseOfSameToken() {
        String token = requestToken();
        passwordResetService.completeReset(token, "BrandNew#Pass", "10.0.0.1").block();

        StepVerifier.create(passwordResetService.completeReset(token, "Another#Pass1", "10.0.0.1"))
                .expectError(InvalidTokenException.class)
                .verify();
        assertThat(ENCODER.matches("BrandNew#Pass", userRepository.get("alice").getPasswordHash())).isTrue();
    }

    @Test
    void completeReset_shouldRejectSupersededToken() {
        String first = requestToken();
        requestToken();

        StepVerifier.create(passwordResetService.completeReset(first, "BrandNew#Pass", "10.0.0.1"))
                .expectError(InvalidTokenException.class)
                .verify();
    }

    @Test
    void completeReset_shouldRejectExpiredToken() {
        String token = requestToken();
        clock.advance(Duration.ofHours(2));

        StepVerifier.create(passwordResetService.completeReset(token, "BrandNew#Pass", "10.0.0.1"))
                .expectError(InvalidTokenException.class)
                .verify();
    }

    @Test
    void completeReset_shouldValidatePasswordBeforeConsumingToken() {
        String token = requestToken();

        StepVerifier.create(passwordResetService.completeReset(token, "short", "10.0.0.1"))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(passwordResetService.completeReset(token, "LongEnough1", "10.0.0.1"))
                .verifyComplete();
    }

    @Test
    void requestReset_shouldCompleteSilently_whenEmailUnknownOrMalformed() {
        StepVerifier.create(passwordResetService.requestReset("nobody@example.com", "10.0.0.1")).verifyComplete();
        StepVerifier.create(passwordResetService.requestReset("not-an-email", "10.0.0.1")).verifyComplete();

        assertThat(notificationSender.lastResetLink("alice")).isNull();
    }

    @Test
    void requestReset_shouldSkipDisabledAccounts() {
        userRepository.save(userRepository.get("alice").toBuilder().active(false).build()).block();

        StepVerifier.create(passwordResetService.requestReset("alice@example.com", "10.0.0.1")).verifyComplete();

        assertThat(notificationSender.lastResetLink("alice")).isNull();
    }
}
