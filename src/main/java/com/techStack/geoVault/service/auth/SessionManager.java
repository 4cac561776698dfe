package com.techStack.geoVault.service.auth;

import com.techStack.geoVault.config.security.OtpProperties;
import com.techStack.geoVault.event.AuthFailureEvent;
import com.techStack.geoVault.event.AuthSuccessEvent;
import com.techStack.geoVault.exception.account.AccountDisabledException;
import com.techStack.geoVault.exception.auth.AuthenticationFailedException;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.exception.security.RateLimitExceededException;
import com.techStack.geoVault.exception.service.CustomException;
import com.techStack.geoVault.models.audit.AuthEventType;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.models.auth.IssuedTokens;
import com.techStack.geoVault.models.auth.OtpChallenge;
import com.techStack.geoVault.models.auth.TokenClaims;
import com.techStack.geoVault.models.auth.TokenType;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.user.UserRepository;
import com.techStack.geoVault.service.notification.NotificationSender;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.service.security.OtpService;
import com.techStack.geoVault.service.security.RateLimiterService;
import com.techStack.geoVault.service.token.JwtService;
import com.techStack.geoVault.service.token.TokenRevocationService;
import com.techStack.geoVault.util.validation.HelperUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Login lifecycle: password check, OTP challenge, token issue, refresh, logout and
 * per-request token authentication.
 * <p>
 * A login moves from no session to OTP pending (after the password check) to authenticated
 * (after OTP verification). Every authentication failure surfaces the same generic message;
 * the specific reason only reaches logs and the audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionManager {

    private static final String OTP_SEND_FAILED = "Failed to send OTP. Please try again later.";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final OtpService otpService;
    private final OtpProperties otpProperties;
    private final NotificationSender notificationSender;
    private final RateLimiterService rateLimiterService;
    private final JwtService jwtService;
    private final TokenRevocationService revocationService;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /* =========================
       Login / OTP
       ========================= */

    public Mono<OtpChallenge> login(String username, String password, String ipAddress) {
        if (StringUtils.isAnyBlank(username, password)) {
            return fail(username, ipAddress, "missing credentials");
        }

        return rateLimiterService.checkLoginRateLimit(username)
                .doOnError(RateLimitExceededException.class, e -> publishFailure(username, ipAddress, "rate limited"))
                .then(userRepository.findByUsername(username))
                .switchIfEmpty(Mono.defer(() -> fail(username, ipAddress, "unknown user")))
                .flatMap(user -> passwordMatches(password, user)
                        .flatMap(matches -> {
                            if (!matches) {
                                return fail(username, ipAddress, "bad password");
                            }
                            if (!user.isActive()) {
                                publishFailure(username, ipAddress, "account disabled");
                                return Mono.error(new AccountDisabledException());
                            }
                            return issueOtp(user, ipAddress);
                        }));
    }

    public Mono<OtpChallenge> resendOtp(String username, String ipAddress) {
        return userRepository.findByUsername(StringUtils.defaultString(username))
                .switchIfEmpty(Mono.defer(() -> fail(username, ipAddress, "resend for unknown user")))
                .flatMap(user -> {
                    if (user.getOtpHash() == null) {
                        return fail(username, ipAddress, "resend without pending OTP");
                    }
                    if (!user.isActive()) {
                        return Mono.error(new AccountDisabledException());
                    }
                    Instant now = clock.instant();
                    if (user.getOtpSentAt() != null) {
                        Instant allowedAt = user.getOtpSentAt().plus(otpProperties.getResendCooldown());
                        if (now.isBefore(allowedAt)) {
                            return Mono.error(new RateLimitExceededException(
                                    "Please wait before requesting a new OTP", Duration.between(now, allowedAt)));
                        }
                    }
                    return issueOtp(user, ipAddress);
                });
    }

    public Mono<IssuedTokens> verifyOtp(String username, String code, String ipAddress) {
        if (StringUtils.isAnyBlank(username, code)) {
            return fail(username, ipAddress, "missing OTP");
        }

        return rateLimiterService.checkRateLimit("otp:" + username,
                        otpProperties.getMaxVerifyAttempts(), otpProperties.getTtl())
                .then(userRepository.findByUsername(username))
                .switchIfEmpty(Mono.defer(() -> fail(username, ipAddress, "OTP for unknown user")))
                .flatMap(user -> {
                    if (user.getOtpHash() == null || user.getOtpExpiresAt() == null) {
                        return fail(username, ipAddress, "no pending OTP");
                    }
                    if (!clock.instant().isBefore(user.getOtpExpiresAt())) {
                        return fail(username, ipAddress, "OTP expired");
                    }
                    if (!otpService.matches(code, user.getOtpHash())) {
                        return fail(username, ipAddress, "OTP mismatch");
                    }
                    if (!user.isActive()) {
                        return Mono.error(new AccountDisabledException());
                    }
                    return userRepository.save(user.withoutOtp())
                            .map(saved -> issueTokens(saved, ipAddress));
                });
    }

    /* =========================
       Tokens
       ========================= */

    public Mono<IssuedTokens> refresh(String refreshToken) {
        return jwtService.validateToken(refreshToken, TokenType.REFRESH)
                .flatMap(claims -> requireNotRevoked(claims)
                        .then(userRepository.findByUsername(claims.subject()))
                        .switchIfEmpty(Mono.error(new InvalidTokenException("Invalid refresh token")))
                        .flatMap(user -> {
                            if (!user.isActive()) {
                                return Mono.error(new AccountDisabledException());
                            }
                            String accessToken = jwtService.generateToken(user.getUsername(), user.getRole(), TokenType.ACCESS);
                            return Mono.just(IssuedTokens.builder()
                                    .username(user.getUsername())
                                    .role(user.getRole())
                                    .accessToken(accessToken)
                                    .refreshToken(refreshToken)
                                    .accessExpiresIn(jwtService.expirationSeconds(TokenType.ACCESS))
                                    .refreshExpiresIn(claims.remainingLifetime(clock.instant()).toSeconds())
                                    .build());
                        }));
    }

    /**
     * Revokes the access token and, when given and belonging to the same user, the refresh token.
     */
    public Mono<Void> logout(String accessToken, String refreshToken, String ipAddress) {
        return jwtService.validateToken(accessToken, TokenType.ACCESS)
                .flatMap(access -> revocationService.revoke(access)
                        .then(revokeRefreshIfOwned(refreshToken, access.subject()))
                        .then(auditLogService.recordAuthEvent(AuthEventType.LOGOUT, access.subject(), null, ipAddress))
                        .doOnSuccess(v -> log.info("👋 Logged out {}", HelperUtils.maskUsername(access.subject()))));
    }

    /**
     * Verifies an access token and that its id has not been revoked.
     */
    public Mono<AuthenticatedUser> authenticate(String accessToken) {
        return jwtService.validateToken(accessToken, TokenType.ACCESS)
                .flatMap(claims -> {
                    if (claims.role() == null) {
                        return Mono.error(new InvalidTokenException("Invalid token"));
                    }
                    return requireNotRevoked(claims)
                            .thenReturn(new AuthenticatedUser(claims.subject(), claims.role(),
                                    claims.tokenId(), claims.expiresAt()));
                });
    }

    /* =========================
       Internals
       ========================= */

    private Mono<OtpChallenge> issueOtp(User user, String ipAddress) {
        String code = otpService.generateCode();
        Instant now = clock.instant();
        Instant expiresAt = now.plus(otpProperties.getTtl());

        User pending = user.toBuilder()
                .otpHash(otpService.hash(code))
                .otpExpiresAt(expiresAt)
                .otpSentAt(now)
                .build();

        return userRepository.save(pending)
                .then(notificationSender.sendOtp(user.getEmail(), user.getUsername(), code, otpProperties.getTtl())
                        .onErrorMap(e -> new CustomException(HttpStatus.INTERNAL_SERVER_ERROR, OTP_SEND_FAILED, e)))
                .then(auditLogService.recordAuthEvent(AuthEventType.OTP_SENT, user.getUsername(), null, ipAddress))
                .then(Mono.fromCallable(() -> {
                    meterRegistry.counter("auth.otp.sent").increment();
                    log.info("🔑 OTP issued for {}", HelperUtils.maskUsername(user.getUsername()));
                    return new OtpChallenge(user.getUsername(), user.getRole(), expiresAt);
                }));
    }

    private IssuedTokens issueTokens(User user, String ipAddress) {
        String accessToken = jwtService.generateToken(user.getUsername(), user.getRole(), TokenType.ACCESS);
        String refreshToken = jwtService.generateToken(user.getUsername(), user.getRole(), TokenType.REFRESH);

        eventPublisher.publishEvent(new AuthSuccessEvent(user, ipAddress, clock.instant()));

        return IssuedTokens.builder()
                .username(user.getUsername())
                .role(user.getRole())
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .accessExpiresIn(jwtService.expirationSeconds(TokenType.ACCESS))
                .refreshExpiresIn(jwtService.expirationSeconds(TokenType.REFRESH))
                .build();
    }

    private Mono<Void> requireNotRevoked(TokenClaims claims) {
        return revocationService.isRevoked(claims.tokenId())
                .flatMap(revoked -> revoked
                        ? Mono.<Void>error(new InvalidTokenException("Token has been revoked"))
                        : Mono.<Void>empty());
    }

    private Mono<Void> revokeRefreshIfOwned(String refreshToken, String username) {
        if (StringUtils.isBlank(refreshToken)) {
            return Mono.empty();
        }
        return jwtService.validateToken(refreshToken, TokenType.REFRESH)
                .filter(claims -> username.equals(claims.subject()))
                .flatMap(revocationService::revoke)
                .onErrorResume(InvalidTokenException.class, e -> {
                    log.debug("Refresh token presented at logout was not revocable: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Boolean> passwordMatches(String rawPassword, User user) {
        return Mono.fromCallable(() -> user.getPasswordHash() != null
                        && passwordEncoder.matches(rawPassword, user.getPasswordHash()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private <T> Mono<T> fail(String username, String ipAddress, String reason) {
        publishFailure(username, ipAddress, reason);
        return Mono.error(new AuthenticationFailedException(reason));
    }

    private void publishFailure(String username, String ipAddress, String reason) {
        eventPublisher.publishEvent(new AuthFailureEvent(
                StringUtils.defaultString(username), ipAddress, reason, clock.instant()));
    }
}
