package com.techStack.geoVault.service.user;

import com.techStack.geoVault.config.notification.NotificationProperties;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.models.audit.AuthEventType;
import com.techStack.geoVault.models.auth.TokenType;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.security.SecurityStateStore;
import com.techStack.geoVault.repository.user.UserRepository;
import com.techStack.geoVault.service.notification.NotificationSender;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.service.token.JwtService;
import com.techStack.geoVault.service.token.TokenRevocationService;
import com.techStack.geoVault.util.validation.HelperUtils;
import com.techStack.geoVault.util.validation.PasswordRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;

/**
 * Email-based password reset with single-use tokens.
 * <p>
 * The issued reset token is stored under {@code reset:<username>}; completing a reset takes it
 * out of the store, so a second use of the same token fails. Requests for unknown emails
 * complete exactly like requests for known ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    private static final String INVALID_RESET_TOKEN = "Reset token is invalid or has already been used";

    private final UserRepository userRepository;
    private final JwtService jwtService;
    private final SecurityStateStore stateStore;
    private final TokenRevocationService revocationService;
    private final NotificationSender notificationSender;
    private final NotificationProperties notificationProperties;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;

    public Mono<Void> requestReset(String email, String ipAddress) {
        String normalized = HelperUtils.normalizeEmail(email);
        if (normalized == null || !SecurityConstants.EMAIL_PATTERN.matcher(normalized).matches()) {
            return Mono.empty();
        }

        return userRepository.findByEmail(normalized)
                .filter(User::isActive)
                .flatMap(user -> {
                    String token = jwtService.generateToken(user.getUsername(), null, TokenType.RESET);
                    Duration ttl = Duration.ofSeconds(jwtService.expirationSeconds(TokenType.RESET));
                    String link = UriComponentsBuilder.fromUriString(notificationProperties.getResetLinkBase())
                            .queryParam("token", token)
                            .build()
                            .toUriString();

                    return stateStore.put(resetKey(user.getUsername()), token, ttl)
                            .then(notificationSender.sendPasswordResetLink(user.getEmail(), user.getUsername(), link, ttl))
                            .doOnSuccess(v -> log.info("🔁 Password reset requested for {}",
                                    HelperUtils.maskEmail(normalized)));
                })
                .onErrorResume(e -> {
                    log.error("❌ Password reset request for {} failed: {}",
                            HelperUtils.maskEmail(normalized), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    public Mono<Void> completeReset(String token, String newPassword, String ipAddress) {
        return Mono.fromRunnable(() -> PasswordRules.validate("newPassword", newPassword))
                .then(jwtService.validateToken(token, TokenType.RESET))
                .flatMap(claims -> stateStore.take(resetKey(claims.subject()))
                        .filter(stored -> MessageDigest.isEqual(
                                stored.getBytes(StandardCharsets.UTF_8),
                                token.getBytes(StandardCharsets.UTF_8)))
                        .switchIfEmpty(Mono.error(new InvalidTokenException(INVALID_RESET_TOKEN)))
                        .then(userRepository.findByUsername(claims.subject()))
                        .switchIfEmpty(Mono.error(new InvalidTokenException(INVALID_RESET_TOKEN)))
                        .flatMap(user -> encode(newPassword)
                                .flatMap(hash -> userRepository.save(user.toBuilder()
                                        .passwordHash(hash)
                                        .otpHash(null)
                                        .otpExpiresAt(null)
                                        .otpSentAt(null)
                                        .build())))
                        .flatMap(saved -> revocationService.revoke(claims)
                                .then(auditLogService.recordAuthEvent(AuthEventType.PASSWORD_RESET,
                                        saved.getUsername(), "reset via email link", ipAddress))
                                .doOnSuccess(v -> log.info("✅ Password reset completed for {}",
                                        HelperUtils.maskUsername(saved.getUsername())))));
    }

    private Mono<String> encode(String password) {
        return Mono.fromCallable(() -> passwordEncoder.encode(password))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static String resetKey(String username) {
        return SecurityConstants.RESET_PREFIX + username;
    }
}
