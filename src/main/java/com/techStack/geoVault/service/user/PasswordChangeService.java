package com.techStack.geoVault.service.user;

import com.techStack.geoVault.exception.resource.ResourceNotFoundException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.audit.AuthEventType;
import com.techStack.geoVault.repository.user.UserRepository;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.util.validation.HelperUtils;
import com.techStack.geoVault.util.validation.PasswordRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordChangeService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;

    public Mono<Void> changePassword(String username, String currentPassword, String newPassword, String ipAddress) {
        return Mono.fromRunnable(() -> PasswordRules.validate("newPassword", newPassword))
                .then(userRepository.findByUsername(username))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", username)))
                .flatMap(user -> Mono.fromCallable(() -> {
                            if (currentPassword == null || !passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
                                throw new ValidationException("currentPassword", "Current password is incorrect");
                            }
                            if (passwordEncoder.matches(newPassword, user.getPasswordHash())) {
                                throw new ValidationException("newPassword", "New password must differ from the current one");
                            }
                            return user.toBuilder().passwordHash(passwordEncoder.encode(newPassword)).build();
                        })
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(userRepository::save)
                .flatMap(saved -> auditLogService.recordAuthEvent(AuthEventType.PASSWORD_CHANGED,
                        saved.getUsername(), null, ipAddress))
                .doOnSuccess(v -> log.info("🔒 Password changed for {}", HelperUtils.maskUsername(username)));
    }
}
