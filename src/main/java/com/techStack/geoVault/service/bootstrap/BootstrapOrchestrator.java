package com.techStack.geoVault.service.bootstrap;

import com.techStack.geoVault.config.bootstrap.BootstrapProperties;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.user.UserRepository;
import com.techStack.geoVault.service.policy.PolicyConfigService;
import com.techStack.geoVault.util.validation.HelperUtils;
import com.techStack.geoVault.util.validation.PasswordRules;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Seeds the admin account and the default access policy on startup when they are absent.
 * Runs without blocking startup; failures are logged and counted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BootstrapOrchestrator implements CommandLineRunner {

    private static final Duration BOOTSTRAP_TIMEOUT = Duration.ofMinutes(2);

    private final BootstrapProperties properties;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PolicyConfigService policyConfigService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public void run(String... args) {
        if (!properties.isEnabled()) {
            log.info("⏭️ Bootstrap disabled");
            return;
        }
        log.info("🚀 Initiating bootstrap check...");

        bootstrap()
                .timeout(BOOTSTRAP_TIMEOUT)
                .doOnSuccess(v -> {
                    log.info("✅ Bootstrap process completed");
                    meterRegistry.counter("bootstrap.completed").increment();
                })
                .doOnError(e -> {
                    log.error("💥 Bootstrap process failed: {}", e.getMessage(), e);
                    meterRegistry.counter("bootstrap.failure").increment();
                })
                .subscribe();
    }

    public Mono<Void> bootstrap() {
        return ensureAdmin()
                .then(policyConfigService.ensureDefaultPolicy())
                .doOnNext(created -> {
                    if (created) {
                        log.info("📍 Default access policy stored");
                    }
                })
                .then();
    }

    private Mono<Void> ensureAdmin() {
        String username = properties.getUsername();
        return userRepository.findByUsername(username)
                .doOnNext(existing -> log.info("✅ Admin account {} already present", HelperUtils.maskUsername(username)))
                .hasElement()
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.empty();
                    }
                    if (StringUtils.isBlank(properties.getPassword())) {
                        log.error("❌ bootstrap.admin.password is not set - admin account not created");
                        meterRegistry.counter("bootstrap.config.invalid").increment();
                        return Mono.empty();
                    }
                    return createAdmin(username);
                });
    }

    private Mono<Void> createAdmin(String username) {
        return Mono.fromCallable(() -> {
                    PasswordRules.validate("bootstrap.admin.password", properties.getPassword());
                    return User.builder()
                            .username(username)
                            .email(HelperUtils.normalizeEmail(properties.getEmail()))
                            .passwordHash(passwordEncoder.encode(properties.getPassword()))
                            .role(Roles.ADMIN)
                            .active(true)
                            .createdAt(clock.instant())
                            .build();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(userRepository::save)
                .doOnSuccess(admin -> log.info("🔐 Admin account {} created", HelperUtils.maskUsername(username)))
                .then();
    }
}
