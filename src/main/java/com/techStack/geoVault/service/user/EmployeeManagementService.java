package com.techStack.geoVault.service.user;

import com.techStack.geoVault.dto.request.EmployeeCreateRequest;
import com.techStack.geoVault.dto.request.EmployeeUpdateRequest;
import com.techStack.geoVault.exception.resource.ConflictException;
import com.techStack.geoVault.exception.resource.ResourceNotFoundException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.repository.user.UserRepository;
import com.techStack.geoVault.util.validation.HelperUtils;
import com.techStack.geoVault.util.validation.PasswordRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Comparator;

import static com.techStack.geoVault.constants.SecurityConstants.EMAIL_PATTERN;
import static com.techStack.geoVault.constants.SecurityConstants.USERNAME_PATTERN;

/**
 * Admin-side lifecycle of employee accounts. Admin accounts are never reachable through here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmployeeManagementService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    /* =========================
       Create
       ========================= */

    public Mono<User> createEmployee(EmployeeCreateRequest request, String actor) {
        String username = StringUtils.trimToEmpty(request.getUsername());
        String email = HelperUtils.normalizeEmail(request.getEmail());

        return Mono.fromRunnable(() -> {
                    if (!USERNAME_PATTERN.matcher(username).matches()) {
                        throw new ValidationException("username", "Username must be 3-64 letters, digits, '.', '_' or '-'");
                    }
                    if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
                        throw new ValidationException("email", "Invalid email format");
                    }
                    PasswordRules.validate("password", request.getPassword());
                })
                .then(Mono.defer(() -> userRepository.findByUsername(username)
                        .flatMap(existing -> Mono.<User>error(new ConflictException("username", "Username already exists")))))
                .then(Mono.defer(() -> userRepository.findByEmail(email)
                        .flatMap(existing -> Mono.<User>error(new ConflictException("email", "Email already registered")))))
                .then(encode(request.getPassword()))
                .map(hash -> User.builder()
                        .username(username)
                        .email(email)
                        .passwordHash(hash)
                        .role(Roles.EMPLOYEE)
                        .active(true)
                        .createdAt(clock.instant())
                        .build())
                .flatMap(userRepository::save)
                .doOnSuccess(user -> log.info("👤 Employee {} created by {}",
                        HelperUtils.maskUsername(username), HelperUtils.maskUsername(actor)));
    }

    /* =========================
       Read
       ========================= */

    public Flux<User> listEmployees() {
        return userRepository.findByRole(Roles.EMPLOYEE)
                .sort(Comparator.comparing(User::getUsername));
    }

    public Mono<User> getEmployee(String username) {
        return findEmployee(username);
    }

    /* =========================
       Update / Delete
       ========================= */

    /**
     * Applies only {@code email}, {@code password} and {@code active}; null fields are left unchanged.
     */
    public Mono<User> updateEmployee(String username, EmployeeUpdateRequest request, String actor) {
        return findEmployee(username)
                .flatMap(user -> applyEmail(user, request.getEmail()))
                .flatMap(user -> applyPassword(user, request.getPassword()))
                .map(user -> request.getActive() == null ? user : user.toBuilder().active(request.getActive()).build())
                .flatMap(userRepository::save)
                .doOnSuccess(user -> log.info("✏️ Employee {} updated by {} (active={})",
                        HelperUtils.maskUsername(username), HelperUtils.maskUsername(actor), user.isActive()));
    }

    public Mono<Void> deleteEmployee(String username, String actor) {
        return findEmployee(username)
                .flatMap(user -> userRepository.deleteByUsername(user.getUsername()))
                .doOnSuccess(v -> log.info("🗑️ Employee {} deleted by {}",
                        HelperUtils.maskUsername(username), HelperUtils.maskUsername(actor)));
    }

    /* =========================
       Internals
       ========================= */

    private Mono<User> findEmployee(String username) {
        return userRepository.findByUsername(StringUtils.defaultString(username))
                .filter(user -> user.getRole() == Roles.EMPLOYEE)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Employee", username)));
    }

    private Mono<User> applyEmail(User user, String rawEmail) {
        if (rawEmail == null) {
            return Mono.just(user);
        }
        String email = HelperUtils.normalizeEmail(rawEmail);
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            return Mono.error(new ValidationException("email", "Invalid email format"));
        }
        if (email.equals(user.getEmail())) {
            return Mono.just(user);
        }
        return userRepository.findByEmail(email)
                .flatMap(other -> Mono.<User>error(new ConflictException("email", "Email already registered")))
                .switchIfEmpty(Mono.fromSupplier(() -> user.toBuilder().email(email).build()));
    }

    private Mono<User> applyPassword(User user, String password) {
        if (password == null) {
            return Mono.just(user);
        }
        return Mono.fromRunnable(() -> PasswordRules.validate("password", password))
                .then(encode(password))
                .map(hash -> user.toBuilder().passwordHash(hash).build());
    }

    private Mono<String> encode(String password) {
        return Mono.fromCallable(() -> passwordEncoder.encode(password))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
