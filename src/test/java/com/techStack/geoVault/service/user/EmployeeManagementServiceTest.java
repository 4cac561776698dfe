package com.techStack.geoVault.service.user;

import com.techStack.geoVault.dto.request.EmployeeCreateRequest;
import com.techStack.geoVault.dto.request.EmployeeUpdateRequest;
import com.techStack.geoVault.exception.resource.ConflictException;
import com.techStack.geoVault.exception.resource.ResourceNotFoundException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.support.InMemoryUserRepository;
import com.techStack.geoVault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class EmployeeManagementServiceTest {

    private static final PasswordEncoder ENCODER = new BCryptPasswordEncoder(4);

    private InMemoryUserRepository userRepository;
    private EmployeeManagementService employeeService;

    @BeforeEach
    void setUp() {
        userRepository = new InMemoryUserRepository();
        employeeService = new EmployeeManagementService(userRepository, ENCODER,
                new MutableClock(Instant.parse("2026-03-02T10:00:00Z")));
        userRepository.save(User.builder().username("admin").email("admin@example.com")
                .role(Roles.ADMIN).active(true).build()).block();
    }

    @Test
    void createEmployee_shouldHashPasswordAndAssignEmployeeRole() {
        StepVerifier.create(employeeService.createEmployee(
                        new EmployeeCreateRequest("alice", "Alice@Example.com", "Sup3rSecret"), "admin"))
                .assertNext(user -> {
                    assertThat(user.getRole()).isEqualTo(Roles.EMPLOYEE);
                    assertThat(user.isActive()).isTrue();
                    assertThat(user.getEmail()).isEqualTo("alice@example.com");
                    assertThat(ENCODER.matches("Sup3rSecret", user.getPasswordHash())).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void createEmployee_shouldConflict_onDuplicateUsernameOrEmail() {
        employeeService.createEmployee(new EmployeeCreateRequest("alice", "alice@example.com", "Sup3rSecret"), "admin")
                .block();

        StepVerifier.create(employeeService.createEmployee(
                        new EmployeeCreateRequest("alice", "other@example.com", "Sup3rSecret"), "admin"))
                .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(ConflictException.class)
                        .hasMessage("Username already exists"))
                .verify();
        StepVerifier.create(employeeService.createEmployee(
                        new EmployeeCreateRequest("alice2", "ALICE@example.com", "Sup3rSecret"), "admin"))
                .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(ConflictException.class)
                        .hasMessage("Email already registered"))
                .verify();
    }

    @Test
    void createEmployee_shouldValidateInput() {
        StepVerifier.create(employeeService.createEmployee(
                        new EmployeeCreateRequest("a", "alice@example.com", "Sup3rSecret"), "admin"))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(employeeService.createEmployee(
                        new EmployeeCreateRequest("alice", "nope", "Sup3rSecret"), "admin"))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(employeeService.createEmployee(
                        new EmployeeCreateRequest("alice", "alice@example.com", "short"), "admin"))
                .expectError(ValidationException.class)
                .verify();
        assertThat(userRepository.size()).isEqualTo(1);
    }

    @Test
    void updateEmployee_shouldApplyOnlyGivenFields() {
        User created = employeeService.createEmployee(
                new EmployeeCreateRequest("alice", "alice@example.com", "Sup3rSecret"), "admin").block();

        StepVerifier.create(employeeService.updateEmployee("alice", new EmployeeUpdateRequest(null, null, false), "admin"))
                .assertNext(user -> {
                    assertThat(user.isActive()).isFalse();
                    assertThat(user.getEmail()).isEqualTo("alice@example.com");
                    assertThat(user.getPasswordHash()).isEqualTo(created.getPasswordHash());
                    assertThat(user.getRole()).isEqualTo(Roles.EMPLOYEE);
                })
                .verifyComplete();
    }

    @Test
    void employeeOperations_shouldNotReachAdminAccounts() {
        StepVerifier.create(employeeService.getEmployee("admin"))
                .expectError(ResourceNotFoundException.class)
                .verify();
        StepVerifier.create(employeeService.deleteEmployee("admin", "admin"))
                .expectError(ResourceNotFoundException.class)
                .verify();
        assertThat(userRepository.get("admin")).isNotNull();
    }

    @Test
    void listEmployees_shouldSortByUsername() {
        employeeService.createEmployee(new EmployeeCreateRequest("zoe", "zoe@example.com", "Sup3rSecret"), "admin").block();
        employeeService.createEmployee(new EmployeeCreateRequest("bob", "bob@example.com", "Sup3rSecret"), "admin").block();

        StepVerifier.create(employeeService.listEmployees().map(User::getUsername).collectList())
                .assertNext(names -> assertThat(names).containsExactly("bob", "zoe"))
                .verifyComplete();
    }

    @Test
    void deleteEmployee_shouldRemoveAccount() {
        employeeService.createEmployee(new EmployeeCreateRequest("alice", "alice@example.com", "Sup3rSecret"), "admin")
                .block();

        StepVerifier.create(employeeService.deleteEmployee("alice", "admin")).verifyComplete();

        assertThat(userRepository.get("alice")).isNull();
    }
}
