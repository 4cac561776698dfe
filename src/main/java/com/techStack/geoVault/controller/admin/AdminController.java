package com.techStack.geoVault.controller.admin;

import com.techStack.geoVault.dto.request.EmployeeCreateRequest;
import com.techStack.geoVault.dto.request.EmployeeUpdateRequest;
import com.techStack.geoVault.dto.request.PolicyConfigRequest;
import com.techStack.geoVault.dto.request.WfhDecisionRequest;
import com.techStack.geoVault.dto.response.ApiResponse;
import com.techStack.geoVault.dto.response.EmployeeResponse;
import com.techStack.geoVault.dto.response.WfhGrantResponse;
import com.techStack.geoVault.models.audit.AccessDecisionLog;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.service.policy.PolicyConfigService;
import com.techStack.geoVault.service.user.EmployeeManagementService;
import com.techStack.geoVault.service.wfh.WfhGrantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Admin API: employees, access policy, WFH decisions and the access log.
 * Role enforcement happens in the security filter chain.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final int MAX_LOG_LIMIT = 1000;

    private final EmployeeManagementService employeeService;
    private final PolicyConfigService policyConfigService;
    private final WfhGrantService wfhGrantService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /* =========================
       Employees
       ========================= */

    @PostMapping("/employees")
    public Mono<ResponseEntity<ApiResponse<EmployeeResponse>>> createEmployee(
            @Valid @RequestBody EmployeeCreateRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {

        return employeeService.createEmployee(request, admin.username())
                .map(user -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.success("Employee created", EmployeeResponse.from(user))));
    }

    @GetMapping("/employees")
    public Mono<ResponseEntity<ApiResponse<List<EmployeeResponse>>>> listEmployees() {
        return employeeService.listEmployees()
                .map(EmployeeResponse::from)
                .collectList()
                .map(list -> ResponseEntity.ok(ApiResponse.success(list)));
    }

    @GetMapping("/employees/{username}")
    public Mono<ResponseEntity<ApiResponse<EmployeeResponse>>> getEmployee(@PathVariable String username) {
        return employeeService.getEmployee(username)
                .map(user -> ResponseEntity.ok(ApiResponse.success(EmployeeResponse.from(user))));
    }

    @PutMapping("/employees/{username}")
    public Mono<ResponseEntity<ApiResponse<EmployeeResponse>>> updateEmployee(
            @PathVariable String username,
            @Valid @RequestBody EmployeeUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {

        return employeeService.updateEmployee(username, request, admin.username())
                .map(user -> ResponseEntity.ok(ApiResponse.success("Employee updated", EmployeeResponse.from(user))));
    }

    @DeleteMapping("/employees/{username}")
    public Mono<ResponseEntity<ApiResponse<Void>>> deleteEmployee(
            @PathVariable String username,
            @AuthenticationPrincipal AuthenticatedUser admin) {

        return employeeService.deleteEmployee(username, admin.username())
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(ApiResponse.success("Employee deleted"))));
    }

    /* =========================
       Policy
       ========================= */

    @GetMapping("/policy-config")
    public Mono<ResponseEntity<ApiResponse<AccessPolicy>>> getPolicy() {
        return policyConfigService.currentPolicy()
                .map(policy -> ResponseEntity.ok(ApiResponse.success(policy)));
    }

    @PutMapping("/policy-config")
    public Mono<ResponseEntity<ApiResponse<AccessPolicy>>> updatePolicy(
            @Valid @RequestBody PolicyConfigRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {

        return policyConfigService.updatePolicy(request, admin.username())
                .map(policy -> ResponseEntity.ok(ApiResponse.success("Policy updated", policy)));
    }

    /* =========================
       WFH
       ========================= */

    @GetMapping("/wfh-requests")
    public Mono<ResponseEntity<ApiResponse<List<WfhGrantResponse>>>> listWfhRequests() {
        return wfhGrantService.listAll()
                .map(grant -> WfhGrantResponse.from(grant, clock.instant()))
                .collectList()
                .map(list -> ResponseEntity.ok(ApiResponse.success(list)));
    }

    @PutMapping("/wfh-requests/{username}")
    public Mono<ResponseEntity<ApiResponse<WfhGrantResponse>>> decideWfhRequest(
            @PathVariable String username,
            @Valid @RequestBody WfhDecisionRequest request,
            @AuthenticationPrincipal AuthenticatedUser admin) {

        return wfhGrantService.decide(username, request, admin.username())
                .map(grant -> ResponseEntity.ok(ApiResponse.success("WFH request " + grant.getStatus().name().toLowerCase(),
                        WfhGrantResponse.from(grant, clock.instant()))));
    }

    /* =========================
       Audit
       ========================= */

    @GetMapping("/access-logs")
    public Mono<ResponseEntity<ApiResponse<List<AccessDecisionLog>>>> accessLogs(
            @RequestParam(defaultValue = "100") int limit) {

        int bounded = Math.max(1, Math.min(limit, MAX_LOG_LIMIT));
        return auditLogService.recentAccessLogs(bounded)
                .collectList()
                .map(logs -> ResponseEntity.ok(ApiResponse.success(logs)));
    }
}
