package com.techStack.geoVault.controller.diagnostic;

import com.techStack.geoVault.dto.response.ApiResponse;
import com.techStack.geoVault.dto.response.ServerTimeResponse;
import com.techStack.geoVault.models.crypto.CryptoCapabilities;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.models.policy.PolicyDecision;
import com.techStack.geoVault.models.policy.PolicyOverride;
import com.techStack.geoVault.service.crypto.CryptoEngine;
import com.techStack.geoVault.service.policy.PolicyConfigService;
import com.techStack.geoVault.service.policy.PolicyEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Policy dry-run, server time and crypto capabilities.
 */
@RestController
@RequiredArgsConstructor
public class DiagnosticsController {

    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final PolicyEngine policyEngine;
    private final PolicyConfigService policyConfigService;
    private final CryptoEngine cryptoEngine;
    private final Clock clock;

    /**
     * Evaluates a hypothetical request against the current policy without touching any file
     * and without WFH overrides.
     */
    @GetMapping("/api/policy/validate")
    public Mono<ResponseEntity<ApiResponse<PolicyDecision>>> validate(
            @RequestParam(required = false) Double latitude,
            @RequestParam(required = false) Double longitude,
            @RequestParam(required = false) String network) {

        AccessRequest request = new AccessRequest(latitude, longitude, network);
        return policyConfigService.currentPolicy()
                .map(policy -> policyEngine.evaluate(request, policy, PolicyOverride.NONE))
                .map(decision -> ResponseEntity.ok(ApiResponse.success(decision)));
    }

    @GetMapping("/api/time")
    public Mono<ResponseEntity<ApiResponse<ServerTimeResponse>>> serverTime() {
        Instant now = clock.instant();
        String local = LocalTime.ofInstant(now, policyEngine.zone()).format(HH_MM_SS);
        return Mono.just(ResponseEntity.ok(ApiResponse.success(
                new ServerTimeResponse(now, local, policyEngine.zone().getId()))));
    }

    @GetMapping({"/api/crypto/info", "/api/admin/crypto/info"})
    public Mono<ResponseEntity<ApiResponse<CryptoCapabilities>>> cryptoInfo() {
        return Mono.fromCallable(cryptoEngine::capabilities)
                .map(capabilities -> ResponseEntity.ok(ApiResponse.success(capabilities)));
    }
}
