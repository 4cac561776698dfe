package com.techStack.geoVault.service.policy;

import com.techStack.geoVault.config.policy.PolicyProperties;
import com.techStack.geoVault.dto.request.PolicyConfigRequest;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.repository.policy.PolicyConfigRepository;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

import static com.techStack.geoVault.constants.SecurityConstants.TIME_OF_DAY_PATTERN;

/**
 * Reads and replaces the single active access policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyConfigService {

    private final PolicyConfigRepository repository;
    private final PolicyProperties properties;
    private final Clock clock;

    /**
     * The stored policy, or the configured defaults when nothing has been stored yet.
     */
    public Mono<AccessPolicy> currentPolicy() {
        return repository.findActive()
                .switchIfEmpty(Mono.fromSupplier(() -> properties.getDefaults().toPolicy()));
    }

    public Mono<AccessPolicy> updatePolicy(PolicyConfigRequest request, String admin) {
        return Mono.fromCallable(() -> {
                    validate(request);
                    return AccessPolicy.builder()
                            .latitude(request.getLatitude())
                            .longitude(request.getLongitude())
                            .radiusMeters(request.getRadiusMeters())
                            .allowedNetwork(request.getAllowedNetwork().trim())
                            .startTime(request.getStartTime())
                            .endTime(request.getEndTime())
                            .updatedAt(clock.instant())
                            .updatedBy(admin)
                            .build();
                })
                .flatMap(repository::save)
                .doOnSuccess(policy -> log.info("📍 Access policy updated by {}: radius={}m, window={}-{}",
                        HelperUtils.maskUsername(admin), policy.getRadiusMeters(),
                        policy.getStartTime(), policy.getEndTime()));
    }

    /**
     * Stores the defaults when no policy exists yet. Emits true when something was written.
     */
    public Mono<Boolean> ensureDefaultPolicy() {
        return repository.findActive()
                .map(existing -> false)
                .switchIfEmpty(Mono.defer(() -> repository.save(properties.getDefaults().toPolicy().toBuilder()
                                .updatedAt(clock.instant())
                                .updatedBy("system")
                                .build())
                        .thenReturn(true)));
    }

    private static void validate(PolicyConfigRequest request) {
        if (request.getLatitude() == null || request.getLatitude() < -90 || request.getLatitude() > 90) {
            throw new ValidationException("latitude", "Latitude must be between -90 and 90");
        }
        if (request.getLongitude() == null || request.getLongitude() < -180 || request.getLongitude() > 180) {
            throw new ValidationException("longitude", "Longitude must be between -180 and 180");
        }
        if (request.getRadiusMeters() == null || request.getRadiusMeters() <= 0) {
            throw new ValidationException("radiusMeters", "Radius must be positive");
        }
        if (StringUtils.isBlank(request.getAllowedNetwork())) {
            throw new ValidationException("allowedNetwork", "Allowed network is required");
        }
        if (request.getStartTime() == null || !TIME_OF_DAY_PATTERN.matcher(request.getStartTime()).matches()) {
            throw new ValidationException("startTime", "Start time must be HH:mm");
        }
        if (request.getEndTime() == null || !TIME_OF_DAY_PATTERN.matcher(request.getEndTime()).matches()) {
            throw new ValidationException("endTime", "End time must be HH:mm");
        }
    }
}
