package com.techStack.geoVault.service.observability;

import com.techStack.geoVault.models.audit.AccessAction;
import com.techStack.geoVault.models.audit.AccessDecisionLog;
import com.techStack.geoVault.models.audit.AuthEventLog;
import com.techStack.geoVault.models.audit.AuthEventType;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.repository.audit.AccessLogRepository;
import com.techStack.geoVault.repository.audit.AuthEventRepository;
import com.techStack.geoVault.util.validation.HelperUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Audit trail for file operations and authentication events.
 * <p>
 * Access decisions must be durable before the caller sees the outcome, so failures propagate.
 * Authentication events are best effort: a storage failure is logged and does not fail the login.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

    private final AccessLogRepository accessLogRepository;
    private final AuthEventRepository authEventRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /* =========================
       File Access
       ========================= */

    public Mono<AccessDecisionLog> recordFileEvent(String username,
                                                   String fileId,
                                                   String filename,
                                                   AccessAction action,
                                                   boolean success,
                                                   String reason,
                                                   AccessRequest request,
                                                   String wfhGrantId) {
        AccessRequest context = AccessRequest.orEmpty(request);
        AccessDecisionLog entry = AccessDecisionLog.builder()
                .id(UUID.randomUUID().toString())
                .username(username)
                .fileId(fileId)
                .filename(filename)
                .action(action)
                .timestamp(clock.instant())
                .success(success)
                .reason(reason)
                .latitude(context.latitude())
                .longitude(context.longitude())
                .network(context.network())
                .wfhGrantId(wfhGrantId)
                .build();

        return accessLogRepository.append(entry)
                .doOnSuccess(saved -> log.info("📝 {} {} by {} on {}: {}",
                        action, success ? "ok" : "denied", HelperUtils.maskUsername(username), fileId, reason));
    }

    public Flux<AccessDecisionLog> recentAccessLogs(int limit) {
        return accessLogRepository.findRecent(limit);
    }

    public Mono<Long> countAccessLogs() {
        return accessLogRepository.count();
    }

    /* =========================
       Authentication
       ========================= */

    public Mono<Void> recordAuthEvent(AuthEventType type, String username, String reason, String ipAddress) {
        AuthEventLog event = AuthEventLog.builder()
                .id(UUID.randomUUID().toString())
                .username(username)
                .eventType(type)
                .reason(reason)
                .ipAddress(ipAddress)
                .timestamp(clock.instant())
                .build();

        meterRegistry.counter("auth.events", "type", type.name()).increment();

        return authEventRepository.append(event)
                .onErrorResume(e -> {
                    log.error("❌ Failed to persist {} event for {}: {}",
                            type, HelperUtils.maskUsername(username), e.getMessage());
                    return Mono.empty();
                });
    }
}
