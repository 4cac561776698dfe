package com.techStack.geoVault.listener;

import com.techStack.geoVault.event.AuthFailureEvent;
import com.techStack.geoVault.event.AuthSuccessEvent;
import com.techStack.geoVault.models.audit.AuthEventType;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.util.validation.HelperUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Turns authentication events into audit records and metrics off the request path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthEventListener {

    private final AuditLogService auditLogService;
    private final MeterRegistry meterRegistry;

    @Async
    @EventListener
    public void onAuthSuccess(AuthSuccessEvent event) {
        log.info("✅ Login completed for {} from {} at {}",
                HelperUtils.maskUsername(event.getUser().getUsername()), event.getIpAddress(), event.getTimestamp());

        meterRegistry.counter("auth.login.success").increment();
        auditLogService.recordAuthEvent(AuthEventType.LOGIN_SUCCESS, event.getUser().getUsername(),
                        "OTP verified", event.getIpAddress())
                .subscribe();
    }

    @Async
    @EventListener
    public void onAuthFailure(AuthFailureEvent event) {
        log.warn("⚠️ Login failure for {} from {}: {}",
                HelperUtils.maskUsername(event.getUsername()), event.getIpAddress(), event.getReason());

        meterRegistry.counter("auth.login.failure").increment();
        auditLogService.recordAuthEvent(AuthEventType.LOGIN_FAILURE, event.getUsername(),
                        event.getReason(), event.getIpAddress())
                .subscribe();
    }
}
