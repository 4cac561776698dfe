package com.techStack.geoVault.support;

import com.techStack.geoVault.service.notification.NotificationSender;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the last OTP code and reset link per username instead of sending mail.
 */
public class RecordingNotificationSender implements NotificationSender {

    private final Map<String, String> codes = new ConcurrentHashMap<>();
    private final Map<String, String> resetLinks = new ConcurrentHashMap<>();
    private volatile boolean failing;

    @Override
    public Mono<Void> sendOtp(String email, String username, String code, Duration validity) {
        return Mono.defer(() -> {
            if (failing) {
                return Mono.error(new IllegalStateException("smtp down"));
            }
            codes.put(username, code);
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> sendPasswordResetLink(String email, String username, String link, Duration validity) {
        return Mono.fromRunnable(() -> resetLinks.put(username, link));
    }

    public String lastCode(String username) {
        return codes.get(username);
    }

    public String lastResetLink(String username) {
        return resetLinks.get(username);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
