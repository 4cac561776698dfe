package com.techStack.geoVault.service.notification;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Outbound delivery of one-time codes and password reset links.
 */
public interface NotificationSender {

    Mono<Void> sendOtp(String email, String username, String code, Duration validity);

    Mono<Void> sendPasswordResetLink(String email, String username, String resetLink, Duration validity);
}
