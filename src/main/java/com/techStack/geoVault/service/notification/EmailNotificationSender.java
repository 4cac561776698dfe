package com.techStack.geoVault.service.notification;

import com.techStack.geoVault.config.notification.NotificationProperties;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailNotificationSender implements NotificationSender {

    private final JavaMailSender mailSender;
    private final NotificationProperties properties;

    @Override
    public Mono<Void> sendOtp(String email, String username, String code, Duration validity) {
        String subject = properties.getAppName() + " - Your Login Verification Code";
        String body = "Hello " + username + ",\n\n"
                + "Your one-time verification code is: " + code + "\n\n"
                + "This code expires in " + validity.toMinutes() + " minutes.\n"
                + "If you did not try to sign in, you can ignore this email.\n";
        return send(email, subject, body, "OTP");
    }

    @Override
    public Mono<Void> sendPasswordResetLink(String email, String username, String resetLink, Duration validity) {
        String subject = properties.getAppName() + " - Password Reset";
        String body = "Hello " + username + ",\n\n"
                + "Use the link below to reset your password:\n" + resetLink + "\n\n"
                + "The link expires in " + validity.toMinutes() + " minutes and can be used once.\n";
        return send(email, subject, body, "password reset");
    }

    private Mono<Void> send(String to, String subject, String body, String kind) {
        return Mono.fromRunnable(() -> {
                    SimpleMailMessage message = new SimpleMailMessage();
                    message.setFrom(properties.getFrom());
                    message.setTo(to);
                    message.setSubject(subject);
                    message.setText(body);
                    mailSender.send(message);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(Retry.backoff(2, Duration.ofMillis(500))
                        .filter(MailException.class::isInstance)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(v -> log.info("📧 {} email sent to {}", kind, HelperUtils.maskEmail(to)))
                .doOnError(e -> log.error("❌ Failed to send {} email to {}: {}",
                        kind, HelperUtils.maskEmail(to), e.getMessage()))
                .then();
    }
}
