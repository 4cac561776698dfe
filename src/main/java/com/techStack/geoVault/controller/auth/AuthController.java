package com.techStack.geoVault.controller.auth;

import com.techStack.geoVault.dto.request.ForgotPasswordRequest;
import com.techStack.geoVault.dto.request.LoginRequest;
import com.techStack.geoVault.dto.request.OtpVerifyRequest;
import com.techStack.geoVault.dto.request.PasswordChangeRequest;
import com.techStack.geoVault.dto.request.PasswordResetCompleteRequest;
import com.techStack.geoVault.dto.request.RefreshTokenRequest;
import com.techStack.geoVault.dto.request.ResendOtpRequest;
import com.techStack.geoVault.dto.response.ApiResponse;
import com.techStack.geoVault.dto.response.AuthResponse;
import com.techStack.geoVault.exception.auth.InvalidTokenException;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.models.auth.OtpChallenge;
import com.techStack.geoVault.security.authentication.AccessTokenResolver;
import com.techStack.geoVault.service.auth.SessionManager;
import com.techStack.geoVault.service.token.CsrfTokenService;
import com.techStack.geoVault.service.user.PasswordChangeService;
import com.techStack.geoVault.service.user.PasswordResetService;
import com.techStack.geoVault.util.validation.HelperUtils;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

import static com.techStack.geoVault.constants.SecurityConstants.CSRF_HEADER;

/**
 * Session endpoints: password + OTP login, refresh, logout, password reset and change, CSRF token.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final String RESET_REQUESTED =
            "If an account exists with this email, you will receive a password reset link.";

    private final SessionManager sessionManager;
    private final CsrfTokenService csrfTokenService;
    private final PasswordResetService passwordResetService;
    private final PasswordChangeService passwordChangeService;
    private final SessionCookieWriter cookieWriter;

    /* =========================
       Login / OTP
       ========================= */

    @PostMapping("/login")
    public Mono<ResponseEntity<ApiResponse<OtpChallenge>>> login(
            @Valid @RequestBody LoginRequest request, ServerWebExchange exchange) {

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return sessionManager.login(request.getUsername(), request.getPassword(), ip)
                .map(challenge -> ResponseEntity.ok(ApiResponse.success(
                        "OTP sent to your registered email", challenge)));
    }

    @PostMapping("/resend-otp")
    public Mono<ResponseEntity<ApiResponse<OtpChallenge>>> resendOtp(
            @Valid @RequestBody ResendOtpRequest request, ServerWebExchange exchange) {

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return sessionManager.resendOtp(request.getUsername(), ip)
                .map(challenge -> ResponseEntity.ok(ApiResponse.success("OTP resent", challenge)));
    }

    @PostMapping("/verify-otp")
    public Mono<ResponseEntity<ApiResponse<AuthResponse>>> verifyOtp(
            @Valid @RequestBody OtpVerifyRequest request, ServerWebExchange exchange) {

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return sessionManager.verifyOtp(request.getUsername(), request.getOtp(), ip)
                .flatMap(tokens -> csrfTokenService.issue(tokens.username())
                        .map(csrf -> {
                            cookieWriter.writeAccess(exchange.getResponse(), tokens.accessToken(), tokens.accessExpiresIn());
                            cookieWriter.writeRefresh(exchange.getResponse(), tokens.refreshToken(), tokens.refreshExpiresIn());
                            log.info("✅ Session established for {}", HelperUtils.maskUsername(tokens.username()));
                            return ResponseEntity.ok()
                                    .header(CSRF_HEADER, csrf)
                                    .body(ApiResponse.success("Login successful", AuthResponse.from(tokens, csrf)));
                        }));
    }

    /* =========================
       Tokens
       ========================= */

    @PostMapping("/refresh-token")
    public Mono<ResponseEntity<ApiResponse<AuthResponse>>> refreshToken(
            @RequestBody(required = false) RefreshTokenRequest request, ServerWebExchange exchange) {

        String refreshToken = request != null && StringUtils.isNotBlank(request.getRefreshToken())
                ? request.getRefreshToken()
                : AccessTokenResolver.refreshCookie(exchange.getRequest()).orElse(null);
        if (refreshToken == null) {
            return Mono.error(new InvalidTokenException("Refresh token is required"));
        }

        return sessionManager.refresh(refreshToken)
                .map(tokens -> {
                    cookieWriter.writeAccess(exchange.getResponse(), tokens.accessToken(), tokens.accessExpiresIn());
                    return ResponseEntity.ok(ApiResponse.success("Token refreshed", AuthResponse.from(tokens, null)));
                });
    }

    @PostMapping("/logout")
    public Mono<ResponseEntity<ApiResponse<Void>>> logout(
            @RequestBody(required = false) RefreshTokenRequest request,
            @AuthenticationPrincipal AuthenticatedUser user,
            ServerWebExchange exchange) {

        String accessToken = AccessTokenResolver.resolve(exchange.getRequest())
                .map(AccessTokenResolver.ResolvedToken::token)
                .orElse(null);
        String refreshToken = request != null && StringUtils.isNotBlank(request.getRefreshToken())
                ? request.getRefreshToken()
                : AccessTokenResolver.refreshCookie(exchange.getRequest()).orElse(null);
        String ip = HelperUtils.clientIp(exchange.getRequest());

        return sessionManager.logout(accessToken, refreshToken, ip)
                .then(csrfTokenService.invalidate(user.username()))
                .then(Mono.fromSupplier(() -> {
                    cookieWriter.clear(exchange.getResponse());
                    return ResponseEntity.ok(ApiResponse.success("Logged out successfully"));
                }));
    }

    @GetMapping("/csrf-token")
    public Mono<ResponseEntity<ApiResponse<Map<String, String>>>> csrfToken(
            @AuthenticationPrincipal AuthenticatedUser user) {

        return csrfTokenService.issue(user.username())
                .map(token -> ResponseEntity.ok()
                        .header(CSRF_HEADER, token)
                        .body(ApiResponse.success(Map.of("csrfToken", token))));
    }

    /* =========================
       Password
       ========================= */

    @PostMapping("/forgot-password")
    public Mono<ResponseEntity<ApiResponse<Void>>> forgotPassword(
            @Valid @RequestBody ForgotPasswordRequest request, ServerWebExchange exchange) {

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return passwordResetService.requestReset(request.getEmail(), ip)
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(ApiResponse.success(RESET_REQUESTED))));
    }

    @PostMapping("/reset-password")
    public Mono<ResponseEntity<ApiResponse<Void>>> resetPassword(
            @Valid @RequestBody PasswordResetCompleteRequest request, ServerWebExchange exchange) {

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return passwordResetService.completeReset(request.getToken(), request.getNewPassword(), ip)
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(ApiResponse.success("Password has been reset"))));
    }

    @PostMapping("/change-password")
    public Mono<ResponseEntity<ApiResponse<Void>>> changePassword(
            @Valid @RequestBody PasswordChangeRequest request,
            @AuthenticationPrincipal AuthenticatedUser user,
            ServerWebExchange exchange) {

        String ip = HelperUtils.clientIp(exchange.getRequest());
        return passwordChangeService.changePassword(user.username(), request.getCurrentPassword(),
                        request.getNewPassword(), ip)
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(ApiResponse.success("Password changed successfully"))));
    }
}
