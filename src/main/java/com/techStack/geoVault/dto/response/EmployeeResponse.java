package com.techStack.geoVault.dto.response;

import com.techStack.geoVault.models.user.User;
import lombok.Builder;

import java.time.Instant;

/**
 * Public view of an account. Never carries the password hash or OTP state.
 */
@Builder
public record EmployeeResponse(
        String username,
        String email,
        String role,
        boolean active,
        Instant createdAt
) {

    public static EmployeeResponse from(User user) {
        return EmployeeResponse.builder()
                .username(user.getUsername())
                .email(user.getEmail())
                .role(user.getRole() == null ? null : user.getRole().name())
                .active(user.isActive())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
