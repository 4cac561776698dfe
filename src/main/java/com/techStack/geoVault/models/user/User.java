package com.techStack.geoVault.models.user;

import com.techStack.geoVault.util.FirestoreUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A principal, keyed by username. OTP fields are populated between login and
 * successful verification only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private String username;
    private String email;
    private String passwordHash;
    private Roles role;
    private boolean active;
    private Instant createdAt;

    /* ===== OTP state ===== */
    private String otpHash;
    private Instant otpExpiresAt;
    private Instant otpSentAt;

    public boolean isAdmin() {
        return role == Roles.ADMIN;
    }

    public User withoutOtp() {
        return toBuilder().otpHash(null).otpExpiresAt(null).otpSentAt(null).build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("username", username);
        map.put("email", email);
        map.put("passwordHash", passwordHash);
        map.put("role", role != null ? role.name() : null);
        map.put("active", active);
        map.put("createdAt", FirestoreUtil.toTimestamp(createdAt));
        map.put("otpHash", otpHash);
        map.put("otpExpiresAt", FirestoreUtil.toTimestamp(otpExpiresAt));
        map.put("otpSentAt", FirestoreUtil.toTimestamp(otpSentAt));
        return map;
    }

    public static User fromMap(Map<String, Object> map) {
        return User.builder()
                .username((String) map.get("username"))
                .email((String) map.get("email"))
                .passwordHash((String) map.get("passwordHash"))
                .role(Roles.fromString((String) map.get("role")))
                .active(Boolean.TRUE.equals(map.getOrDefault("active", Boolean.TRUE)))
                .createdAt(FirestoreUtil.toInstant(map.get("createdAt")))
                .otpHash((String) map.get("otpHash"))
                .otpExpiresAt(FirestoreUtil.toInstant(map.get("otpExpiresAt")))
                .otpSentAt(FirestoreUtil.toInstant(map.get("otpSentAt")))
                .build();
    }

    @Override
    public String toString() {
        return "User{username='" + username + "', role=" + role + ", active=" + active + "}";
    }
}
