package com.techStack.geoVault.constants;

import java.time.Duration;
import java.util.regex.Pattern;

public final class SecurityConstants {

    private SecurityConstants() {}

    // Tokens
    public static final String TOKEN_TYPE = "Bearer";
    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_ROLE = "role";
    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";
    public static final String CSRF_HEADER = "X-CSRF-Token";

    // OTP
    public static final int OTP_LENGTH = 6;
    public static final Duration OTP_TTL = Duration.ofMinutes(5);
    public static final Duration OTP_RESEND_COOLDOWN = Duration.ofSeconds(30);

    // State store key prefixes
    public static final String REVOKED_PREFIX = "revoked:";
    public static final String RATE_LIMIT_PREFIX = "ratelimit:";
    public static final String CSRF_PREFIX = "csrf:";
    public static final String RESET_PREFIX = "reset:";

    // Collection names
    public static final String COLLECTION_USERS = "users";
    public static final String COLLECTION_POLICY_CONFIG = "policy_config";
    public static final String COLLECTION_WFH_GRANTS = "wfh_grants";
    public static final String COLLECTION_FILE_METADATA = "file_metadata";
    public static final String COLLECTION_ENCRYPTED_OBJECTS = "encrypted_objects";
    public static final String COLLECTION_ACCESS_LOGS = "access_logs";
    public static final String COLLECTION_AUTH_EVENTS = "auth_events";

    // Fixed document IDs for easy retrieval
    public static final String ACTIVE_POLICY_DOC_ID = "active";

    public static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}$",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{3,64}$");

    public static final Pattern TIME_OF_DAY_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    /* =========================
       Generic Messages
       ========================= */
    public static final String MSG_AUTHENTICATION_FAILED = "Authentication failed";
    public static final String MSG_ADMIN_REQUIRED = "Admin access required";
    public static final String MSG_EMPLOYEE_REQUIRED = "Employee access only";
}
