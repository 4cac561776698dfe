package com.techStack.geoVault.models.audit;

public enum AuthEventType {
    LOGIN_SUCCESS,
    LOGIN_FAILURE,
    OTP_SENT,
    LOGOUT,
    PASSWORD_RESET,
    PASSWORD_CHANGED
}
