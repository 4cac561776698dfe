package com.techStack.geoVault.exception.auth;

import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.exception.service.CustomException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Raised for bad credentials and bad or expired OTPs.
 * The message shown to callers is always the generic one; {@link #getInternalReason()}
 * is for logs and audit events only.
 */
@Getter
public class AuthenticationFailedException extends CustomException {

    private final String internalReason;

    public AuthenticationFailedException(String internalReason) {
        super(HttpStatus.UNAUTHORIZED, SecurityConstants.MSG_AUTHENTICATION_FAILED, null, "AUTHENTICATION_FAILED");
        this.internalReason = internalReason;
    }
}
