package com.techStack.geoVault.exception.account;

import com.techStack.geoVault.exception.service.CustomException;
import org.springframework.http.HttpStatus;

public class AccountDisabledException extends CustomException {
    public AccountDisabledException() {
        super(HttpStatus.FORBIDDEN, "Account is disabled", null, "ACCOUNT_DISABLED");
    }
}
