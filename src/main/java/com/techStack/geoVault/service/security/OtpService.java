package com.techStack.geoVault.service.security;

import com.techStack.geoVault.config.security.OtpProperties;
import com.techStack.geoVault.constants.SecurityConstants;
import com.techStack.geoVault.exception.crypto.CryptoOperationException;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates one-time codes and the keyed hashes that are the only form in which codes are stored.
 */
@Service
public class OtpService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKeySpec hashKey;

    public OtpService(OtpProperties properties) {
        this.hashKey = new SecretKeySpec(properties.getHashSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public String generateCode() {
        int bound = (int) Math.pow(10, SecurityConstants.OTP_LENGTH);
        return String.format(Locale.ROOT, "%0" + SecurityConstants.OTP_LENGTH + "d", secureRandom.nextInt(bound));
    }

    public String hash(String code) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(hashKey);
            return HexFormat.of().formatHex(mac.doFinal(code.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("OTP hashing failed", e);
        }
    }

    /**
     * Constant-time comparison of a presented code against a stored hash.
     */
    public boolean matches(String code, String storedHash) {
        if (code == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                hash(code.trim()).getBytes(StandardCharsets.UTF_8),
                storedHash.getBytes(StandardCharsets.UTF_8));
    }
}
