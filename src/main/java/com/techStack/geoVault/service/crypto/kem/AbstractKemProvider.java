package com.techStack.geoVault.service.crypto.kem;

import com.techStack.geoVault.exception.crypto.CryptoOperationException;
import com.techStack.geoVault.exception.crypto.DecapsulationException;
import com.techStack.geoVault.models.crypto.Encapsulation;
import com.techStack.geoVault.models.crypto.KemMode;
import com.techStack.geoVault.models.crypto.KemPublicKey;
import com.techStack.geoVault.models.crypto.KemSecretKey;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Appends a key-confirmation tag to every encapsulated key so that decapsulation with the
 * wrong secret key is detected instead of silently yielding an unrelated secret.
 * <p>
 * Wire form: {@code primitiveCiphertext || HMAC-SHA256(sharedSecret, label)[0..16)}.
 */
public abstract class AbstractKemProvider implements KemProvider {

    static final int CONFIRMATION_TAG_SIZE = 16;
    private static final byte[] CONFIRMATION_LABEL = "geovault-kem-key-confirmation".getBytes(StandardCharsets.UTF_8);

    protected abstract Encapsulation encapsulateRaw(KemPublicKey publicKey) throws GeneralSecurityException;

    protected abstract byte[] decapsulateRaw(KemSecretKey secretKey, byte[] primitiveCiphertext)
            throws GeneralSecurityException;

    @Override
    public final Encapsulation encapsulate(KemPublicKey publicKey) {
        requireMode(publicKey.mode());
        try {
            Encapsulation raw = encapsulateRaw(publicKey);
            byte[] tag = confirmationTag(raw.sharedSecret());
            byte[] wire = Arrays.copyOf(raw.encapsulatedKey(), raw.encapsulatedKey().length + CONFIRMATION_TAG_SIZE);
            System.arraycopy(tag, 0, wire, raw.encapsulatedKey().length, CONFIRMATION_TAG_SIZE);
            return new Encapsulation(wire, raw.sharedSecret());
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException(mode().algorithmLabel() + " encapsulation failed", e);
        }
    }

    @Override
    public final byte[] decapsulate(KemSecretKey secretKey, byte[] encapsulatedKey) {
        if (secretKey.mode() != mode()) {
            throw new DecapsulationException("Secret key mode " + secretKey.mode() + " does not match " + mode());
        }
        if (encapsulatedKey == null || encapsulatedKey.length <= CONFIRMATION_TAG_SIZE) {
            throw new DecapsulationException("Encapsulated key is truncated");
        }

        int split = encapsulatedKey.length - CONFIRMATION_TAG_SIZE;
        byte[] primitive = Arrays.copyOfRange(encapsulatedKey, 0, split);
        byte[] presentedTag = Arrays.copyOfRange(encapsulatedKey, split, encapsulatedKey.length);

        byte[] sharedSecret;
        try {
            sharedSecret = decapsulateRaw(secretKey, primitive);
        } catch (GeneralSecurityException | RuntimeException e) {
            throw new DecapsulationException(mode().algorithmLabel() + " decapsulation failed", e);
        }

        if (!MessageDigest.isEqual(presentedTag, confirmationTag(sharedSecret))) {
            Arrays.fill(sharedSecret, (byte) 0);
            throw new DecapsulationException("Key confirmation failed");
        }
        return sharedSecret;
    }

    protected void requireMode(KemMode presented) {
        if (presented != mode()) {
            throw new DecapsulationException("Key mode " + presented + " does not match " + mode());
        }
    }

    private static byte[] confirmationTag(byte[] sharedSecret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(sharedSecret, "HmacSHA256"));
            return Arrays.copyOf(mac.doFinal(CONFIRMATION_LABEL), CONFIRMATION_TAG_SIZE);
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("HMAC-SHA256 unavailable", e);
        }
    }
}
