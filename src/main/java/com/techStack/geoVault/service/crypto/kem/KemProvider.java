package com.techStack.geoVault.service.crypto.kem;

import com.techStack.geoVault.models.crypto.Encapsulation;
import com.techStack.geoVault.models.crypto.KemKeyPair;
import com.techStack.geoVault.models.crypto.KemMode;
import com.techStack.geoVault.models.crypto.KemPublicKey;
import com.techStack.geoVault.models.crypto.KemSecretKey;

/**
 * A key-encapsulation mechanism producing 32-byte shared secrets.
 */
public interface KemProvider {

    KemMode mode();

    /**
     * Whether the underlying primitive could be initialised in this runtime.
     */
    boolean isAvailable();

    KemKeyPair generateKeyPair();

    Encapsulation encapsulate(KemPublicKey publicKey);

    /**
     * @throws com.techStack.geoVault.exception.crypto.DecapsulationException when the encapsulated key
     *         does not belong to {@code secretKey} or is malformed
     */
    byte[] decapsulate(KemSecretKey secretKey, byte[] encapsulatedKey);
}
