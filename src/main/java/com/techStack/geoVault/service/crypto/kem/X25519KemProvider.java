package com.techStack.geoVault.service.crypto.kem;

import com.techStack.geoVault.exception.crypto.CryptoOperationException;
import com.techStack.geoVault.models.crypto.Encapsulation;
import com.techStack.geoVault.models.crypto.KemKeyPair;
import com.techStack.geoVault.models.crypto.KemMode;
import com.techStack.geoVault.models.crypto.KemPublicKey;
import com.techStack.geoVault.models.crypto.KemSecretKey;
import org.springframework.stereotype.Component;

import javax.crypto.KeyAgreement;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * Classical fallback: ephemeral-static X25519 Diffie-Hellman used as a KEM.
 * The encapsulated key is the ephemeral public key; the shared secret is
 * {@code SHA-256(dh || ephemeralPublic)}.
 */
@Component
public class X25519KemProvider extends AbstractKemProvider {

    private static final String ALGORITHM = "X25519";

    @Override
    public KemMode mode() {
        return KemMode.CLASSICAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public KemKeyPair generateKeyPair() {
        try {
            KeyPair keyPair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            return new KemKeyPair(
                    new KemPublicKey(KemMode.CLASSICAL, keyPair.getPublic().getEncoded()),
                    new KemSecretKey(KemMode.CLASSICAL, keyPair.getPrivate().getEncoded()));
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("X25519 key generation failed", e);
        }
    }

    @Override
    protected Encapsulation encapsulateRaw(KemPublicKey publicKey) throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance(ALGORITHM);
        PublicKey recipient = keyFactory.generatePublic(new X509EncodedKeySpec(publicKey.encoded()));

        KeyPair ephemeral = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        byte[] ephemeralPublic = ephemeral.getPublic().getEncoded();
        byte[] dh = agree(ephemeral.getPrivate(), recipient);
        return new Encapsulation(ephemeralPublic, kdf(dh, ephemeralPublic));
    }

    @Override
    protected byte[] decapsulateRaw(KemSecretKey secretKey, byte[] primitiveCiphertext)
            throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance(ALGORITHM);
        PrivateKey own = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(secretKey.encoded()));
        PublicKey ephemeral = keyFactory.generatePublic(new X509EncodedKeySpec(primitiveCiphertext));
        return kdf(agree(own, ephemeral), primitiveCiphertext);
    }

    private static byte[] agree(PrivateKey privateKey, PublicKey publicKey) throws GeneralSecurityException {
        KeyAgreement agreement = KeyAgreement.getInstance(ALGORITHM);
        agreement.init(privateKey);
        agreement.doPhase(publicKey, true);
        return agreement.generateSecret();
    }

    private static byte[] kdf(byte[] dh, byte[] ephemeralPublic) throws GeneralSecurityException {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        digest.update(dh);
        digest.update(ephemeralPublic);
        return digest.digest();
    }
}
