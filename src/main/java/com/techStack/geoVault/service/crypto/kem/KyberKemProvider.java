package com.techStack.geoVault.service.crypto.kem;

import com.techStack.geoVault.exception.crypto.CryptoOperationException;
import com.techStack.geoVault.models.crypto.Encapsulation;
import com.techStack.geoVault.models.crypto.KemKeyPair;
import com.techStack.geoVault.models.crypto.KemMode;
import com.techStack.geoVault.models.crypto.KemPublicKey;
import com.techStack.geoVault.models.crypto.KemSecretKey;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.SecretKeyWithEncapsulation;
import org.bouncycastle.jcajce.spec.KEMExtractSpec;
import org.bouncycastle.jcajce.spec.KEMGenerateSpec;
import org.bouncycastle.pqc.jcajce.provider.BouncyCastlePQCProvider;
import org.bouncycastle.pqc.jcajce.spec.KyberParameterSpec;
import org.springframework.stereotype.Component;

import javax.crypto.KeyGenerator;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * Kyber-768 through the BouncyCastle PQC JCA provider.
 */
@Slf4j
@Component
public class KyberKemProvider extends AbstractKemProvider {

    private static final String ALGORITHM = "KYBER";
    private static final String PROVIDER = BouncyCastlePQCProvider.PROVIDER_NAME;

    private final SecureRandom secureRandom = new SecureRandom();
    private final boolean available;

    public KyberKemProvider() {
        this.available = initialise();
    }

    private static boolean initialise() {
        try {
            if (Security.getProvider(PROVIDER) == null) {
                Security.addProvider(new BouncyCastlePQCProvider());
            }
            KeyPairGenerator.getInstance(ALGORITHM, PROVIDER);
            return true;
        } catch (GeneralSecurityException | RuntimeException e) {
            log.warn("⚠️ Kyber-768 unavailable, post-quantum KEM disabled: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public KemMode mode() {
        return KemMode.POST_QUANTUM;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public KemKeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM, PROVIDER);
            generator.initialize(KyberParameterSpec.kyber768, secureRandom);
            KeyPair keyPair = generator.generateKeyPair();
            return new KemKeyPair(
                    new KemPublicKey(KemMode.POST_QUANTUM, keyPair.getPublic().getEncoded()),
                    new KemSecretKey(KemMode.POST_QUANTUM, keyPair.getPrivate().getEncoded()));
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("Kyber-768 key generation failed", e);
        }
    }

    @Override
    protected Encapsulation encapsulateRaw(KemPublicKey publicKey) throws GeneralSecurityException {
        PublicKey key = KeyFactory.getInstance(ALGORITHM, PROVIDER)
                .generatePublic(new X509EncodedKeySpec(publicKey.encoded()));

        KeyGenerator generator = KeyGenerator.getInstance(ALGORITHM, PROVIDER);
        generator.init(new KEMGenerateSpec(key, "AES"), secureRandom);
        SecretKeyWithEncapsulation secret = (SecretKeyWithEncapsulation) generator.generateKey();
        return new Encapsulation(secret.getEncapsulation(), secret.getEncoded());
    }

    @Override
    protected byte[] decapsulateRaw(KemSecretKey secretKey, byte[] primitiveCiphertext)
            throws GeneralSecurityException {
        PrivateKey key = KeyFactory.getInstance(ALGORITHM, PROVIDER)
                .generatePrivate(new PKCS8EncodedKeySpec(secretKey.encoded()));

        KeyGenerator generator = KeyGenerator.getInstance(ALGORITHM, PROVIDER);
        generator.init(new KEMExtractSpec(key, primitiveCiphertext, "AES"));
        return generator.generateKey().getEncoded();
    }
}
