package com.techStack.geoVault.service.crypto;

import com.techStack.geoVault.config.crypto.CryptoProperties;
import com.techStack.geoVault.exception.crypto.CryptoOperationException;
import com.techStack.geoVault.exception.crypto.DecapsulationException;
import com.techStack.geoVault.exception.crypto.IntegrityException;
import com.techStack.geoVault.models.crypto.CryptoCapabilities;
import com.techStack.geoVault.models.crypto.Encapsulation;
import com.techStack.geoVault.models.crypto.HybridCiphertext;
import com.techStack.geoVault.models.crypto.KemKeyPair;
import com.techStack.geoVault.models.crypto.KemMode;
import com.techStack.geoVault.models.crypto.KemPublicKey;
import com.techStack.geoVault.models.crypto.KemResult;
import com.techStack.geoVault.models.crypto.KemSecretKey;
import com.techStack.geoVault.service.crypto.kem.KemProvider;
import com.techStack.geoVault.service.crypto.kem.KyberKemProvider;
import com.techStack.geoVault.service.crypto.kem.X25519KemProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Key encapsulation, key derivation and authenticated encryption.
 * <p>
 * Blob layout produced by {@link #encrypt} and consumed by {@link #decrypt}:
 * {@code nonce(16) || tag(16) || ciphertext}. The KEM runs Kyber-768 when available and
 * falls back to X25519 otherwise; every KEM result is tagged with the mode that produced it.
 */
@Slf4j
@Service
public class CryptoEngine {

    public static final int KEY_SIZE = 32;
    public static final int NONCE_SIZE = 16;
    public static final int TAG_SIZE = 16;
    public static final String CIPHER_NAME = "AES-256-GCM";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int MIN_BLOB_SIZE = NONCE_SIZE + TAG_SIZE;

    private final CryptoProperties properties;
    private final KyberKemProvider postQuantum;
    private final X25519KemProvider classical;
    private final Scheduler cryptoScheduler;
    private final MeterRegistry meterRegistry;
    private final SecureRandom secureRandom = new SecureRandom();
    private final byte[] kdfSalt;

    public CryptoEngine(CryptoProperties properties,
                        KyberKemProvider postQuantum,
                        X25519KemProvider classical,
                        @Qualifier("cryptoScheduler") Scheduler cryptoScheduler,
                        MeterRegistry meterRegistry) {
        this.properties = properties;
        this.postQuantum = postQuantum;
        this.classical = classical;
        this.cryptoScheduler = cryptoScheduler;
        this.meterRegistry = meterRegistry;
        this.kdfSalt = properties.getKdfSalt().getBytes(StandardCharsets.UTF_8);

        log.info("🔐 CryptoEngine ready - KEM: {}, cipher: {}", activeMode(), CIPHER_NAME);
    }

    /* ===== Key encapsulation ===== */

    public KemResult<KemKeyPair> generateKeypair() {
        KemProvider provider = activeProvider();
        if (provider.mode() == KemMode.POST_QUANTUM) {
            try {
                return new KemResult<>(KemMode.POST_QUANTUM, provider.generateKeyPair());
            } catch (CryptoOperationException e) {
                log.warn("⚠️ Kyber-768 key generation failed, falling back to X25519: {}", e.getMessage());
                recordFallback();
            }
        }
        return new KemResult<>(KemMode.CLASSICAL, classical.generateKeyPair());
    }

    public KemResult<Encapsulation> encapsulate(KemPublicKey publicKey) {
        KemProvider provider = providerFor(publicKey.mode());
        return new KemResult<>(provider.mode(), provider.encapsulate(publicKey));
    }

    public byte[] decapsulate(KemSecretKey secretKey, byte[] encapsulatedKey) {
        return providerFor(secretKey.mode()).decapsulate(secretKey, encapsulatedKey);
    }

    /* ===== Key derivation ===== */

    /**
     * PBKDF2-HMAC-SHA256 with the configured fixed salt. Deterministic for a given input.
     */
    public byte[] deriveKey(byte[] sharedSecret) {
        if (sharedSecret == null || sharedSecret.length == 0) {
            throw new CryptoOperationException("Shared secret must not be empty", null);
        }
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(sharedSecret, kdfSalt, properties.getKdfIterations());
        return ((KeyParameter) generator.generateDerivedParameters(KEY_SIZE * 8)).getKey();
    }

    public byte[] generateFileKey() {
        byte[] key = new byte[KEY_SIZE];
        secureRandom.nextBytes(key);
        return key;
    }

    /* ===== Authenticated encryption ===== */

    public byte[] encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        byte[] nonce = new byte[NONCE_SIZE];
        secureRandom.nextBytes(nonce);

        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE * 8, nonce));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("Encryption failed", e);
        }

        // JCA appends the tag; move it in front of the ciphertext
        int ciphertextLength = sealed.length - TAG_SIZE;
        byte[] blob = new byte[NONCE_SIZE + sealed.length];
        System.arraycopy(nonce, 0, blob, 0, NONCE_SIZE);
        System.arraycopy(sealed, ciphertextLength, blob, NONCE_SIZE, TAG_SIZE);
        System.arraycopy(sealed, 0, blob, MIN_BLOB_SIZE, ciphertextLength);
        return blob;
    }

    /**
     * @throws IntegrityException if the blob is malformed, oversized, or fails authentication
     */
    public byte[] decrypt(byte[] blob, byte[] key) {
        requireKey(key);
        if (blob == null || blob.length < MIN_BLOB_SIZE) {
            throw new IntegrityException("Ciphertext blob is truncated");
        }
        if (blob.length > properties.getMaxBlobBytes()) {
            throw new IntegrityException("Ciphertext blob exceeds " + properties.getMaxBlobBytes() + " bytes");
        }

        int ciphertextLength = blob.length - MIN_BLOB_SIZE;
        byte[] sealed = new byte[ciphertextLength + TAG_SIZE];
        System.arraycopy(blob, MIN_BLOB_SIZE, sealed, 0, ciphertextLength);
        System.arraycopy(blob, NONCE_SIZE, sealed, ciphertextLength, TAG_SIZE);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_SIZE * 8, blob, 0, NONCE_SIZE));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoOperationException("Decryption failed", e);
        }
    }

    /* ===== Hybrid ===== */

    /**
     * KEM + KDF + AES-GCM. With no public key a throwaway key pair is generated.
     */
    public HybridCiphertext encryptHybrid(byte[] plaintext, KemPublicKey publicKey) {
        KemPublicKey recipient = publicKey != null ? publicKey : generateKeypair().value().publicKey();
        KemResult<Encapsulation> encapsulation = encapsulate(recipient);
        byte[] key = deriveKey(encapsulation.value().sharedSecret());
        try {
            byte[] blob = encrypt(plaintext, key);
            return new HybridCiphertext(
                    encapsulation.value().encapsulatedKey(),
                    blob,
                    encapsulation.mode().hybridAlgorithm(),
                    encapsulation.mode());
        } finally {
            Arrays.fill(key, (byte) 0);
            Arrays.fill(encapsulation.value().sharedSecret(), (byte) 0);
        }
    }

    public byte[] decryptHybrid(HybridCiphertext ciphertext, KemSecretKey secretKey) {
        if (ciphertext.mode() != secretKey.mode()) {
            throw new DecapsulationException("Ciphertext mode " + ciphertext.mode()
                    + " does not match secret key mode " + secretKey.mode());
        }
        byte[] sharedSecret = decapsulate(secretKey, ciphertext.encapsulatedKey());
        byte[] key = deriveKey(sharedSecret);
        try {
            return decrypt(ciphertext.encryptedBlob(), key);
        } finally {
            Arrays.fill(key, (byte) 0);
            Arrays.fill(sharedSecret, (byte) 0);
        }
    }

    /* ===== Reactive wrappers ===== */

    public Mono<byte[]> encryptAsync(byte[] plaintext, byte[] key) {
        return Mono.fromCallable(() -> encrypt(plaintext, key)).subscribeOn(cryptoScheduler);
    }

    public Mono<byte[]> decryptAsync(byte[] blob, byte[] key) {
        return Mono.fromCallable(() -> decrypt(blob, key)).subscribeOn(cryptoScheduler);
    }

    public Mono<byte[]> deriveKeyAsync(byte[] sharedSecret) {
        return Mono.fromCallable(() -> deriveKey(sharedSecret)).subscribeOn(cryptoScheduler);
    }

    /* ===== Introspection ===== */

    public KemMode activeMode() {
        return activeProvider().mode();
    }

    public CryptoCapabilities capabilities() {
        KemMode mode = activeMode();
        return CryptoCapabilities.builder()
                .postQuantumAvailable(postQuantum.isAvailable())
                .activeMode(mode)
                .kemAlgorithm(mode == KemMode.POST_QUANTUM ? "Kyber-768" : "X25519")
                .symmetricCipher(CIPHER_NAME)
                .keySizeBits(KEY_SIZE * 8)
                .nonceSizeBytes(NONCE_SIZE)
                .tagSizeBytes(TAG_SIZE)
                .keyDerivation("PBKDF2-HMAC-SHA256 (" + properties.getKdfIterations() + " iterations)")
                .hybridAlgorithm(mode.hybridAlgorithm())
                .build();
    }

    private KemProvider activeProvider() {
        if (properties.isPqcEnabled() && postQuantum.isAvailable()) {
            return postQuantum;
        }
        if (properties.isPqcEnabled()) {
            recordFallback();
        }
        return classical;
    }

    private KemProvider providerFor(KemMode mode) {
        if (mode == KemMode.POST_QUANTUM) {
            if (!postQuantum.isAvailable()) {
                throw new CryptoOperationException("Post-quantum KEM is not available in this runtime", null);
            }
            return postQuantum;
        }
        return classical;
    }

    private void recordFallback() {
        meterRegistry.counter("crypto.kem.fallback").increment();
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != KEY_SIZE) {
            throw new CryptoOperationException("AES-256 key must be " + KEY_SIZE + " bytes", null);
        }
    }
}
