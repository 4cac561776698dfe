package com.techStack.geoVault.config.crypto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crypto")
@Getter
@Setter
public class CryptoProperties {

    /** When false the KEM always runs in classical (X25519) mode. */
    private boolean pqcEnabled = true;

    @Min(value = 10000, message = "crypto.kdf-iterations must be at least 10000")
    private int kdfIterations = 100_000;

    @NotBlank
    private String kdfSalt = "geofence_file_encryption_salt";

    /** Upper bound on a ciphertext blob accepted by decrypt. */
    @Positive
    private int maxBlobBytes = 64 * 1024 * 1024;

    @Positive
    private int schedulerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Positive
    private int schedulerQueueSize = 1000;
}
