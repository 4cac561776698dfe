package com.techStack.geoVault.config.storage;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "files")
@Getter
@Setter
public class FileStorageProperties {

    /**
     * Plaintext upload cap. Ciphertext is stored as a Blob inside a single Firestore
     * document, so this must stay well under the 1 MiB document limit.
     */
    @Positive
    private long maxUploadBytes = 700 * 1024;

    @Positive
    private int maxFilenameLength = 255;
}
