package com.techStack.geoVault.models.file;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.techStack.geoVault.util.FirestoreUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Descriptor of an encrypted file. The ciphertext itself lives in the encrypted object store
 * under the same {@code fileId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileMetadata {

    public static final String ALGORITHM = "AES-256-GCM";

    private String fileId;
    private String filename;
    private String uploadedBy;
    private Instant uploadedAt;
    private long size;

    /** Base64 AES-256 key, unique per file. */
    @JsonIgnore
    private String encryptionKey;

    private String algorithm;
    private boolean encrypted;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("fileId", fileId);
        map.put("filename", filename);
        map.put("uploadedBy", uploadedBy);
        map.put("uploadedAt", FirestoreUtil.toTimestamp(uploadedAt));
        map.put("size", size);
        map.put("encryptionKey", encryptionKey);
        map.put("algorithm", algorithm);
        map.put("encrypted", encrypted);
        return map;
    }

    public static FileMetadata fromMap(Map<String, Object> map) {
        return FileMetadata.builder()
                .fileId((String) map.get("fileId"))
                .filename((String) map.get("filename"))
                .uploadedBy((String) map.get("uploadedBy"))
                .uploadedAt(FirestoreUtil.toInstant(map.get("uploadedAt")))
                .size(FirestoreUtil.toLong(map.get("size")))
                .encryptionKey((String) map.get("encryptionKey"))
                .algorithm((String) map.get("algorithm"))
                .encrypted(Boolean.TRUE.equals(map.get("encrypted")))
                .build();
    }

    @Override
    public String toString() {
        return "FileMetadata{fileId='" + fileId + "', filename='" + filename + "', size=" + size + "}";
    }
}
