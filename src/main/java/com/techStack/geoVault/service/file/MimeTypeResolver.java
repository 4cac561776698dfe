package com.techStack.geoVault.service.file;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a filename extension to the media type returned with decrypted content.
 */
@Component
public class MimeTypeResolver {

    public static final String DEFAULT_TYPE = "application/octet-stream";

    private static final Map<String, String> TYPES = Map.ofEntries(
            Map.entry("pdf", "application/pdf"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("txt", "text/plain"),
            Map.entry("log", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("csv", "text/csv"),
            Map.entry("json", "application/json")
    );

    public String resolve(String filename) {
        String extension = StringUtils.substringAfterLast(StringUtils.defaultString(filename), ".");
        if (extension.isEmpty()) {
            return DEFAULT_TYPE;
        }
        return TYPES.getOrDefault(extension.toLowerCase(Locale.ROOT), DEFAULT_TYPE);
    }
}
