package com.techStack.geoVault.service.file;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MimeTypeResolverTest {

    private final MimeTypeResolver resolver = new MimeTypeResolver();

    @ParameterizedTest
    @CsvSource({
            "report.pdf, application/pdf",
            "photo.JPG, image/jpeg",
            "diagram.png, image/png",
            "notes.txt, text/plain",
            "server.log, text/plain",
            "README.md, text/markdown",
            "data.csv, text/csv",
            "archive.tar.json, application/json"
    })
    void resolve_shouldMapKnownExtensions(String filename, String expected) {
        assertThat(resolver.resolve(filename)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Makefile", "payload.exe", "trailingdot."})
    void resolve_shouldFallBackToOctetStream(String filename) {
        assertThat(resolver.resolve(filename)).isEqualTo(MimeTypeResolver.DEFAULT_TYPE);
    }
}
