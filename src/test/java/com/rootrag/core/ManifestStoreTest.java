package com.rootrag.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateParentDirectoriesOnSave() throws Exception {
        Path path = tempDir.resolve("a/b/manifest.json");

        new ManifestStore().save(path, Map.of("schema_version", "corpus_manifest_v1"));

        assertTrue(Files.readString(path).contains("\"schema_version\" : \"corpus_manifest_v1\""));
    }

    @Test
    void shouldReportMissingManifest() {
        IOException error = assertThrows(IOException.class,
                () -> new ManifestStore().load(tempDir.resolve("manifest.json"), Map.class));

        assertTrue(error.getMessage().startsWith("Manifest not found"));
    }

    @Test
    void shouldNameFieldInValidationMessage() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> ValidationException.requireNonBlank("root_ref", "  "));

        assertEquals("root_ref", error.field());
        assertEquals("root_ref: must not be blank", error.getMessage());
    }
}
