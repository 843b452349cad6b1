package com.docclassifier.api.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void storesLoadsAndDeletesDocuments() throws Exception {
        LocalStorageService storage = new LocalStorageService(tempDir.toString());
        UUID jobId = UUID.randomUUID();
        byte[] content = "document bytes".getBytes(StandardCharsets.UTF_8);

        String path = storage.store(jobId, "bank statement (march).pdf", content);

        assertThat(path).isEqualTo("local://" + jobId + "/bank_statement__march_.pdf");
        assertThat(storage.load(path)).isEqualTo(content);

        storage.delete(path);

        assertThat(Files.exists(tempDir.resolve(jobId.toString()))).isFalse();
        assertThatThrownBy(() -> storage.load(path)).isInstanceOf(IOException.class);
        storage.delete(path);
    }

    @Test
    void rejectsPathsOutsideTheStorageRoot() {
        LocalStorageService storage = new LocalStorageService(tempDir.toString());

        assertThatThrownBy(() -> storage.load("local://../outside/secret.txt"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.load("s3://bucket/key"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sanitizesFilenames() {
        assertThat(LocalStorageService.sanitizeFilename("../../etc/passwd")).doesNotContain("..").doesNotContain("/");
        assertThat(LocalStorageService.sanitizeFilename(null)).isEqualTo("document");
    }
}
