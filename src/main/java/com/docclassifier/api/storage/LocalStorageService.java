package com.docclassifier.api.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores uploads on the local filesystem under {@code app.storage.local-dir}.
 * Paths have the form {@code local://{jobId}/{filename}}.
 */
@Service
public class LocalStorageService implements StorageService {

    private static final Logger logger = LoggerFactory.getLogger(LocalStorageService.class);
    private static final Pattern INVALID_FILENAME_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");
    private static final String PREFIX = "local://";

    private final Path storageRoot;

    public LocalStorageService(@Value("${app.storage.local-dir:.local-storage}") String localDir) {
        this.storageRoot = Paths.get(localDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(storageRoot);
            logger.info("Local storage service initialized with directory: {}", storageRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create local storage directory: " + storageRoot, e);
        }
    }

    static String sanitizeFilename(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "document";
        }
        String sanitized = INVALID_FILENAME_CHARS.matcher(filename).replaceAll("_");
        return sanitized.replace("..", "_");
    }

    @Override
    public String store(UUID jobId, String filename, byte[] content) throws IOException {
        String sanitizedFilename = sanitizeFilename(filename);
        Path jobDir = storageRoot.resolve(jobId.toString());
        Files.createDirectories(jobDir);
        Path filePath = jobDir.resolve(sanitizedFilename);

        Files.write(filePath, content);
        String storagePath = PREFIX + jobId + "/" + sanitizedFilename;
        logger.debug("Stored {} bytes at {}", content.length, storagePath);
        return storagePath;
    }

    @Override
    public byte[] load(String storagePath) throws IOException {
        Path filePath = resolve(storagePath);
        if (!Files.exists(filePath)) {
            throw new IOException("File not found: " + storagePath);
        }
        return Files.readAllBytes(filePath);
    }

    @Override
    public void delete(String storagePath) throws IOException {
        Path filePath = resolve(storagePath);
        Files.deleteIfExists(filePath);
        Path jobDir = filePath.getParent();
        if (jobDir != null && !jobDir.equals(storageRoot) && Files.isDirectory(jobDir)) {
            try (Stream<Path> entries = Files.list(jobDir)) {
                if (entries.findAny().isEmpty()) {
                    Files.deleteIfExists(jobDir);
                }
            }
        }
        logger.debug("Deleted stored file {}", storagePath);
    }

    private Path resolve(String storagePath) {
        if (storagePath == null || !storagePath.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Invalid local storage path: " + storagePath);
        }
        String[] parts = storagePath.substring(PREFIX.length()).split("/", 2);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid local storage path format: " + storagePath);
        }
        Path filePath = storageRoot.resolve(parts[0]).resolve(parts[1]).normalize();
        if (!filePath.startsWith(storageRoot)) {
            throw new IllegalArgumentException("Path traversal detected: " + storagePath);
        }
        return filePath;
    }
}
