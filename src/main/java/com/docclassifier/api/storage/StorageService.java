package com.docclassifier.api.storage;

import java.io.IOException;
import java.util.UUID;

/**
 * Holds uploaded document bytes between submission and processing.
 */
public interface StorageService {

    /**
     * Stores a document under {jobId}/{filename}.
     *
     * @return storage path to pass to {@link #load(String)}
     * @throws IOException if the bytes cannot be written
     */
    String store(UUID jobId, String filename, byte[] content) throws IOException;

    /**
     * @param storagePath path returned from {@link #store}
     * @throws IOException if the file is missing or unreadable
     */
    byte[] load(String storagePath) throws IOException;

    /**
     * Removes a stored document. Deleting a missing file is not an error.
     */
    void delete(String storagePath) throws IOException;
}
