package com.roapid.adapter.storage;

import java.util.List;
import java.util.Optional;

/**
 * Last-written copy of each fetched payload, addressed by a path relative to the data directory.
 */
public interface ArtifactStore {

    /** Name of the field stamped into every saved artifact. */
    String LAST_UPDATED_FIELD = "lastUpdated";

    /**
     * Stamps {@value #LAST_UPDATED_FIELD} into the JSON object, writes it and returns the written bytes.
     *
     * @throws StorageException when the payload is not a JSON object or the write fails
     */
    byte[] save(String relativePath, byte[] rawPayload);

    /**
     * @return stored bytes, or empty when nothing was stored yet
     * @throws StorageException on any other read failure
     */
    Optional<byte[]> readExisting(String relativePath);

    /**
     * File names directly under the data directory; empty when the directory does not exist yet.
     *
     * @throws StorageException when the directory exists but cannot be listed
     */
    List<String> listArtifactNames();
}
