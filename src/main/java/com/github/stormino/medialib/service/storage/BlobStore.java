package com.github.stormino.medialib.service.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Byte storage for finished artifacts, addressed by storage key.
 */
public interface BlobStore {

    /**
     * Store the file at {@code localPath} under {@code storageKey}.
     *
     * @throws com.github.stormino.medialib.exception.StorageException on failure
     */
    void put(String storageKey, Path localPath);

    /**
     * @return true if an object was removed
     * @throws com.github.stormino.medialib.exception.StorageException on failure
     */
    boolean delete(String storageKey);

    boolean exists(String storageKey);

    Optional<Long> size(String storageKey);

    /**
     * Time-limited download URL, empty when the store cannot hand out URLs.
     */
    Optional<String> urlFor(String storageKey, Duration ttl);
}
