package com.github.stormino.medialib.service.storage;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Local directory plus the optional remote store, seen as one. Without a remote
 * store every operation falls back to the local files alone.
 */
@Slf4j
@Service
public class ArtifactStore {

    private final LocalBlobStore local;
    private final BlobStore remote;
    private final Duration urlTtl;

    public ArtifactStore(LocalBlobStore local, Optional<S3BlobStore> remote, MediaLibraryProperties properties) {
        this.local = local;
        this.remote = remote.orElse(null);
        this.urlTtl = Duration.ofSeconds(properties.getStorage().getUrlTtlSeconds());
        log.info("Artifact store: local={}, remote={}", local.getRoot(), this.remote != null ? "enabled" : "disabled");
    }

    /**
     * Make the artifact available under {@code storageKey} locally and, when configured, remotely.
     * Retried with backoff; callers treat a final {@link StorageException} as a warning.
     */
    @Retryable(retryFor = StorageException.class, maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2))
    public void push(String storageKey, Path localPath) {
        local.put(storageKey, localPath);
        if (remote != null) {
            remote.put(storageKey, localPath);
            log.info("Uploaded {} to remote storage", storageKey);
        }
    }

    public boolean exists(String storageKey) {
        return local.exists(storageKey) || (remote != null && remote.exists(storageKey));
    }

    public Optional<Long> size(String storageKey) {
        Optional<Long> localSize = local.size(storageKey);
        if (localSize.isPresent() || remote == null) {
            return localSize;
        }
        return remote.size(storageKey);
    }

    /**
     * Pre-signed remote URL, if the remote store holds the object.
     */
    public Optional<String> urlFor(String storageKey) {
        if (remote == null || !remote.exists(storageKey)) {
            return Optional.empty();
        }
        return remote.urlFor(storageKey, urlTtl);
    }

    public Optional<Path> localPath(String storageKey) {
        return local.exists(storageKey) ? Optional.of(local.pathFor(storageKey)) : Optional.empty();
    }

    /**
     * Path a new artifact for {@code storageKey} should be written to.
     */
    public Path localTarget(String storageKey) {
        return local.pathFor(storageKey);
    }

    /**
     * Delete the bytes everywhere. Failures are logged, not thrown.
     *
     * @return true if no copy is known to remain
     */
    public boolean purge(String storageKey) {
        boolean clean = true;
        try {
            local.delete(storageKey);
        } catch (StorageException e) {
            log.warn("Failed to delete local copy of {}: {}", storageKey, e.getMessage());
            clean = false;
        }
        if (remote != null) {
            try {
                remote.delete(storageKey);
            } catch (StorageException e) {
                log.warn("Failed to delete remote copy of {}: {}", storageKey, e.getMessage());
                clean = false;
            }
        }
        return clean;
    }

    public boolean isRemoteEnabled() {
        return remote != null;
    }
}
