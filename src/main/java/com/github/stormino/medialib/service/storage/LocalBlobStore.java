package com.github.stormino.medialib.service.storage;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.exception.StorageException;
import com.github.stormino.medialib.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;

/**
 * Artifacts as plain files under the configured videos directory.
 */
@Slf4j
@Component
public class LocalBlobStore implements BlobStore {

    private final Path root;

    @Autowired
    public LocalBlobStore(MediaLibraryProperties properties) {
        this(Paths.get(properties.getDownload().getVideosPath()));
    }

    public LocalBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Local path of a storage key.
     *
     * @throws StorageException if the key could escape the storage directory
     */
    public Path pathFor(String storageKey) {
        if (!PathUtils.isSafeStorageKey(storageKey)) {
            throw new StorageException("Invalid storage key: " + storageKey, storageKey, "resolve");
        }
        return root.resolve(storageKey);
    }

    @Override
    public void put(String storageKey, Path localPath) {
        Path target = pathFor(storageKey);
        try {
            Files.createDirectories(root);
            if (Files.exists(target) && Files.isSameFile(target, localPath)) {
                return;
            }
            Files.copy(localPath, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored {} locally at {}", storageKey, target);
        } catch (IOException e) {
            throw new StorageException("Failed to store file locally: " + e.getMessage(), e, storageKey, "put");
        }
    }

    @Override
    public boolean delete(String storageKey) {
        try {
            return Files.deleteIfExists(pathFor(storageKey));
        } catch (IOException e) {
            throw new StorageException("Failed to delete local file: " + e.getMessage(), e, storageKey, "delete");
        }
    }

    @Override
    public boolean exists(String storageKey) {
        if (!PathUtils.isSafeStorageKey(storageKey)) {
            return false;
        }
        return Files.isRegularFile(root.resolve(storageKey));
    }

    @Override
    public Optional<Long> size(String storageKey) {
        if (!exists(storageKey)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.size(root.resolve(storageKey)));
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", storageKey, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> urlFor(String storageKey, Duration ttl) {
        return Optional.empty();
    }
}
