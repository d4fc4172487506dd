package com.github.stormino.medialib.service.registry;

import com.github.stormino.medialib.exception.StorageException;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.AssetRegistration;
import com.github.stormino.medialib.model.LibraryEntry;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import com.github.stormino.medialib.util.AcquisitionConstants;
import com.github.stormino.medialib.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Library operations that are not acquisitions: saving metadata for a file and direct uploads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LibraryService {

    private final ContentRegistry contentRegistry;
    private final LibraryAdmission libraryAdmission;
    private final ArtifactStore artifactStore;

    /**
     * Attach {@code storageKey} to the tenant's library with {@code metadata}. A file present
     * in storage without a registry row is registered first as a direct upload.
     *
     * @return The asset, empty if neither a row nor the bytes exist
     */
    public Optional<Asset> save(long tenantId, String storageKey, Map<String, Object> metadata) {
        String title = titleFrom(metadata, storageKey);
        Object url = metadata != null ? metadata.get(AcquisitionConstants.METADATA_URL) : null;
        Map<String, Object> entryMetadata = LibraryEntry.metadataOf(metadata, title, url != null ? url.toString() : null);

        Optional<Asset> asset = contentRegistry.findByStorageKey(storageKey);
        if (asset.isPresent()) {
            Optional<Asset> attached = libraryAdmission.attachIfPresent(tenantId, asset.get().getId(), entryMetadata);
            if (attached.isPresent()) {
                return attached;
            }
            log.debug("Asset {} was collected before tenant {} could save it", storageKey, tenantId);
        }
        if (!artifactStore.exists(storageKey)) {
            return Optional.empty();
        }
        AssetRegistration registration = AssetRegistration.builder()
                .storageKey(storageKey)
                .title(title)
                .byteSize(artifactStore.size(storageKey).orElse(null))
                .build();
        Asset registered = libraryAdmission.registerAndAttach(tenantId, registration, entryMetadata, canonical -> { });
        log.info("Registered untracked file {} for tenant {}", storageKey, tenantId);
        return Optional.of(registered);
    }

    /**
     * Store an uploaded file, register it without a source identity and attach it to the tenant.
     *
     * @throws StorageException if the bytes cannot be written locally
     */
    public Asset upload(long tenantId, String originalFilename, InputStream content, String title) {
        String storageKey = UUID.randomUUID().toString().substring(0, 8) + "-" + PathUtils.sanitizeFilename(originalFilename);
        Path target = artifactStore.localTarget(storageKey);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to store upload: " + e.getMessage(), e, storageKey, "upload");
        }

        try {
            artifactStore.push(storageKey, target);
        } catch (StorageException e) {
            log.warn("Upload {} kept locally only: {}", storageKey, e.getMessage());
        }

        String displayTitle = title != null && !title.isBlank() ? title.trim() : originalFilename;
        AssetRegistration registration = AssetRegistration.builder()
                .storageKey(storageKey)
                .title(displayTitle)
                .byteSize(artifactStore.size(storageKey).orElse(null))
                .build();
        Asset asset = libraryAdmission.registerAndAttach(tenantId, registration,
                LibraryEntry.metadataOf(null, displayTitle, null), canonical -> { });
        log.info("Tenant {} uploaded {} as asset {}", tenantId, storageKey, asset.getId());
        return asset;
    }

    private static String titleFrom(Map<String, Object> metadata, String fallback) {
        Object title = metadata != null ? metadata.get(AcquisitionConstants.METADATA_TITLE) : null;
        return title != null && !title.toString().isBlank() ? title.toString() : fallback;
    }
}
