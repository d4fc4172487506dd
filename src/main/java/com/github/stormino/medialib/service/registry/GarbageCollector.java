package com.github.stormino.medialib.service.registry;

import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes assets no tenant references. Runs on demand only.
 */
@Slf4j
@Service
public class GarbageCollector {

    private final ContentRegistry contentRegistry;
    private final ArtifactStore artifactStore;
    private final TransactionTemplate transactionTemplate;

    public GarbageCollector(ContentRegistry contentRegistry,
                            ArtifactStore artifactStore,
                            PlatformTransactionManager transactionManager) {
        this.contentRegistry = contentRegistry;
        this.artifactStore = artifactStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Delete the registry rows of all zero-reference assets.
     * Each row is locked, then re-checked in its delete statement, so an asset
     * attached after the scan survives and its key is not returned.
     *
     * @return Storage keys whose rows were deleted
     */
    public List<String> sweep() {
        List<String> keys = new ArrayList<>();
        for (Asset orphan : contentRegistry.findUnreferenced()) {
            if (deleteIfStillOrphaned(orphan.getId())) {
                keys.add(orphan.getStorageKey());
            } else {
                log.debug("Asset {} gained a reference during sweep, kept", orphan.getStorageKey());
            }
        }
        log.info("Sweep removed {} orphaned asset(s)", keys.size());
        return keys;
    }

    private boolean deleteIfStillOrphaned(long assetId) {
        Boolean deleted = transactionTemplate.execute(status ->
                contentRegistry.lockById(assetId).isPresent() && contentRegistry.deleteIfUnreferenced(assetId));
        return Boolean.TRUE.equals(deleted);
    }

    /**
     * Sweep, then purge the returned keys from local and remote storage.
     *
     * @return Storage keys removed from the registry
     */
    public List<String> collect() {
        List<String> keys = sweep();
        for (String key : keys) {
            if (!artifactStore.purge(key)) {
                log.warn("Bytes of {} may remain in storage", key);
            }
        }
        return keys;
    }
}
