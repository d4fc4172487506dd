package com.github.stormino.medialib.service.registry;

import com.github.stormino.medialib.model.Asset;

import java.util.List;
import java.util.Optional;

/**
 * Tenant-independent table of acquired assets, reference-counted by library membership.
 */
public interface ContentRegistry {

    Optional<Asset> findBySource(String sourceIdentity);

    Optional<Asset> findByStorageKey(String storageKey);

    /**
     * Read and row-lock an asset until the surrounding transaction ends.
     * Must be called inside a transaction.
     *
     * @return The asset, empty if the row is gone
     */
    Optional<Asset> lockById(long assetId);

    /**
     * Register acquired bytes. Idempotent: if an asset with the same storage key, or the
     * same non-null source identity, already exists, that row is returned unchanged.
     * Concurrent registrations resolve to one canonical row.
     *
     * @param storageKey File name of the bytes
     * @param sourceIdentity Canonical source, null for direct uploads
     * @param title Display title
     * @param byteSize Size in bytes, may be null
     * @return The canonical asset
     */
    Asset register(String storageKey, String sourceIdentity, String title, Long byteSize);

    int referenceCount(long assetId);

    /**
     * Backfill the size of an existing asset.
     */
    void updateByteSize(long assetId, long byteSize);

    /**
     * Delete an asset row and, by cascade, its library entries.
     * Callers must have verified a zero reference count.
     */
    void delete(long assetId);

    /**
     * Delete an asset row only if no library entry references it, checked in the same statement.
     *
     * @return true if the row was deleted
     */
    boolean deleteIfUnreferenced(long assetId);

    /**
     * Assets no library entry points at.
     */
    List<Asset> findUnreferenced();
}
