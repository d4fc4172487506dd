package com.github.stormino.medialib.service.registry;

import com.github.stormino.medialib.model.LibraryEntry;

import java.util.List;
import java.util.Map;

/**
 * Per-tenant references into the content registry. Detaching never deletes the
 * asset itself; that is the garbage collector's job.
 */
public interface TenantLibrary {

    /**
     * Add the asset to the tenant's library, or replace the metadata if it is already there.
     */
    void attach(long tenantId, long assetId, Map<String, Object> metadata);

    /**
     * Library view: storage key to metadata, only for assets whose bytes are present.
     */
    Map<String, Map<String, Object>> list(long tenantId);

    /**
     * All entries of the tenant, present bytes or not.
     */
    List<LibraryEntry> entries(long tenantId);

    /**
     * @return true if a row was removed
     */
    boolean detach(long tenantId, String storageKey);
}
