package com.github.stormino.medialib.model;

import com.github.stormino.medialib.util.AcquisitionConstants;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class LibraryEntry {

    long tenantId;
    long assetId;
    String storageKey;
    Map<String, Object> metadata;

    /**
     * Metadata stored for a tenant: caller-supplied keys plus the display title and,
     * when known, the provenance URL.
     */
    public static Map<String, Object> metadataOf(Map<String, Object> extra, String title, String url) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (extra != null) {
            metadata.putAll(extra);
        }
        metadata.put(AcquisitionConstants.METADATA_TITLE, title);
        if (url != null) {
            metadata.put(AcquisitionConstants.METADATA_URL, url);
        }
        return metadata;
    }
}
