package com.github.stormino.medialib.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A tenant-independent piece of acquired content. {@code sourceIdentity} is null
 * for directly uploaded assets.
 */
@Value
@Builder(toBuilder = true)
public class Asset {

    long id;
    String sourceIdentity;
    String displayTitle;
    String storageKey;
    Long byteSize;
    LocalDateTime createdAt;

    public boolean isDirectUpload() {
        return sourceIdentity == null;
    }
}
