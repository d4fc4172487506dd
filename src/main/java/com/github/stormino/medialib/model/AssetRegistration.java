package com.github.stormino.medialib.model;

import lombok.Builder;
import lombok.Value;

/**
 * Bytes about to enter the registry, as produced by a job or an upload.
 */
@Value
@Builder
public class AssetRegistration {

    String storageKey;
    String sourceIdentity;
    String title;
    Long byteSize;
}
