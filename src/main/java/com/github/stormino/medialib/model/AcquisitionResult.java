package com.github.stormino.medialib.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Answer to an acquisition request: either an immediate dedup hit or a job to poll.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AcquisitionResult {

    boolean dedup;
    String jobId;
    String filename;
    String title;

    public static AcquisitionResult dedupHit(Asset asset, String title) {
        return AcquisitionResult.builder()
                .dedup(true)
                .filename(asset.getStorageKey())
                .title(title)
                .build();
    }

    public static AcquisitionResult jobCreated(AcquisitionJob job) {
        return AcquisitionResult.builder()
                .dedup(false)
                .jobId(job.getId())
                .build();
    }
}
