package com.github.stormino.medialib.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a job as returned to a polling tenant.
 */
@Value
@Builder
public class JobStatus {

    String jobId;
    JobState state;
    double progress;
    String title;
    String filename;
    String error;
    String warning;

    public static JobStatus forJob(AcquisitionJob job) {
        return JobStatus.builder()
                .jobId(job.getId())
                .state(job.getState())
                .progress(job.getProgress())
                .title(job.getTitle())
                .filename(job.getFilename())
                .error(job.getErrorMessage())
                .warning(job.getWarning())
                .build();
    }
}
