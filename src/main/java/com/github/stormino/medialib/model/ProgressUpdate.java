package com.github.stormino.medialib.model;

import lombok.Builder;
import lombok.Value;

/**
 * Progress information parsed from one line of tool output.
 */
@Value
@Builder
public class ProgressUpdate {

    String jobId;
    Double progress;
    Phase phase;
    String title;

    public enum Phase {
        DOWNLOADING,
        FINALIZING
    }

    public boolean hasProgress() {
        return progress != null;
    }
}
