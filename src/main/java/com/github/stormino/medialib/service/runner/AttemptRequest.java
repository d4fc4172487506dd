package com.github.stormino.medialib.service.runner;

import com.github.stormino.medialib.model.ProgressUpdate;
import com.github.stormino.medialib.service.egress.AttemptDescriptor;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Everything one run of the extraction tool needs.
 */
@Data
@Builder
public class AttemptRequest {

    /**
     * Job the attempt belongs to, for logging and progress events.
     */
    private final String jobId;

    /**
     * Canonical URL handed to the tool.
     */
    private final String sourceIdentity;

    /**
     * Rung being attempted.
     */
    private final AttemptDescriptor attempt;

    /**
     * Path the tool must write. A sibling with another media extension is also accepted.
     */
    private final Path outputFile;

    /**
     * Cookie-jar file, or null when the rung runs without a credential.
     */
    private final Path credentialFile;

    /**
     * Receives progress and title updates as lines arrive. May be null.
     */
    private final Consumer<ProgressUpdate> progressCallback;
}
