package com.github.stormino.medialib.model;

/**
 * Classification of a failed acquisition attempt. Retryable kinds advance the
 * strategy ladder; the rest end the job immediately.
 */
public enum FailureKind {
    INVALID_SOURCE(false),
    UPSTREAM_BLOCKED(true),
    CLIENT_BLOCKED(true),
    CONNECTIVITY(true),
    TOOL_UNAVAILABLE(true),
    ARTIFACT_MISSING(true),
    CONTENT_UNAVAILABLE(false),
    TOOL_ERROR(true),
    TIMEOUT(true);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
