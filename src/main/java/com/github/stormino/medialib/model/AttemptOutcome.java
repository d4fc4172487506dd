package com.github.stormino.medialib.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Result of one rung of the strategy ladder.
 */
@Value
@Builder(toBuilder = true)
public class AttemptOutcome {

    Status status;
    FailureKind failureKind;
    String errorMessage;

    /**
     * Title reported by the tool, if it printed one.
     */
    String title;

    Integer exitCode;

    /**
     * Output file the tool produced. Set only for {@link Status#SUCCESS}.
     */
    Path artifact;

    public enum Status {
        SUCCESS,
        RETRYABLE,
        FATAL
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE;
    }

    public static AttemptOutcome success(Path artifact, String title) {
        return AttemptOutcome.builder()
                .status(Status.SUCCESS)
                .artifact(artifact)
                .title(title)
                .exitCode(0)
                .build();
    }

    public static AttemptOutcome failure(FailureKind kind, String errorMessage) {
        return AttemptOutcome.builder()
                .status(kind.isRetryable() ? Status.RETRYABLE : Status.FATAL)
                .failureKind(kind)
                .errorMessage(errorMessage)
                .build();
    }

    public static AttemptOutcome failure(FailureKind kind, String errorMessage, Integer exitCode) {
        return AttemptOutcome.builder()
                .status(kind.isRetryable() ? Status.RETRYABLE : Status.FATAL)
                .failureKind(kind)
                .errorMessage(errorMessage)
                .exitCode(exitCode)
                .build();
    }

    /**
     * Same failure, no longer eligible for another attempt.
     */
    public AttemptOutcome asFatal() {
        return toBuilder().status(Status.FATAL).build();
    }

    public AttemptOutcome withTitle(String title) {
        return toBuilder().title(title).build();
    }
}
