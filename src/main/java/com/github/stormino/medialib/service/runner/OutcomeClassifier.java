package com.github.stormino.medialib.service.runner;

import com.github.stormino.medialib.model.AttemptOutcome;
import com.github.stormino.medialib.model.FailureKind;
import com.github.stormino.medialib.util.AcquisitionConstants;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Maps the tool's exit code and output to an attempt outcome. Pure: no I/O, no state.
 *
 * <p>Lines starting with {@code ERROR:} are matched first so that warnings the tool
 * recovered from do not decide the classification. A zero exit is always a success;
 * the caller still has to locate the artifact.
 */
@Component
public class OutcomeClassifier {

    private static final String ERROR_PREFIX = "ERROR:";
    private static final int MAX_MESSAGE_LENGTH = 500;

    public AttemptOutcome classify(int exitCode, String output) {
        if (exitCode == 0) {
            return AttemptOutcome.success(null, null);
        }

        String text = output == null ? "" : output;
        List<String> errorLines = text.lines()
                .map(String::trim)
                .filter(line -> line.startsWith(ERROR_PREFIX))
                .toList();

        if (isToolMissing(exitCode, text)) {
            return AttemptOutcome.failure(FailureKind.TOOL_UNAVAILABLE,
                    "Extraction tool could not be executed (exit code " + exitCode + ")", exitCode);
        }

        String message = lastError(errorLines)
                .orElse("Download failed with exit code " + exitCode);

        Optional<FailureSignature> signature = match(String.join("\n", errorLines));
        if (signature.isEmpty()) {
            signature = match(text);
        }

        FailureKind kind = signature.map(FailureSignature::getKind).orElse(FailureKind.TOOL_ERROR);
        return AttemptOutcome.failure(kind, message, exitCode);
    }

    /**
     * First signature, in declaration order, found in {@code text}.
     */
    public Optional<FailureSignature> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(FailureSignature.values())
                .filter(signature -> signature.matches(text))
                .findFirst();
    }

    private static boolean isToolMissing(int exitCode, String text) {
        boolean shellCode = exitCode == AcquisitionConstants.EXIT_COMMAND_NOT_FOUND
                || exitCode == AcquisitionConstants.EXIT_NOT_EXECUTABLE;
        return shellCode && (text.isBlank() || text.contains("not found") || text.contains("Permission denied"));
    }

    private static Optional<String> lastError(List<String> errorLines) {
        if (errorLines.isEmpty()) {
            return Optional.empty();
        }
        String last = errorLines.get(errorLines.size() - 1);
        return Optional.of(last.length() > MAX_MESSAGE_LENGTH ? last.substring(0, MAX_MESSAGE_LENGTH) : last);
    }
}
