package com.github.stormino.medialib.service.runner;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.model.AttemptOutcome;
import com.github.stormino.medialib.model.FailureKind;
import com.github.stormino.medialib.model.ProgressUpdate;
import com.github.stormino.medialib.service.command.ExtractionCommandBuilder;
import com.github.stormino.medialib.service.parser.ToolOutputParser;
import com.github.stormino.medialib.util.AcquisitionConstants;
import com.github.stormino.medialib.util.PathUtils;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

@Slf4j
@Service
public class ExtractionToolRunner implements AcquisitionRunner {

    private static final long VERSION_TIMEOUT_SECONDS = 15;

    private final MediaLibraryProperties properties;
    private final ExtractionCommandBuilder commandBuilder;
    private final OutcomeClassifier classifier;
    private final ScheduledThreadPoolExecutor watchdog;

    public ExtractionToolRunner(MediaLibraryProperties properties,
                                ExtractionCommandBuilder commandBuilder,
                                OutcomeClassifier classifier) {
        this.properties = properties;
        this.commandBuilder = commandBuilder;
        this.classifier = classifier;
        this.watchdog = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "extraction-watchdog");
            thread.setDaemon(true);
            return thread;
        });
        this.watchdog.setRemoveOnCancelPolicy(true);
    }

    @PreDestroy
    public void shutdown() {
        watchdog.shutdownNow();
    }

    @Override
    public AttemptOutcome run(AttemptRequest request) {
        List<String> command = commandBuilder.buildAcquisitionCommand(request);
        Consumer<ProgressUpdate> callback = request.getProgressCallback() != null
                ? request.getProgressCallback()
                : update -> { };

        try {
            Path parent = request.getOutputFile().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            log.error("Cannot create output directory for job {}: {}", request.getJobId(), e.getMessage());
            return AttemptOutcome.failure(FailureKind.TOOL_ERROR, "Cannot create output directory: " + e.getMessage());
        }

        Process process;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            process = processBuilder.start();
        } catch (IOException e) {
            log.error("Extraction tool could not be started for job {}: {}", request.getJobId(), e.getMessage());
            return AttemptOutcome.failure(FailureKind.TOOL_UNAVAILABLE,
                    "Extraction tool not available: " + e.getMessage());
        }

        AtomicBoolean timedOut = new AtomicBoolean(false);
        long timeoutMinutes = properties.getDownload().getAttemptTimeoutMinutes();
        ScheduledFuture<?> killer = watchdog.schedule(() -> {
            if (process.isAlive()) {
                timedOut.set(true);
                log.warn("Job {} attempt exceeded {} minutes, killing tool", request.getJobId(), timeoutMinutes);
                destroy(process);
            }
        }, timeoutMinutes, TimeUnit.MINUTES);
        try {
            return awaitOutcome(request, process, callback, timedOut, timeoutMinutes);
        } finally {
            killer.cancel(false);
        }
    }

    private AttemptOutcome awaitOutcome(AttemptRequest request, Process process, Consumer<ProgressUpdate> callback,
                                        AtomicBoolean timedOut, long timeoutMinutes) {
        ToolOutputParser parser = new ToolOutputParser();
        Deque<String> tail = new ArrayDeque<>();

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {

            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("Tool output [{}]: {}", request.getJobId(), line);
                if (tail.size() == AcquisitionConstants.OUTPUT_TAIL_LINES) {
                    tail.removeFirst();
                }
                tail.addLast(line);

                ProgressUpdate update = parser.parseLine(line, request.getJobId());
                if (update != null) {
                    callback.accept(update);
                }
            }

            process.waitFor();
        } catch (IOException e) {
            // Stream closed under us, usually by the timeout watchdog
            log.debug("Tool output stream closed for job {}: {}", request.getJobId(), e.getMessage());
            waitQuietly(process);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy(process);
            return AttemptOutcome.failure(FailureKind.TOOL_ERROR, "Attempt interrupted");
        }

        if (timedOut.get()) {
            return AttemptOutcome.failure(FailureKind.TIMEOUT,
                    "Download timeout exceeded (" + timeoutMinutes + " min)")
                    .withTitle(parser.getTitle());
        }

        if (process.isAlive()) {
            destroy(process);
            return AttemptOutcome.failure(FailureKind.TOOL_ERROR, "Extraction tool did not exit");
        }

        int exitCode = process.exitValue();
        AttemptOutcome outcome = classifier.classify(exitCode, String.join("\n", tail));

        if (!outcome.isSuccess()) {
            log.warn("Job {} attempt [{}] failed with exit code {}: {} ({})", request.getJobId(),
                    request.getAttempt(), exitCode, outcome.getErrorMessage(), outcome.getFailureKind());
            return outcome.withTitle(parser.getTitle());
        }

        Optional<Path> artifact = PathUtils.locateArtifact(request.getOutputFile());
        if (artifact.isEmpty()) {
            log.warn("Job {} tool exited 0 but no output at {}", request.getJobId(), request.getOutputFile());
            return AttemptOutcome.failure(FailureKind.ARTIFACT_MISSING,
                    AcquisitionConstants.ARTIFACT_MISSING_ERROR, exitCode).withTitle(parser.getTitle());
        }
        return AttemptOutcome.success(artifact.get(), parser.getTitle());
    }

    @Override
    public Optional<String> toolVersion() {
        List<String> command = commandBuilder.buildVersionCommand();
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            String output;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.readLine();
            }
            if (!process.waitFor(VERSION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                destroy(process);
                return Optional.empty();
            }
            if (process.exitValue() != 0 || output == null || output.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(output.trim());
        } catch (IOException e) {
            log.debug("Extraction tool version check failed: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * Timeout tasks still scheduled. Zero between attempts.
     */
    int pendingWatchdogs() {
        return watchdog.getQueue().size();
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void waitQuietly(Process process) {
        try {
            if (!process.waitFor(30, TimeUnit.SECONDS)) {
                destroy(process);
                process.waitFor();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy(process);
        }
    }
}
