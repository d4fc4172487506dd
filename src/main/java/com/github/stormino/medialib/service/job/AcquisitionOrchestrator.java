package com.github.stormino.medialib.service.job;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.exception.RegistrationException;
import com.github.stormino.medialib.exception.StorageException;
import com.github.stormino.medialib.model.AcquisitionJob;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.AssetRegistration;
import com.github.stormino.medialib.model.AttemptOutcome;
import com.github.stormino.medialib.model.FailureKind;
import com.github.stormino.medialib.model.JobState;
import com.github.stormino.medialib.model.LibraryEntry;
import com.github.stormino.medialib.model.ProgressUpdate;
import com.github.stormino.medialib.service.credential.CredentialResolver;
import com.github.stormino.medialib.service.egress.AttemptDescriptor;
import com.github.stormino.medialib.service.egress.EgressStrategySelector;
import com.github.stormino.medialib.service.egress.StrategyLadder;
import com.github.stormino.medialib.service.registry.ContentRegistry;
import com.github.stormino.medialib.service.registry.LibraryAdmission;
import com.github.stormino.medialib.service.runner.AcquisitionRunner;
import com.github.stormino.medialib.service.runner.AttemptRequest;
import com.github.stormino.medialib.service.state.JobStateMachine;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import com.github.stormino.medialib.util.AcquisitionConstants;
import com.github.stormino.medialib.util.PathUtils;
import com.github.stormino.medialib.util.TempFileManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Drives one job from QUEUED to COMPLETE or FAILED on the worker thread that owns it.
 *
 * <p>Rungs run sequentially. Retryable failures advance the ladder, a client-identity
 * block first queues the same route under another client, and a non-retryable failure
 * ends the job. A missing artifact after a zero exit is re-checked once and the rung
 * re-run once; an unstartable tool is retried once. Registration and library attach
 * both have to succeed before the job reports COMPLETE. Every job writes to its own
 * key; when the source already has an asset, the bytes move to that asset's key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcquisitionOrchestrator {

    private final MediaLibraryProperties properties;
    private final EgressStrategySelector strategySelector;
    private final AcquisitionRunner runner;
    private final CredentialResolver credentialResolver;
    private final ContentRegistry contentRegistry;
    private final LibraryAdmission libraryAdmission;
    private final ArtifactStore artifactStore;
    private final JobStateMachine stateMachine;

    /**
     * Run the job to a terminal state. Never throws.
     */
    public void execute(AcquisitionJob job) {
        try (TempFileManager tempFiles = new TempFileManager()) {
            run(job, tempFiles);
        } catch (Exception e) {
            log.error("Job {} failed unexpectedly: {}", job.getId(), e.getMessage(), e);
            fail(job, "Unexpected error: " + e.getMessage());
        }
    }

    private void run(AcquisitionJob job, TempFileManager tempFiles) {
        if (!stateMachine.transition(job, JobState.RUNNING)) {
            return;
        }
        job.setStartedAt(LocalDateTime.now());
        log.info("Job {} started for tenant {}: {}", job.getId(), job.getTenantId(), job.getSourceIdentity());

        Path credentialFile = prepareCredential(job, tempFiles);
        boolean hasCredential = credentialFile != null;
        StrategyLadder ladder = strategySelector.buildLadder(hasCredential);
        Path outputFile = artifactStore.localTarget(job.getStorageKey());

        RetryBudget budget = new RetryBudget();
        AttemptOutcome last = null;

        while (ladder.hasNext()) {
            AttemptDescriptor attempt = ladder.next();
            job.setAttemptIndex(ladder.position());
            log.info("Job {} rung {}/{}: {}", job.getId(), ladder.position(), ladder.size(), attempt);

            AttemptOutcome outcome = attemptRung(job, attempt, outputFile, credentialFile, budget);
            last = outcome;

            if (outcome.isSuccess()) {
                complete(job, outcome);
                return;
            }
            if (!outcome.isRetryable()) {
                fail(job, outcome.getErrorMessage());
                return;
            }
            if (outcome.getFailureKind() == FailureKind.CLIENT_BLOCKED) {
                strategySelector.retryWithAlternateClient(ladder, attempt, hasCredential);
            }
            log.warn("Job {} rung {} failed ({}): {}", job.getId(), ladder.position(),
                    outcome.getFailureKind(), outcome.getErrorMessage());
        }

        String lastError = last != null ? last.getErrorMessage() : "no strategy available";
        fail(job, AcquisitionConstants.LADDER_EXHAUSTED_PREFIX + lastError);
    }

    /**
     * Run one rung, absorbing the once-per-job retries for an unstartable tool and a missing artifact.
     */
    private AttemptOutcome attemptRung(AcquisitionJob job, AttemptDescriptor attempt, Path outputFile,
                                       Path credentialFile, RetryBudget budget) {
        AttemptRequest request = AttemptRequest.builder()
                .jobId(job.getId())
                .sourceIdentity(job.getSourceIdentity())
                .attempt(attempt)
                .outputFile(outputFile)
                .credentialFile(attempt.isUseCredential() ? credentialFile : null)
                .progressCallback(update -> applyProgress(job, update))
                .build();

        while (true) {
            AttemptOutcome outcome = runner.run(request);
            if (outcome.getTitle() != null) {
                job.setTitle(outcome.getTitle());
            }
            if (outcome.getFailureKind() == FailureKind.ARTIFACT_MISSING) {
                outcome = recheckArtifact(job, outputFile, outcome);
            }
            if (outcome.isSuccess()) {
                return outcome;
            }

            if (outcome.getFailureKind() == FailureKind.ARTIFACT_MISSING) {
                if (budget.artifactRetryUsed) {
                    return outcome.asFatal();
                }
                budget.artifactRetryUsed = true;
                log.warn("Job {} artifact missing after reported success, re-running rung", job.getId());
                continue;
            }
            if (outcome.getFailureKind() == FailureKind.TOOL_UNAVAILABLE) {
                if (budget.toolRetryUsed) {
                    return outcome.asFatal();
                }
                budget.toolRetryUsed = true;
                log.warn("Job {} could not run the extraction tool, retrying once: {}",
                        job.getId(), outcome.getErrorMessage());
                continue;
            }
            return outcome;
        }
    }

    private AttemptOutcome recheckArtifact(AcquisitionJob job, Path outputFile, AttemptOutcome missing) {
        long delay = properties.getDownload().getArtifactRecheckDelayMs();
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return missing;
            }
        }
        Optional<Path> artifact = PathUtils.locateArtifact(outputFile);
        if (artifact.isPresent()) {
            log.info("Job {} artifact appeared on re-check: {}", job.getId(), artifact.get());
            return AttemptOutcome.success(artifact.get(), missing.getTitle());
        }
        return missing;
    }

    private void complete(AcquisitionJob job, AttemptOutcome outcome) {
        Path artifact = outcome.getArtifact();
        String ownKey = artifact.getFileName().toString();
        job.setStorageKey(ownKey);
        job.advanceProgress(AcquisitionConstants.FINALIZING_PROGRESS);

        String warning = null;
        try {
            artifactStore.push(ownKey, artifact);
        } catch (StorageException e) {
            log.warn("Job {} stored {} locally only: {}", job.getId(), ownKey, e.getMessage());
            warning = "Remote storage upload failed: " + e.getMessage();
        }

        Long byteSize = sizeOf(artifact);
        String title = job.getEffectiveTitle();
        AssetRegistration registration = AssetRegistration.builder()
                .storageKey(ownKey)
                .sourceIdentity(job.getSourceIdentity())
                .title(title)
                .byteSize(byteSize)
                .build();

        Asset asset;
        try {
            asset = libraryAdmission.registerAndAttach(job.getTenantId(), registration,
                    LibraryEntry.metadataOf(job.getRequestMetadata(), title, job.getSourceIdentity()),
                    canonical -> prepareCanonical(job, canonical, ownKey, artifact, byteSize));
        } catch (StorageException e) {
            log.error("Job {} could not move its bytes to the canonical asset: {}", job.getId(), e.getMessage());
            artifactStore.purge(ownKey);
            fail(job, "Storage failure: " + e.getMessage());
            return;
        } catch (RegistrationException | DataAccessException e) {
            log.error("Job {} acquired {} but could not save it to the library: {}",
                    job.getId(), ownKey, e.getMessage());
            fail(job, "Failed to save to library: " + e.getMessage());
            return;
        }

        String storageKey = asset.getStorageKey();
        if (!storageKey.equals(ownKey)) {
            // Committed: the canonical asset holds its own copy now
            artifactStore.purge(ownKey);
        }

        job.setAssetId(asset.getId());
        job.setStorageKey(storageKey);
        job.setFilename(storageKey);
        job.setWarning(warning);
        job.advanceProgress(AcquisitionConstants.COMPLETE_PROGRESS);
        job.setCompletedAt(LocalDateTime.now());
        stateMachine.transition(job, JobState.COMPLETE);
        log.info("Job {} complete: {} (asset {})", job.getId(), storageKey, asset.getId());
    }

    /**
     * Runs with the canonical asset row locked. When another job or an earlier attempt registered
     * this source under a different key, make sure that key has bytes before anyone is attached to it.
     *
     * @throws StorageException if the canonical asset would be left without bytes
     */
    private void prepareCanonical(AcquisitionJob job, Asset canonical, String ownKey, Path artifact, Long byteSize) {
        if (canonical.getStorageKey().equals(ownKey)) {
            if (byteSize != null && !byteSize.equals(canonical.getByteSize())) {
                contentRegistry.updateByteSize(canonical.getId(), byteSize);
            }
            return;
        }

        log.info("Job {} resolved to asset {} ({})", job.getId(), canonical.getId(), canonical.getStorageKey());
        if (artifactStore.exists(canonical.getStorageKey())) {
            return;
        }
        try {
            artifactStore.push(canonical.getStorageKey(), artifact);
        } catch (StorageException e) {
            if (!artifactStore.exists(canonical.getStorageKey())) {
                throw e;
            }
            log.warn("Job {} restored {} locally only: {}", job.getId(), canonical.getStorageKey(), e.getMessage());
        }
        if (byteSize != null && !byteSize.equals(canonical.getByteSize())) {
            contentRegistry.updateByteSize(canonical.getId(), byteSize);
        }
    }

    private void applyProgress(AcquisitionJob job, ProgressUpdate update) {
        if (update.getTitle() != null) {
            job.setTitle(update.getTitle());
        }
        if (update.hasProgress()) {
            job.advanceProgress(Math.min(update.getProgress(), AcquisitionConstants.FINALIZING_PROGRESS));
        }
    }

    private Path prepareCredential(AcquisitionJob job, TempFileManager tempFiles) {
        Optional<String> credential = credentialResolver.resolve(job.getTenantId());
        if (credential.isEmpty()) {
            return null;
        }
        try {
            return credentialResolver.writeCredentialFile(credential.get(), job.getId(), tempFiles);
        } catch (IOException e) {
            log.warn("Job {} could not write credential file, running without it: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    private void fail(AcquisitionJob job, String message) {
        if (job.isTerminal()) {
            return;
        }
        job.setErrorMessage(message);
        job.setCompletedAt(LocalDateTime.now());
        stateMachine.transition(job, JobState.FAILED);
        log.error("Job {} failed: {}", job.getId(), message);
    }

    private static Long sizeOf(Path artifact) {
        try {
            return Files.size(artifact);
        } catch (IOException e) {
            return null;
        }
    }

    private static final class RetryBudget {
        private boolean toolRetryUsed;
        private boolean artifactRetryUsed;
    }
}
