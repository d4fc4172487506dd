package com.github.stormino.medialib.service.job;

import com.github.stormino.medialib.config.MediaLibraryProperties;
import com.github.stormino.medialib.model.AcquisitionJob;
import com.github.stormino.medialib.model.AcquisitionResult;
import com.github.stormino.medialib.model.Asset;
import com.github.stormino.medialib.model.JobState;
import com.github.stormino.medialib.model.JobStatus;
import com.github.stormino.medialib.model.LibraryEntry;
import com.github.stormino.medialib.model.SourceIdentity;
import com.github.stormino.medialib.service.registry.ContentRegistry;
import com.github.stormino.medialib.service.registry.LibraryAdmission;
import com.github.stormino.medialib.service.state.JobStateMachine;
import com.github.stormino.medialib.service.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for acquisition requests: dedup check, job creation and status polling.
 */
@Slf4j
@Service
public class AcquisitionService {

    private final MediaLibraryProperties properties;
    private final ContentRegistry contentRegistry;
    private final LibraryAdmission libraryAdmission;
    private final ArtifactStore artifactStore;
    private final JobRegistry jobRegistry;
    private final JobStateMachine stateMachine;
    private final AcquisitionOrchestrator orchestrator;
    private final Executor jobExecutor;

    public AcquisitionService(MediaLibraryProperties properties,
                              ContentRegistry contentRegistry,
                              LibraryAdmission libraryAdmission,
                              ArtifactStore artifactStore,
                              JobRegistry jobRegistry,
                              JobStateMachine stateMachine,
                              AcquisitionOrchestrator orchestrator,
                              @Qualifier("jobExecutor") Executor jobExecutor) {
        this.properties = properties;
        this.contentRegistry = contentRegistry;
        this.libraryAdmission = libraryAdmission;
        this.artifactStore = artifactStore;
        this.jobRegistry = jobRegistry;
        this.stateMachine = stateMachine;
        this.orchestrator = orchestrator;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Resolve a request for {@code rawUrl}: attach an existing asset right away, or start a job.
     *
     * @param tenantId Requesting tenant
     * @param rawUrl Source URL as supplied
     * @param title Optional title override for the tenant's library
     * @param metadata Optional extra library metadata
     * @return Dedup hit or the id of the job to poll
     * @throws com.github.stormino.medialib.exception.InvalidSourceException if the URL is rejected
     * @throws com.github.stormino.medialib.exception.RegistrationException if a dedup hit cannot be attached
     */
    public AcquisitionResult acquire(long tenantId, String rawUrl, String title, Map<String, Object> metadata) {
        SourceIdentity source = SourceIdentity.parse(rawUrl, properties.getSource().getAllowedHosts());

        Optional<Asset> existing = contentRegistry.findBySource(source.value());
        if (existing.isPresent() && artifactStore.exists(existing.get().getStorageKey())) {
            Asset asset = existing.get();
            String effectiveTitle = firstNonBlank(title, asset.getDisplayTitle(), asset.getStorageKey());
            Optional<Asset> attached = libraryAdmission.attachIfPresent(tenantId, asset.getId(),
                    LibraryEntry.metadataOf(metadata, effectiveTitle, source.value()));
            if (attached.isPresent()) {
                log.info("Dedup hit for tenant {}: {} -> {}", tenantId, source, asset.getStorageKey());
                return AcquisitionResult.dedupHit(attached.get(), effectiveTitle);
            }
            log.info("Asset {} for {} was collected before it could be attached, acquiring again",
                    asset.getId(), source);
        } else if (existing.isPresent()) {
            log.info("Asset {} for {} has no bytes, re-acquiring", existing.get().getId(), source);
        }

        // Own key per job: concurrent jobs for one source never share an output file
        AcquisitionJob job = AcquisitionJob.builder()
                .tenantId(tenantId)
                .sourceIdentity(source.value())
                .requestedTitle(title != null && !title.isBlank() ? title.trim() : null)
                .requestMetadata(metadata)
                .build();
        job.setStorageKey(job.getId() + "." + properties.getDownload().getMergeOutputFormat());

        AcquisitionJob owner = jobRegistry.registerIfAbsent(job);
        if (owner != job) {
            log.info("Tenant {} already acquiring {} in job {}", tenantId, source, owner.getId());
            return AcquisitionResult.jobCreated(owner);
        }

        try {
            jobExecutor.execute(() -> orchestrator.execute(job));
        } catch (RejectedExecutionException e) {
            log.error("Job {} rejected by worker pool: {}", job.getId(), e.getMessage());
            job.setErrorMessage("Server busy, try again later");
            job.setCompletedAt(LocalDateTime.now());
            stateMachine.transition(job, JobState.FAILED);
        }
        log.info("Job {} created for tenant {}: {}", job.getId(), tenantId, source);
        return AcquisitionResult.jobCreated(job);
    }

    /**
     * Status of a job as seen by {@code tenantId}. Jobs of other tenants are not found.
     */
    public Optional<JobStatus> getJobStatus(long tenantId, String jobId) {
        return jobRegistry.findForTenant(tenantId, jobId).map(JobStatus::forJob);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
