package com.github.stormino.medialib.service.job;

import com.github.stormino.medialib.model.AcquisitionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of acquisition jobs. Lives as long as the process; jobs are never persisted.
 */
@Slf4j
@Component
public class JobRegistry {

    private final Map<String, AcquisitionJob> jobs = new ConcurrentHashMap<>();

    /**
     * Tenant and source to the id of that tenant's job for the source.
     */
    private final Map<String, String> activeBySource = new ConcurrentHashMap<>();

    /**
     * Register {@code job} unless the same tenant already has an unfinished job for the same source.
     *
     * @return The job now responsible for the source: {@code job} itself, or the one already running
     */
    public AcquisitionJob registerIfAbsent(AcquisitionJob job) {
        String key = activeKey(job.getTenantId(), job.getSourceIdentity());
        String ownerId = activeBySource.compute(key, (k, existingId) -> {
            AcquisitionJob existing = existingId != null ? jobs.get(existingId) : null;
            if (existing != null && !existing.isTerminal()) {
                return existingId;
            }
            jobs.put(job.getId(), job);
            return job.getId();
        });
        if (!ownerId.equals(job.getId())) {
            log.debug("Tenant {} already has job {} for {}", job.getTenantId(), ownerId, job.getSourceIdentity());
        }
        return jobs.get(ownerId);
    }

    public Optional<AcquisitionJob> find(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Look up a job visible to {@code tenantId}. Jobs of other tenants are reported as absent.
     */
    public Optional<AcquisitionJob> findForTenant(long tenantId, String jobId) {
        return find(jobId).filter(job -> job.belongsTo(tenantId));
    }

    public int size() {
        return jobs.size();
    }

    private static String activeKey(long tenantId, String sourceIdentity) {
        return tenantId + "|" + sourceIdentity;
    }
}
