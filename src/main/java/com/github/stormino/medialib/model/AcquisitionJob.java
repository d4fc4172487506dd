package com.github.stormino.medialib.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory acquisition job. Written only by its own worker thread; read by any
 * status poller, so mutable fields are volatile and readers may see a slightly
 * stale combination of them.
 */
@Data
@Builder
public class AcquisitionJob {

    public static final String PENDING_TITLE = "Fetching...";

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private long tenantId;
    private String sourceIdentity;

    /**
     * File name the tool is asked to write; may change if the tool picks another container.
     */
    private volatile String storageKey;

    /**
     * Title supplied by the tenant with the request, if any.
     */
    private String requestedTitle;

    private Map<String, Object> requestMetadata;

    @Builder.Default
    private volatile JobState state = JobState.QUEUED;

    @Builder.Default
    private volatile double progress = 0.0;

    @Builder.Default
    private volatile String title = PENDING_TITLE;

    private volatile String filename;
    private volatile String errorMessage;
    private volatile String warning;

    @Builder.Default
    private volatile int attemptIndex = 0;

    private volatile Long assetId;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime completedAt;

    /**
     * Raise progress to {@code value}, clamped to 0-100. Never lowers it.
     */
    public void advanceProgress(double value) {
        double clamped = Math.max(0.0, Math.min(100.0, value));
        if (clamped > progress) {
            progress = clamped;
        }
    }

    public boolean isTerminal() {
        return state == JobState.COMPLETE || state == JobState.FAILED;
    }

    public boolean belongsTo(long tenant) {
        return tenantId == tenant;
    }

    /**
     * Title to store in library metadata: the tenant's, then the discovered one, then the file name.
     */
    public String getEffectiveTitle() {
        if (requestedTitle != null && !requestedTitle.isBlank()) {
            return requestedTitle;
        }
        if (title != null && !title.isBlank() && !PENDING_TITLE.equals(title)) {
            return title;
        }
        return filename != null ? filename : storageKey;
    }
}
