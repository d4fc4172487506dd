package com.github.stormino.medialib.service.state;

import com.github.stormino.medialib.model.AcquisitionJob;
import com.github.stormino.medialib.model.JobState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for acquisition jobs. Jobs only move forward:
 * <pre>
 * QUEUED → RUNNING → COMPLETE
 *    ↓        ↓
 *  FAILED   FAILED
 * </pre>
 */
@Slf4j
@Component
public class JobStateMachine {

    private final Map<JobState, Set<JobState>> validTransitions = new EnumMap<>(JobState.class);

    public JobStateMachine() {
        validTransitions.put(JobState.QUEUED, EnumSet.of(JobState.RUNNING, JobState.FAILED));
        validTransitions.put(JobState.RUNNING, EnumSet.of(JobState.COMPLETE, JobState.FAILED));
        validTransitions.put(JobState.COMPLETE, EnumSet.noneOf(JobState.class));
        validTransitions.put(JobState.FAILED, EnumSet.noneOf(JobState.class));
    }

    /**
     * Same state counts as valid (idempotent).
     */
    public boolean isValidTransition(@NonNull JobState currentState, @NonNull JobState newState) {
        if (currentState == newState) {
            return true;
        }
        return validTransitions.get(currentState).contains(newState);
    }

    /**
     * Move {@code job} to {@code newState} if allowed.
     *
     * @return true if the job is now in {@code newState}
     */
    public boolean transition(@NonNull AcquisitionJob job, @NonNull JobState newState) {
        JobState current = job.getState();
        if (!isValidTransition(current, newState)) {
            log.warn("Job {} invalid state transition attempted: {} → {} (rejected)", job.getId(), current, newState);
            return false;
        }
        if (current != newState) {
            log.debug("Job {} state transition: {} → {}", job.getId(), current, newState);
            job.setState(newState);
        }
        return true;
    }
}
