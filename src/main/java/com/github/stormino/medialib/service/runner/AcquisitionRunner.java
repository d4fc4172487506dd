package com.github.stormino.medialib.service.runner;

import com.github.stormino.medialib.model.AttemptOutcome;

import java.util.Optional;

/**
 * Runs one rung of the strategy ladder against the external extraction tool.
 */
public interface AcquisitionRunner {

    /**
     * Run the tool once and classify the result. Blocks until the tool exits or times out.
     * Progress and title are pushed to the request's callback while the tool runs.
     *
     * @param request Attempt to run
     * @return Outcome; never null and never thrown
     */
    AttemptOutcome run(AttemptRequest request);

    /**
     * Version string the tool reports, empty if it cannot be executed.
     */
    Optional<String> toolVersion();
}
