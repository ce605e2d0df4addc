package com.topicmatch.backend.modules.trigger.infrastructure.solver;

/**
 * Boundary to the external optimizer. Submission only hands the job over; the result arrives later
 * through the completion callback.
 */
public interface SolverClient {

    /**
     * @throws SolverSubmissionException when the solver did not accept the job
     */
    void submit(SolverSubmission submission);
}
