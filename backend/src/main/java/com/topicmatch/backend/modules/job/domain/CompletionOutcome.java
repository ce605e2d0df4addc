package com.topicmatch.backend.modules.job.domain;

/**
 * Result of a completion attempt. Only {@link #COMPLETED} may lead to materialization.
 */
public enum CompletionOutcome {
    /** First completion of a pending job. */
    COMPLETED,
    /** Repeated delivery of the result already stored. */
    DUPLICATE,
    /** A different result for a job that already completed; the stored one is kept. */
    CONFLICTING,
    /** The job failed or was abandoned before the result arrived. */
    IGNORED;

    public boolean isFirstCompletion() {
        return this == COMPLETED;
    }
}
