package com.topicmatch.backend.modules.trigger.infrastructure.solver;

public class SolverSubmissionException extends RuntimeException {

    public SolverSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
