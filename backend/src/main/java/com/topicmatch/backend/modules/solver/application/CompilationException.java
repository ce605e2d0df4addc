package com.topicmatch.backend.modules.solver.application;

import org.springframework.http.HttpStatus;

import com.topicmatch.backend.global.error.ProblemException;

/**
 * Raised before any job exists when the period's data cannot be turned into a solver request.
 */
public class CompilationException extends ProblemException {

    public CompilationException(String code, String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
    }

    @Override
    public CompilationException with(String key, Object value) {
        super.with(key, value);
        return this;
    }
}
