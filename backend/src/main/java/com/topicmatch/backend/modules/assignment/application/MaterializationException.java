package com.topicmatch.backend.modules.assignment.application;

import org.springframework.http.HttpStatus;

import com.topicmatch.backend.global.error.ProblemException;

/**
 * The solver result cannot be turned into a complete batch. Nothing has been written when this is thrown.
 */
public class MaterializationException extends ProblemException {

    public MaterializationException(String code, String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
    }

    @Override
    public MaterializationException with(String key, Object value) {
        super.with(key, value);
        return this;
    }
}
