package com.topicmatch.backend.modules.trigger.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolverCallbackResponse(
        UUID jobId,
        String outcome,
        String batchId,
        String error
) {
}
