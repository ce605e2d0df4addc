package com.topicmatch.backend.modules.trigger.presentation.dto;

import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SolverCallbackRequest(
        @NotNull(message = "DEFERRED_ID_REQUIRED")
        UUID deferredId,
        @NotBlank(message = "EVALUATION_ID_REQUIRED")
        String evaluationId,
        @NotNull(message = "DATA_REQUIRED")
        Map<String, Object> data,
        @NotBlank(message = "HASH_REQUIRED")
        String hash
) {
}
