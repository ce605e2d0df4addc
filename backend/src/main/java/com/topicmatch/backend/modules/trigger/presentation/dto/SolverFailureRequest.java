package com.topicmatch.backend.modules.trigger.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code hash} signs the error string.
 */
public record SolverFailureRequest(
        @NotBlank(message = "ERROR_REQUIRED")
        String error,
        @NotBlank(message = "HASH_REQUIRED")
        String hash
) {
}
