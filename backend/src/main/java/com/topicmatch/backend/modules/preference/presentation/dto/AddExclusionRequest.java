package com.topicmatch.backend.modules.preference.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record AddExclusionRequest(
        @NotBlank(message = "STUDENT_ID_REQUIRED")
        String studentA,
        @NotBlank(message = "STUDENT_ID_REQUIRED")
        String studentB
) {
}
