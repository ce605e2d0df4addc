package com.topicmatch.backend.modules.preference.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

public record AddRosterRequest(
        @NotEmpty(message = "STUDENT_IDS_REQUIRED")
        List<@NotBlank String> studentIds
) {
}
