package com.topicmatch.backend.modules.constraint.presentation.dto;

import com.topicmatch.backend.modules.constraint.domain.CriterionType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code minRatio} is a percentage (0-100).
 */
public record CreateConstraintRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 120, message = "NAME_TOO_LONG")
        String name,
        String description,
        CriterionType criterionType,
        Double minRatio,
        Integer minStudents,
        Integer maxStudents
) {
}
