package com.topicmatch.backend.modules.constraint.presentation.dto;

import com.topicmatch.backend.modules.constraint.domain.CriterionType;

import jakarta.validation.constraints.Size;

public record UpdateConstraintRequest(
        @Size(max = 120, message = "NAME_TOO_LONG")
        String name,
        String description,
        CriterionType criterionType,
        Double minRatio,
        Integer minStudents,
        Integer maxStudents,
        boolean clearCriterion
) {
}
