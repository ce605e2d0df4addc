package com.topicmatch.backend.modules.constraint.presentation.dto;

import java.util.UUID;

import com.topicmatch.backend.modules.constraint.domain.CriterionType;

public record ConstraintResponse(
        UUID constraintId,
        UUID periodId,
        String name,
        String description,
        CriterionType criterionType,
        Double minRatio,
        Double minRatioPercent,
        Integer minStudents,
        Integer maxStudents
) {
}
