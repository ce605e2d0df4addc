package com.topicmatch.backend.modules.solver.presentation.dto;

import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * All fields optional. Without {@code groupSizes} students are split evenly over the active topics.
 */
public record AssignmentPreviewRequest(
        Map<UUID, @NotNull @PositiveOrZero Integer> groupSizes,
        Double rankingPercentage,
        Integer maxTimeSeconds
) {
}
