package com.topicmatch.backend.modules.trigger.presentation.dto;

import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Without {@code groupSizes} students are split evenly over the active topics. {@code override} allows a run
 * while the period is still upcoming or open.
 */
public record AssignNowRequest(
        Map<UUID, @NotNull @PositiveOrZero Integer> groupSizes,
        Double rankingPercentage,
        Integer maxTimeSeconds,
        boolean override
) {

    public static AssignNowRequest defaults() {
        return new AssignNowRequest(null, null, null, false);
    }
}
