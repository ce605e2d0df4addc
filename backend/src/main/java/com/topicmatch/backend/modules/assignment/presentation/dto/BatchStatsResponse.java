package com.topicmatch.backend.modules.assignment.presentation.dto;

import java.util.Map;
import java.util.UUID;

/**
 * {@code rankDistribution} counts students per original rank; unranked students are counted in {@code unranked}.
 */
public record BatchStatsResponse(
        String batchId,
        int totalAssignments,
        int matchedPreferences,
        int topChoices,
        int unranked,
        Map<Integer, Long> rankDistribution,
        Map<UUID, Long> topicDistribution
) {
}
