package com.topicmatch.backend.modules.assignment.presentation.dto;

import java.time.OffsetDateTime;

public record BatchSummaryResponse(
        String batchId,
        OffsetDateTime assignedAt,
        long assignmentCount,
        boolean current
) {
}
