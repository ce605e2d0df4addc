package com.topicmatch.backend.modules.assignment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record StudentAssignmentResponse(
        String studentId,
        UUID topicId,
        String topicTitle,
        String batchId,
        OffsetDateTime assignedAt,
        Integer originalRank,
        boolean wasPreference,
        boolean wasTopChoice
) {
}
