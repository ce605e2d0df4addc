package com.topicmatch.backend.modules.assignment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record CurrentBatchResponse(
        UUID periodId,
        String batchId,
        OffsetDateTime assignedAt,
        List<TopicGroup> topics
) {

    public record TopicGroup(
            UUID topicId,
            String title,
            List<AssignedStudent> students
    ) {
    }

    public record AssignedStudent(
            String studentId,
            Integer originalRank
    ) {
    }
}
