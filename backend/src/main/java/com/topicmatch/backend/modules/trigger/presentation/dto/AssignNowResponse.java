package com.topicmatch.backend.modules.trigger.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssignNowResponse(
        UUID jobId,
        UUID periodId,
        String status,
        boolean submitted,
        String error,
        UUID supersededJobId,
        int numStudents,
        int numGroups,
        List<String> studentsWithoutData
) {
}
