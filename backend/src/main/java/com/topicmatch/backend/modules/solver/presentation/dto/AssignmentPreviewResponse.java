package com.topicmatch.backend.modules.solver.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.presentation.dto.IncompleteStudentResponse;
import com.topicmatch.backend.modules.solver.domain.SolverRequest;

public record AssignmentPreviewResponse(
        UUID periodId,
        SolverRequest request,
        List<String> studentIds,
        List<UUID> topicIds,
        List<String> studentsWithoutData,
        List<IncompleteStudentResponse> incompleteStudents
) {
}
