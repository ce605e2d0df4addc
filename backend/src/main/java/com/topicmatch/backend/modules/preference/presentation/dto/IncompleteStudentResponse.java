package com.topicmatch.backend.modules.preference.presentation.dto;

public record IncompleteStudentResponse(
        String studentId,
        int answeredCount,
        int requiredCount
) {
}
