package com.topicmatch.backend.modules.preference.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AnswerResponse(
        UUID questionId,
        String kind,
        double rawValue,
        double normalizedAnswer,
        OffsetDateTime answeredAt
) {
}
