package com.topicmatch.backend.modules.preference.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Boolean answers are sent as 0/1 or true/false; scale answers as a value in [0, maxScale].
 */
public record SaveAnswersRequest(
        @NotEmpty(message = "ANSWERS_REQUIRED")
        List<@Valid AnswerEntry> answers
) {

    public record AnswerEntry(
            @NotNull(message = "QUESTION_ID_REQUIRED")
            UUID questionId,
            @NotNull(message = "VALUE_REQUIRED")
            Object value
    ) {
    }
}
