package com.topicmatch.backend.modules.period.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotNull;

public record UpdateCloseDateRequest(
        @NotNull(message = "CLOSE_DATE_REQUIRED")
        OffsetDateTime closeDate
) {
}
