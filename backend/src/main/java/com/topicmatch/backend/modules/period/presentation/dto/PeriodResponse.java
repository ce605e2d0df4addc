package com.topicmatch.backend.modules.period.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PeriodResponse(
        UUID periodId,
        String title,
        String description,
        OffsetDateTime openDate,
        OffsetDateTime closeDate,
        boolean active,
        String status
) {
}
