package com.topicmatch.backend.modules.preference.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record PreferenceResponse(
        UUID periodId,
        String studentId,
        List<UUID> topicOrder,
        OffsetDateTime lastUpdated
) {
}
