package com.topicmatch.backend.modules.job.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        UUID jobId,
        UUID periodId,
        String kind,
        String status,
        String error,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        long ageSeconds,
        boolean stale,
        String materializationStatus,
        String materializationError,
        String batchId
) {
}
