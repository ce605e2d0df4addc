package com.topicmatch.backend.modules.preference.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record SavePreferenceRequest(
        @NotNull(message = "TOPIC_ORDER_REQUIRED")
        List<@NotNull UUID> topicOrder
) {
}
