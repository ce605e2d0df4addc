package com.topicmatch.backend.modules.trigger.infrastructure.solver;

import java.util.Map;
import java.util.UUID;

/**
 * Body of {@code POST /solve}. The solver echoes {@code deferredId} back in its callback.
 */
public record SolverSubmission(
        UUID deferredId,
        String callbackUrl,
        Map<String, Object> input
) {
}
