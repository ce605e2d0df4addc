package com.topicmatch.backend.modules.solver.domain;

import java.util.List;
import java.util.UUID;

/**
 * Solver request plus the index maps needed to translate results back:
 * {@code studentIds.get(i)} is solver student {@code i}, {@code topicIds.get(g)} is solver group {@code g}.
 */
public record CompiledRequest(
        SolverRequest request,
        List<String> studentIds,
        List<UUID> topicIds,
        List<String> studentsWithoutData
) {

    public CompiledRequest {
        studentIds = List.copyOf(studentIds);
        topicIds = List.copyOf(topicIds);
        studentsWithoutData = List.copyOf(studentsWithoutData);
    }
}
