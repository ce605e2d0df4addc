package com.topicmatch.backend.modules.trigger.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

record PreparedJob(
        UUID jobId,
        UUID periodId,
        Map<String, Object> input,
        UUID supersededJobId,
        int numStudents,
        int numGroups,
        List<String> studentsWithoutData
) {
}
