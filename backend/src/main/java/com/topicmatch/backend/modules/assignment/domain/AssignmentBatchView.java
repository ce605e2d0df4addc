package com.topicmatch.backend.modules.assignment.domain;

import java.time.OffsetDateTime;

public interface AssignmentBatchView {

    String getBatchId();

    OffsetDateTime getAssignedAt();

    long getAssignmentCount();
}
