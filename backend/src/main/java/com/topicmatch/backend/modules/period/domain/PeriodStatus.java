package com.topicmatch.backend.modules.period.domain;

public enum PeriodStatus {
    UPCOMING,
    OPEN,
    CLOSED,
    ASSIGNED;

    public boolean acceptsAssignment() {
        return this == CLOSED || this == ASSIGNED;
    }
}
