package com.topicmatch.backend.modules.job.domain;

public enum DeferredJobStatus {
    PENDING,
    COMPLETED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
