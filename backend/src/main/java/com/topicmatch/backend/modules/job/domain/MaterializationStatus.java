package com.topicmatch.backend.modules.job.domain;

public enum MaterializationStatus {
    NOT_STARTED,
    MATERIALIZED,
    FAILED
}
