package com.topicmatch.backend.modules.job.domain;

public enum SolverKind {
    CPSAT,
    GA
}
