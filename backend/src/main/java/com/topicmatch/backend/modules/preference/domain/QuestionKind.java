package com.topicmatch.backend.modules.preference.domain;

public enum QuestionKind {
    BOOLEAN,
    SCALE
}
