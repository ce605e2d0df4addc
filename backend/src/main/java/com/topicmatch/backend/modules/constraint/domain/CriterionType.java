package com.topicmatch.backend.modules.constraint.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the solver treats a trait inside a group. The wire name is the lower-case form used in solver requests.
 */
public enum CriterionType {
    PREREQUISITE("prerequisite"),
    MINIMIZE("minimize"),
    PULL("pull"),
    MAXIMIZE("maximize"),
    PUSH("push");

    private final String wireName;

    CriterionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static CriterionType fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown criterion type: " + value));
    }
}
