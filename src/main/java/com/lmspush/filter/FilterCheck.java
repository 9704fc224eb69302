package com.lmspush.filter;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four rule checks, in evaluation order.
 */
public enum FilterCheck {
    CONTENT_TYPE("content_type"),
    GRADE_THRESHOLD("grade_threshold"),
    REQUIRED_TAGS("required_tags"),
    LEARNER_GROUP("learner_group");

    private final String value;

    FilterCheck(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
