package com.qrl.review.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    KEYWORD("keyword"),
    EMBEDDING("embedding");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
