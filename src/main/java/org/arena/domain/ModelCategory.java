package org.arena.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelCategory {
    TEXT("text"),
    VISION("vision"),
    IMAGE("image");

    private final String value;

    ModelCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
