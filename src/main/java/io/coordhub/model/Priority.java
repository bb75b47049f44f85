package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
