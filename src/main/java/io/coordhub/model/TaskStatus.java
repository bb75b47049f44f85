package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<TaskStatus> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (TaskStatus value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static TaskStatus fromString(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + raw));
    }
}
