package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum TaskKind {
    DEVELOP("develop", "development"),
    REVIEW("review", "code-review"),
    TEST("test", "testing");

    private final String wireName;
    private final String defaultCapability;

    TaskKind(String wireName, String defaultCapability) {
        this.wireName = wireName;
        this.defaultCapability = defaultCapability;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Capability an instance must declare to be picked for this kind of task when settings do not override it.
     */
    public String defaultCapability() {
        return defaultCapability;
    }

    public static Optional<TaskKind> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (TaskKind value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static TaskKind fromString(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown task kind: " + raw));
    }
}
