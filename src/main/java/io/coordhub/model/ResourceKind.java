package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ResourceKind {
    BRANCH("branch"),
    FILE("file"),
    ISSUE("issue"),
    PR("pr");

    private final String wireName;

    ResourceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ResourceKind> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (ResourceKind value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static ResourceKind fromString(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown resource kind: " + raw));
    }
}
