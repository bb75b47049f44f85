package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum InstanceKind {
    INITIALIZER("initializer"),
    DEVELOPER("developer"),
    REVIEWER("reviewer"),
    TESTER("tester");

    private final String wireName;

    InstanceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<InstanceKind> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (InstanceKind value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static InstanceKind fromString(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown instance kind: " + raw));
    }
}
