package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum InstanceStatus {
    IDLE("idle"),
    BUSY("busy"),
    OFFLINE("offline");

    private final String wireName;

    InstanceStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<InstanceStatus> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (InstanceStatus value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static InstanceStatus fromString(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown instance status: " + raw));
    }
}
