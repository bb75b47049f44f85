package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum RelationType {
    RELATES_TO("relates_to"),
    CAUSED_BY("caused_by"),
    ENABLES("enables"),
    CONTRADICTS("contradicts"),
    SUPPORTS("supports"),
    IMPLEMENTS("implements"),
    DEPENDS_ON("depends_on");

    private final String wireName;

    RelationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<RelationType> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (RelationType value : values()) {
            if (value.wireName.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static RelationType fromString(String raw) {
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown relation type: " + raw));
    }
}
