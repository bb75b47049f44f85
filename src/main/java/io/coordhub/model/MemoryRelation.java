package io.coordhub.model;

import java.time.Instant;
import java.util.Map;

public record MemoryRelation(
        String id,
        String from,
        String to,
        RelationType relationType,
        double strength,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public static final double DEFAULT_STRENGTH = 0.5d;

    public MemoryRelation {
        strength = clampStrength(strength);
        metadata = Metadata.copyOf(metadata);
    }

    public boolean touches(String entityName) {
        return from.equals(entityName) || to.equals(entityName);
    }

    public static double clampStrength(double raw) {
        if (Double.isNaN(raw)) {
            return DEFAULT_STRENGTH;
        }
        return Math.max(0.0d, Math.min(1.0d, raw));
    }
}
