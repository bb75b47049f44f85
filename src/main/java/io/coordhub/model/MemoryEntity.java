package io.coordhub.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Named fact record in the knowledge graph. Observations are append-only and never repeat.
 */
public record MemoryEntity(
        String name,
        String entityType,
        List<String> observations,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt,
        long version
) {
    public MemoryEntity {
        observations = observations == null ? List.of() : List.copyOf(observations);
        metadata = Metadata.copyOf(metadata);
    }

    public static MemoryEntity create(
            String name,
            String entityType,
            List<String> observations,
            Map<String, Object> metadata,
            Instant now
    ) {
        return new MemoryEntity(name, entityType, appendDistinct(List.of(), observations), metadata, now, now, 1L);
    }

    public MemoryEntity withUpdate(List<String> newObservations, Map<String, Object> metadataPatch, Instant now) {
        return new MemoryEntity(
                name,
                entityType,
                appendDistinct(observations, newObservations),
                Metadata.merge(metadata, metadataPatch),
                createdAt,
                now,
                version + 1L
        );
    }

    public boolean observationContains(String lowerCaseText) {
        for (String observation : observations) {
            if (observation.toLowerCase(Locale.ROOT).contains(lowerCaseText)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> appendDistinct(List<String> existing, List<String> additions) {
        List<String> out = new ArrayList<>(existing);
        if (additions == null) {
            return out;
        }
        for (String observation : additions) {
            if (observation != null && !out.contains(observation)) {
                out.add(observation);
            }
        }
        return out;
    }
}
