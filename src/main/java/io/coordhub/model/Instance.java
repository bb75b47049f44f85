package io.coordhub.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A registered worker. Immutable; heartbeats replace the registry entry with {@link #withHeartbeat}.
 */
public record Instance(
        String id,
        InstanceKind kind,
        InstanceStatus status,
        Set<String> capabilities,
        Map<String, Object> metadata,
        Instant lastSeen
) {
    public Instance {
        capabilities = capabilities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        metadata = Metadata.copyOf(metadata);
    }

    public Instance withHeartbeat(InstanceStatus nextStatus, Map<String, Object> metadataPatch, Instant now) {
        return new Instance(id, kind, nextStatus, capabilities, Metadata.merge(metadata, metadataPatch), now);
    }

    public boolean hasCapability(String capability) {
        return capability != null && capabilities.contains(capability);
    }

    public boolean seenWithin(long timeoutMs, Instant now) {
        if (timeoutMs <= 0L) {
            return true;
        }
        return lastSeen != null && now.toEpochMilli() - lastSeen.toEpochMilli() < timeoutMs;
    }
}
