package io.coordhub.registry;

import io.coordhub.error.CoordinationException;
import io.coordhub.model.Instance;
import io.coordhub.model.InstanceKind;
import io.coordhub.model.InstanceStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered worker instances keyed by id, in registration order. Not thread-safe: the owning runtime
 * serializes access.
 */
public final class InstanceRegistry {
    private final Map<String, Instance> instances = new LinkedHashMap<>();
    private final Clock clock;

    public InstanceRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Inserts or overwrites the instance with this id. Re-registration keeps the original registry position.
     */
    public RegisterOutcome register(
            String id,
            InstanceKind kind,
            InstanceStatus status,
            Collection<String> capabilities,
            Map<String, Object> metadata
    ) {
        if (id == null || id.isBlank()) {
            throw CoordinationException.validation("instance.id is required");
        }
        if (kind == null || status == null) {
            throw CoordinationException.validation("instance.kind and instance.status are required");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw CoordinationException.validation("instance.capabilities must contain at least one entry");
        }
        Instance instance = new Instance(id, kind, status, new LinkedHashSet<>(capabilities), metadata, clock.instant());
        boolean existed = instances.containsKey(id);
        instances.put(id, instance);
        return new RegisterOutcome(instance, existed);
    }

    public Instance heartbeat(String id, InstanceStatus status, Map<String, Object> metadata) {
        Instance current = instances.get(id);
        if (current == null) {
            throw CoordinationException.notFound("Instance not found: " + id);
        }
        Instance updated = current.withHeartbeat(status, metadata, clock.instant());
        instances.put(id, updated);
        return updated;
    }

    public Optional<Instance> unregister(String id) {
        return Optional.ofNullable(instances.remove(id));
    }

    public Optional<Instance> get(String id) {
        return Optional.ofNullable(instances.get(id));
    }

    public boolean contains(String id) {
        return id != null && instances.containsKey(id);
    }

    public List<Instance> list(InstanceKind kind, InstanceStatus status) {
        List<Instance> out = new ArrayList<>();
        for (Instance instance : instances.values()) {
            if (kind != null && instance.kind() != kind) {
                continue;
            }
            if (status != null && instance.status() != status) {
                continue;
            }
            out.add(instance);
        }
        return out;
    }

    /**
     * Idle instances that declare {@code requiredCapability} and have been seen within {@code livenessTimeoutMs},
     * in registry order. The first element is the auto-assignment pick.
     */
    public List<Instance> findAvailable(String requiredCapability, Collection<String> excludeIds, long livenessTimeoutMs) {
        List<Instance> out = new ArrayList<>();
        for (Instance instance : instances.values()) {
            if (excludeIds != null && excludeIds.contains(instance.id())) {
                continue;
            }
            if (instance.status() != InstanceStatus.IDLE) {
                continue;
            }
            if (!instance.seenWithin(livenessTimeoutMs, clock.instant())) {
                continue;
            }
            if (!instance.hasCapability(requiredCapability)) {
                continue;
            }
            out.add(instance);
        }
        return out;
    }

    public Map<String, Instance> snapshot() {
        return new LinkedHashMap<>(instances);
    }

    public int size() {
        return instances.size();
    }

    public record RegisterOutcome(Instance instance, boolean reRegistered) {
    }
}
