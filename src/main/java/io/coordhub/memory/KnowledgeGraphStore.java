package io.coordhub.memory;

import io.coordhub.error.CoordinationException;
import io.coordhub.model.MemoryEntity;
import io.coordhub.model.MemoryRelation;
import io.coordhub.model.RelationType;
import io.coordhub.util.Ids;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entities keyed by name plus the typed edges between them. Deleting an entity drops every edge that touches it.
 *
 * <p>Not thread-safe: the owning runtime serializes access.
 */
public final class KnowledgeGraphStore {
    private final Map<String, MemoryEntity> entities = new LinkedHashMap<>();
    private final Map<String, MemoryRelation> relations = new LinkedHashMap<>();
    private final Clock clock;

    public KnowledgeGraphStore(Clock clock) {
        this.clock = clock;
    }

    public MemoryEntity createEntity(String name, String entityType, List<String> observations, Map<String, Object> metadata) {
        if (entities.containsKey(name)) {
            throw CoordinationException.conflict("Entity already exists: " + name);
        }
        MemoryEntity entity = MemoryEntity.create(name, entityType, observations, metadata, clock.instant());
        entities.put(name, entity);
        return entity;
    }

    public MemoryEntity updateEntity(String name, List<String> observations, Map<String, Object> metadata) {
        MemoryEntity current = entities.get(name);
        if (current == null) {
            throw CoordinationException.notFound("Entity not found: " + name);
        }
        MemoryEntity updated = current.withUpdate(observations, metadata, clock.instant());
        entities.put(name, updated);
        return updated;
    }

    public MemoryRelation createRelation(
            String from,
            String to,
            RelationType relationType,
            Double strength,
            Map<String, Object> metadata
    ) {
        if (!entities.containsKey(from)) {
            throw CoordinationException.notFound("Entity not found: " + from);
        }
        if (!entities.containsKey(to)) {
            throw CoordinationException.notFound("Entity not found: " + to);
        }
        MemoryRelation relation = new MemoryRelation(
                Ids.relationId(),
                from,
                to,
                relationType,
                strength == null ? MemoryRelation.DEFAULT_STRENGTH : strength,
                metadata,
                clock.instant()
        );
        relations.put(relation.id(), relation);
        return relation;
    }

    /**
     * Filters, then truncates to {@code query.limit()}. {@code totalResults} is the truncated count.
     */
    public SearchOutcome search(MemoryQuery query) {
        String nameNeedle = lower(query.entityName());
        String observationNeedle = lower(query.observations());
        List<MemoryEntity> matched = new ArrayList<>();
        for (MemoryEntity entity : entities.values()) {
            if (nameNeedle != null && !entity.name().toLowerCase(Locale.ROOT).contains(nameNeedle)) {
                continue;
            }
            if (query.entityType() != null && !query.entityType().equals(entity.entityType())) {
                continue;
            }
            if (observationNeedle != null && !entity.observationContains(observationNeedle)) {
                continue;
            }
            matched.add(entity);
        }
        int limit = Math.max(0, query.limit());
        List<MemoryEntity> page = matched.size() > limit ? new ArrayList<>(matched.subList(0, limit)) : matched;
        return new SearchOutcome(page, relationsTouchingAny(page), page.size());
    }

    public EntityView getEntity(String name) {
        MemoryEntity entity = entities.get(name);
        if (entity == null) {
            return new EntityView(null, List.of());
        }
        return new EntityView(entity, relationsTouching(name));
    }

    public boolean deleteEntity(String name) {
        if (entities.remove(name) == null) {
            return false;
        }
        Iterator<MemoryRelation> it = relations.values().iterator();
        while (it.hasNext()) {
            if (it.next().touches(name)) {
                it.remove();
            }
        }
        return true;
    }

    public Map<String, MemoryEntity> entitySnapshot() {
        return new LinkedHashMap<>(entities);
    }

    public Map<String, MemoryRelation> relationSnapshot() {
        return new LinkedHashMap<>(relations);
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationCount() {
        return relations.size();
    }

    private List<MemoryRelation> relationsTouching(String name) {
        List<MemoryRelation> out = new ArrayList<>();
        for (MemoryRelation relation : relations.values()) {
            if (relation.touches(name)) {
                out.add(relation);
            }
        }
        return out;
    }

    private List<MemoryRelation> relationsTouchingAny(List<MemoryEntity> page) {
        List<MemoryRelation> out = new ArrayList<>();
        for (MemoryRelation relation : relations.values()) {
            for (MemoryEntity entity : page) {
                if (relation.touches(entity.name())) {
                    out.add(relation);
                    break;
                }
            }
        }
        return out;
    }

    private static String lower(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return raw.toLowerCase(Locale.ROOT);
    }

    public record SearchOutcome(List<MemoryEntity> entities, List<MemoryRelation> relations, int totalResults) {
    }

    public record EntityView(MemoryEntity entity, List<MemoryRelation> relations) {
    }
}
