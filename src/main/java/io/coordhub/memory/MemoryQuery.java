package io.coordhub.memory;

/**
 * Search criteria for {@link KnowledgeGraphStore#search(MemoryQuery)}. Null fields do not filter.
 *
 * @param entityName   case-insensitive substring of the entity name
 * @param entityType   exact, case-sensitive entity type
 * @param observations case-insensitive substring of any observation
 * @param limit        maximum number of entities returned; applied after filtering
 */
public record MemoryQuery(String entityName, String entityType, String observations, int limit) {
    public static MemoryQuery all(int limit) {
        return new MemoryQuery(null, null, null, limit);
    }
}
