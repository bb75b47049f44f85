package io.coordhub.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of operations reachable through {@link MethodDispatcher}. Each constant carries the catalogue entry
 * returned by {@code list_methods}.
 */
public enum CoordinationMethod {
    REGISTER("register", true, "Register or re-register an instance",
            List.of("instance.id", "instance.kind", "instance.status", "instance.capabilities"),
            List.of("instance.metadata")),
    HEARTBEAT("heartbeat", true, "Refresh instance status and liveness",
            List.of("instanceId", "status"), List.of("metadata")),
    UNREGISTER("unregister", true, "Remove an instance and release its resource claims",
            List.of("instanceId"), List.of()),
    LIST_INSTANCES("list_instances", false, "List instances, optionally filtered",
            List.of(), List.of("kind", "status")),
    ASSIGN_TASK("assign_task", true, "Assign a task to a registered instance",
            List.of("task.kind", "task.assignedTo", "task.assignedBy"),
            List.of("task.issueNumber", "task.pullRequestNumber", "task.metadata")),
    UPDATE_TASK_STATUS("update_task_status", true, "Set task status and merge metadata",
            List.of("taskId", "status"), List.of("metadata")),
    GET_TASK("get_task", false, "Fetch one task or null",
            List.of("taskId"), List.of()),
    LIST_TASKS("list_tasks", false, "List tasks, optionally filtered",
            List.of(), List.of("assignedTo", "assignedBy", "status", "kind")),
    REQUEST_DEVELOPER("request_developer", true, "Assign an issue to the first available developer",
            List.of("issueNumber"), List.of("priority", "requirements")),
    CLAIM_RESOURCE("claim_resource", true, "Claim a branch, file, issue or pr for an instance",
            List.of("resourceKind", "resourceId", "instanceId", "operation"), List.of()),
    RELEASE_RESOURCE("release_resource", true, "Release an instance's claim on a resource",
            List.of("resourceKind", "resourceId", "instanceId"), List.of()),
    MEMORY_CREATE_ENTITY("memory.create_entity", true, "Create a knowledge graph entity",
            List.of("name", "entityType", "observations"), List.of("metadata")),
    MEMORY_UPDATE_ENTITY("memory.update_entity", true, "Append observations and merge metadata",
            List.of("name"), List.of("observations", "metadata")),
    MEMORY_CREATE_RELATION("memory.create_relation", true, "Create a typed relation between two entities",
            List.of("from", "to", "relationType"), List.of("strength", "metadata")),
    MEMORY_SEARCH_ENTITIES("memory.search_entities", false, "Search entities by name, type or observation text",
            List.of(), List.of("entityName", "entityType", "observations", "limit")),
    MEMORY_GET_ENTITY("memory.get_entity", false, "Fetch one entity with its relations",
            List.of("name"), List.of()),
    MEMORY_DELETE_ENTITY("memory.delete_entity", true, "Delete an entity and every relation touching it",
            List.of("name"), List.of()),
    GET_STATS("get_stats", false, "Aggregate counts and uptime",
            List.of(), List.of()),
    GET_STATE("get_state", false, "Full dump of instances, tasks and resources",
            List.of(), List.of()),
    LIST_METHODS("list_methods", false, "Method catalogue",
            List.of(), List.of());

    private static final String LEGACY_PREFIX = "selfie.";

    private final String wireName;
    private final boolean mutating;
    private final String description;
    private final List<String> requiredParams;
    private final List<String> optionalParams;

    CoordinationMethod(
            String wireName,
            boolean mutating,
            String description,
            List<String> requiredParams,
            List<String> optionalParams
    ) {
        this.wireName = wireName;
        this.mutating = mutating;
        this.description = description;
        this.requiredParams = requiredParams;
        this.optionalParams = optionalParams;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean mutating() {
        return mutating;
    }

    public String description() {
        return description;
    }

    public List<String> requiredParams() {
        return requiredParams;
    }

    public List<String> optionalParams() {
        return optionalParams;
    }

    /**
     * Resolves {@code memory.create_entity}, the tool-style {@code memory_create_entity} and the legacy
     * {@code selfie.}-prefixed names to the same constant.
     */
    public static Optional<CoordinationMethod> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String name = raw.trim().toLowerCase(Locale.ROOT);
        if (name.startsWith(LEGACY_PREFIX)) {
            name = name.substring(LEGACY_PREFIX.length());
        }
        for (CoordinationMethod value : values()) {
            if (value.wireName.equals(name) || value.wireName.replace('.', '_').equals(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
