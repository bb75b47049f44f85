package io.coordhub.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordhub.error.CoordinationException;
import io.coordhub.model.InstanceKind;
import io.coordhub.model.InstanceStatus;
import io.coordhub.model.Priority;
import io.coordhub.model.RelationType;
import io.coordhub.model.ResourceKind;
import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskStatus;
import io.coordhub.runtime.CoordHubRuntime;
import io.coordhub.task.NewTask;
import io.coordhub.task.TaskFilter;
import io.coordhub.util.Jsons;
import io.coordhub.validation.PayloadValidator;
import io.coordhub.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for the method surface: resolves the name, validates the payload, converts it to typed
 * arguments and calls the runtime. Results are plain records ready for JSON encoding.
 *
 * <p>Resource-claim contention is a normal result ({@code claimed: false}), never an exception. Every other
 * failure is a {@link CoordinationException}; nothing is retried here.
 */
public final class MethodDispatcher {
    private final CoordHubRuntime runtime;

    public MethodDispatcher(CoordHubRuntime runtime) {
        this.runtime = runtime;
    }

    public Object dispatch(String methodName, JsonNode params) {
        try {
            CoordinationMethod method = CoordinationMethod.find(methodName)
                    .orElseThrow(() -> CoordinationException.unknownMethod(methodName));
            ValidationResult validation = PayloadValidator.validate(method, params);
            if (!validation.valid()) {
                throw CoordinationException.validation("Invalid parameters: " + validation.message());
            }
            return invoke(method, params == null ? Jsons.mapper().createObjectNode() : params);
        } catch (CoordinationException e) {
            runtime.recordRejection(methodName, e);
            throw e;
        }
    }

    public static List<MethodDescriptor> catalogue() {
        List<MethodDescriptor> out = new ArrayList<>();
        for (CoordinationMethod method : CoordinationMethod.values()) {
            out.add(new MethodDescriptor(
                    method.wireName(),
                    method.description(),
                    method.mutating(),
                    method.requiredParams(),
                    method.optionalParams()
            ));
        }
        return out;
    }

    private Object invoke(CoordinationMethod method, JsonNode p) {
        return switch (method) {
            case REGISTER -> {
                JsonNode instance = p.path("instance");
                yield runtime.register(new CoordHubRuntime.RegisterRequest(
                        instance.path("id").asText(),
                        InstanceKind.fromString(instance.path("kind").asText()),
                        InstanceStatus.fromString(instance.path("status").asText()),
                        strings(instance.path("capabilities")),
                        metadata(instance.path("metadata"))
                ));
            }
            case HEARTBEAT -> runtime.heartbeat(
                    p.path("instanceId").asText(),
                    InstanceStatus.fromString(p.path("status").asText()),
                    metadata(p.path("metadata"))
            );
            case UNREGISTER -> runtime.unregister(p.path("instanceId").asText());
            case LIST_INSTANCES -> runtime.listInstances(
                    text(p, "kind") == null ? null : InstanceKind.fromString(text(p, "kind")),
                    text(p, "status") == null ? null : InstanceStatus.fromString(text(p, "status"))
            );
            case ASSIGN_TASK -> {
                JsonNode task = p.path("task");
                yield runtime.assignTask(new NewTask(
                        TaskKind.fromString(task.path("kind").asText()),
                        task.path("assignedTo").asText(),
                        task.path("assignedBy").asText(),
                        integer(task, "issueNumber"),
                        integer(task, "pullRequestNumber"),
                        metadata(task.path("metadata")),
                        null
                ));
            }
            case UPDATE_TASK_STATUS -> runtime.updateTaskStatus(
                    p.path("taskId").asText(),
                    TaskStatus.fromString(p.path("status").asText()),
                    metadata(p.path("metadata"))
            );
            case GET_TASK -> runtime.getTask(p.path("taskId").asText());
            case LIST_TASKS -> runtime.listTasks(new TaskFilter(
                    text(p, "assignedTo"),
                    text(p, "assignedBy"),
                    text(p, "status") == null ? null : TaskStatus.fromString(text(p, "status")),
                    text(p, "kind") == null ? null : TaskKind.fromString(text(p, "kind"))
            ));
            case REQUEST_DEVELOPER -> runtime.requestDeveloper(
                    p.path("issueNumber").asInt(),
                    Priority.fromString(text(p, "priority")),
                    strings(p.path("requirements"))
            );
            case CLAIM_RESOURCE -> runtime.claimResource(
                    ResourceKind.fromString(p.path("resourceKind").asText()),
                    p.path("resourceId").asText(),
                    p.path("instanceId").asText(),
                    p.path("operation").asText()
            );
            case RELEASE_RESOURCE -> runtime.releaseResource(
                    ResourceKind.fromString(p.path("resourceKind").asText()),
                    p.path("resourceId").asText(),
                    p.path("instanceId").asText()
            );
            case MEMORY_CREATE_ENTITY -> runtime.createEntity(
                    p.path("name").asText(),
                    p.path("entityType").asText(),
                    strings(p.path("observations")),
                    metadata(p.path("metadata"))
            );
            case MEMORY_UPDATE_ENTITY -> runtime.updateEntity(
                    p.path("name").asText(),
                    strings(p.path("observations")),
                    metadata(p.path("metadata"))
            );
            case MEMORY_CREATE_RELATION -> runtime.createRelation(
                    p.path("from").asText(),
                    p.path("to").asText(),
                    RelationType.fromString(p.path("relationType").asText()),
                    p.path("strength").isNumber() ? p.path("strength").asDouble() : null,
                    metadata(p.path("metadata"))
            );
            case MEMORY_SEARCH_ENTITIES -> runtime.searchEntities(
                    text(p, "entityName"),
                    text(p, "entityType"),
                    text(p, "observations"),
                    integer(p, "limit")
            );
            case MEMORY_GET_ENTITY -> runtime.getEntity(p.path("name").asText());
            case MEMORY_DELETE_ENTITY -> runtime.deleteEntity(p.path("name").asText());
            case GET_STATS -> runtime.stats();
            case GET_STATE -> runtime.state();
            case LIST_METHODS -> Map.of("methods", catalogue());
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isIntegralNumber() ? value.asInt() : null;
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return out;
        }
        for (JsonNode item : array) {
            out.add(item.asText());
        }
        return out;
    }

    private static Map<String, Object> metadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(node, Jsons.MAP_TYPE);
    }

    public record MethodDescriptor(
            String name,
            String description,
            boolean mutating,
            List<String> required,
            List<String> optional
    ) {
    }
}
