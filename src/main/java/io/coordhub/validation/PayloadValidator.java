package io.coordhub.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.coordhub.dispatch.CoordinationMethod;
import io.coordhub.model.InstanceKind;
import io.coordhub.model.InstanceStatus;
import io.coordhub.model.Priority;
import io.coordhub.model.RelationType;
import io.coordhub.model.ResourceKind;
import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Shape checks for method payloads. Runs before any state is touched and never throws; every problem found is
 * reported so a caller can fix them in one round trip.
 */
public final class PayloadValidator {
    private PayloadValidator() {
    }

    public static ValidationResult validate(CoordinationMethod method, JsonNode params) {
        List<String> errors = new ArrayList<>();
        if (params != null && !params.isNull() && !params.isMissingNode() && !params.isObject()) {
            errors.add("params must be an object");
            return new ValidationResult(errors);
        }
        JsonNode p = params == null ? MissingNode.getInstance() : params;
        switch (method) {
            case REGISTER -> {
                JsonNode instance = p.path("instance");
                if (!instance.isObject()) {
                    errors.add("instance is required");
                    break;
                }
                requireText(instance, "id", "instance.id", errors);
                requireEnum(instance, "kind", "instance.kind", InstanceKind::find, errors);
                requireEnum(instance, "status", "instance.status", InstanceStatus::find, errors);
                JsonNode capabilities = instance.path("capabilities");
                if (!capabilities.isArray() || capabilities.isEmpty()) {
                    errors.add("instance.capabilities must be a non-empty array");
                } else {
                    checkStringArray(capabilities, "instance.capabilities", errors);
                }
                optionalObject(instance, "metadata", "instance.metadata", errors);
            }
            case HEARTBEAT -> {
                requireText(p, "instanceId", "instanceId", errors);
                requireEnum(p, "status", "status", InstanceStatus::find, errors);
                optionalObject(p, "metadata", "metadata", errors);
            }
            case UNREGISTER -> requireText(p, "instanceId", "instanceId", errors);
            case LIST_INSTANCES -> {
                optionalEnum(p, "kind", "kind", InstanceKind::find, errors);
                optionalEnum(p, "status", "status", InstanceStatus::find, errors);
            }
            case ASSIGN_TASK -> {
                JsonNode task = p.path("task");
                if (!task.isObject()) {
                    errors.add("task is required");
                    break;
                }
                requireEnum(task, "kind", "task.kind", TaskKind::find, errors);
                requireText(task, "assignedTo", "task.assignedTo", errors);
                requireText(task, "assignedBy", "task.assignedBy", errors);
                optionalInt(task, "issueNumber", "task.issueNumber", errors);
                optionalInt(task, "pullRequestNumber", "task.pullRequestNumber", errors);
                optionalObject(task, "metadata", "task.metadata", errors);
            }
            case UPDATE_TASK_STATUS -> {
                requireText(p, "taskId", "taskId", errors);
                requireEnum(p, "status", "status", TaskStatus::find, errors);
                optionalObject(p, "metadata", "metadata", errors);
            }
            case GET_TASK -> requireText(p, "taskId", "taskId", errors);
            case LIST_TASKS -> {
                optionalText(p, "assignedTo", "assignedTo", errors);
                optionalText(p, "assignedBy", "assignedBy", errors);
                optionalEnum(p, "status", "status", TaskStatus::find, errors);
                optionalEnum(p, "kind", "kind", TaskKind::find, errors);
            }
            case REQUEST_DEVELOPER -> {
                if (!p.path("issueNumber").canConvertToInt() || !p.path("issueNumber").isIntegralNumber()) {
                    errors.add("issueNumber must be an integer");
                }
                JsonNode priority = p.path("priority");
                if (present(priority) && (!priority.isTextual() || !knownPriority(priority.asText()))) {
                    errors.add("priority must be one of high, medium, low");
                }
                JsonNode requirements = p.path("requirements");
                if (present(requirements)) {
                    if (!requirements.isArray()) {
                        errors.add("requirements must be an array");
                    } else {
                        checkStringArray(requirements, "requirements", errors);
                    }
                }
            }
            case CLAIM_RESOURCE -> {
                requireEnum(p, "resourceKind", "resourceKind", ResourceKind::find, errors);
                requireText(p, "resourceId", "resourceId", errors);
                requireText(p, "instanceId", "instanceId", errors);
                requireText(p, "operation", "operation", errors);
            }
            case RELEASE_RESOURCE -> {
                requireEnum(p, "resourceKind", "resourceKind", ResourceKind::find, errors);
                requireText(p, "resourceId", "resourceId", errors);
                requireText(p, "instanceId", "instanceId", errors);
            }
            case MEMORY_CREATE_ENTITY -> {
                requireText(p, "name", "name", errors);
                requireText(p, "entityType", "entityType", errors);
                JsonNode observations = p.path("observations");
                if (!observations.isArray()) {
                    errors.add("observations must be an array");
                } else {
                    checkStringArray(observations, "observations", errors);
                }
                optionalObject(p, "metadata", "metadata", errors);
            }
            case MEMORY_UPDATE_ENTITY -> {
                requireText(p, "name", "name", errors);
                JsonNode observations = p.path("observations");
                if (present(observations)) {
                    if (!observations.isArray()) {
                        errors.add("observations must be an array");
                    } else {
                        checkStringArray(observations, "observations", errors);
                    }
                }
                optionalObject(p, "metadata", "metadata", errors);
            }
            case MEMORY_CREATE_RELATION -> {
                requireText(p, "from", "from", errors);
                requireText(p, "to", "to", errors);
                requireEnum(p, "relationType", "relationType", RelationType::find, errors);
                JsonNode strength = p.path("strength");
                if (present(strength) && !strength.isNumber()) {
                    errors.add("strength must be a number");
                }
                optionalObject(p, "metadata", "metadata", errors);
            }
            case MEMORY_SEARCH_ENTITIES -> {
                optionalText(p, "entityName", "entityName", errors);
                optionalText(p, "entityType", "entityType", errors);
                optionalText(p, "observations", "observations", errors);
                JsonNode limit = p.path("limit");
                if (present(limit) && (!limit.isIntegralNumber() || !limit.canConvertToInt() || limit.asInt() < 1)) {
                    errors.add("limit must be a positive integer");
                }
            }
            case MEMORY_GET_ENTITY, MEMORY_DELETE_ENTITY -> requireText(p, "name", "name", errors);
            case GET_STATS, GET_STATE, LIST_METHODS -> {
                // No parameters.
            }
            default -> throw new IllegalStateException("Unhandled method: " + method);
        }
        return new ValidationResult(errors);
    }

    private static void requireText(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            errors.add(label + " is required");
        }
    }

    private static void optionalText(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.path(field);
        if (present(value) && !value.isTextual()) {
            errors.add(label + " must be a string");
        }
    }

    private static void requireEnum(
            JsonNode node,
            String field,
            String label,
            Function<String, Optional<?>> lookup,
            List<String> errors
    ) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            errors.add(label + " is required");
            return;
        }
        if (lookup.apply(value.asText()).isEmpty()) {
            errors.add(label + " has unsupported value: " + value.asText());
        }
    }

    private static void optionalEnum(
            JsonNode node,
            String field,
            String label,
            Function<String, Optional<?>> lookup,
            List<String> errors
    ) {
        JsonNode value = node.path(field);
        if (!present(value)) {
            return;
        }
        if (!value.isTextual() || lookup.apply(value.asText()).isEmpty()) {
            errors.add(label + " has unsupported value: " + value.asText());
        }
    }

    private static void optionalInt(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.path(field);
        if (present(value) && (!value.isIntegralNumber() || !value.canConvertToInt())) {
            errors.add(label + " must be an integer");
        }
    }

    private static void optionalObject(JsonNode node, String field, String label, List<String> errors) {
        JsonNode value = node.path(field);
        if (present(value) && !value.isObject()) {
            errors.add(label + " must be an object");
        }
    }

    private static void checkStringArray(JsonNode array, String label, List<String> errors) {
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                errors.add(label + " must contain only strings");
                return;
            }
        }
    }

    private static boolean knownPriority(String raw) {
        try {
            Priority.fromString(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean present(JsonNode value) {
        return value != null && !value.isMissingNode() && !value.isNull();
    }
}
