package io.coordhub.task;

import io.coordhub.error.CoordinationException;
import io.coordhub.model.Instance;
import io.coordhub.model.Priority;
import io.coordhub.model.TaskAssignment;
import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskSpecification;
import io.coordhub.model.TaskStatus;
import io.coordhub.registry.InstanceRegistry;
import io.coordhub.util.Ids;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative record of task assignments. Tasks are never removed.
 *
 * <p>Status updates do not check transition order: any status may follow any other, including leaving
 * {@code completed}. Callers that need a stricter lifecycle enforce it themselves.
 *
 * <p>Not thread-safe: the owning runtime serializes access.
 */
public final class TaskLedger {
    public static final String SYSTEM_ASSIGNER = "system";

    private final Map<String, TaskAssignment> tasks = new LinkedHashMap<>();
    private final InstanceRegistry registry;
    private final Clock clock;

    public TaskLedger(InstanceRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public TaskAssignment assign(NewTask input) {
        if (input == null || input.kind() == null) {
            throw CoordinationException.validation("task.kind is required");
        }
        if (isBlank(input.assignedTo())) {
            throw CoordinationException.validation("task.assignedTo is required");
        }
        if (isBlank(input.assignedBy())) {
            throw CoordinationException.validation("task.assignedBy is required");
        }
        // Checked at creation only; the assignee may unregister later.
        if (!registry.contains(input.assignedTo())) {
            throw CoordinationException.notFound("Assigned instance not found: " + input.assignedTo());
        }
        Instant now = clock.instant();
        TaskAssignment task = new TaskAssignment(
                Ids.taskId(),
                input.kind(),
                input.assignedTo(),
                input.assignedBy(),
                TaskStatus.PENDING,
                now,
                now,
                input.metadata(),
                input.issueNumber(),
                input.pullRequestNumber(),
                input.specification()
        );
        tasks.put(task.id(), task);
        return task;
    }

    public TaskAssignment updateStatus(String taskId, TaskStatus status, Map<String, Object> metadata) {
        TaskAssignment current = tasks.get(taskId);
        if (current == null) {
            throw CoordinationException.notFound("Task not found: " + taskId);
        }
        TaskAssignment updated = current.withStatus(status, metadata, clock.instant());
        tasks.put(taskId, updated);
        return updated;
    }

    public Optional<TaskAssignment> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public List<TaskAssignment> list(TaskFilter filter) {
        TaskFilter effective = filter == null ? TaskFilter.all() : filter;
        List<TaskAssignment> out = new ArrayList<>();
        for (TaskAssignment task : tasks.values()) {
            if (effective.matches(task)) {
                out.add(task);
            }
        }
        return out;
    }

    /**
     * Picks the first available developer and assigns it a develop task for the issue. Returns an empty outcome,
     * not an error, when nobody has capacity.
     */
    public DeveloperRequestOutcome requestDeveloper(
            int issueNumber,
            Priority priority,
            List<String> requirements,
            String requiredCapability,
            long livenessTimeoutMs
    ) {
        List<Instance> candidates = registry.findAvailable(requiredCapability, List.of(), livenessTimeoutMs);
        if (candidates.isEmpty()) {
            return DeveloperRequestOutcome.noCapacity();
        }
        Instance selected = candidates.get(0);
        TaskSpecification specification = new TaskSpecification(
                "Issue #" + issueNumber,
                "Development task requested for issue #" + issueNumber,
                requirements,
                List.of(),
                priority
        );
        TaskAssignment task = assign(new NewTask(
                TaskKind.DEVELOP,
                selected.id(),
                SYSTEM_ASSIGNER,
                issueNumber,
                null,
                Map.of(),
                specification
        ));
        return new DeveloperRequestOutcome(task.id(), selected.id(), task.createdAt(), task);
    }

    public Map<String, TaskAssignment> snapshot() {
        return new LinkedHashMap<>(tasks);
    }

    public int size() {
        return tasks.size();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record DeveloperRequestOutcome(String taskId, String assignedTo, Instant estimatedStart, TaskAssignment task) {
        static DeveloperRequestOutcome noCapacity() {
            return new DeveloperRequestOutcome("", null, null, null);
        }

        public boolean assigned() {
            return assignedTo != null;
        }
    }
}
