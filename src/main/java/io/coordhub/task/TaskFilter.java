package io.coordhub.task;

import io.coordhub.model.TaskAssignment;
import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskStatus;

/**
 * Conjunctive task filter; null fields match everything.
 */
public record TaskFilter(String assignedTo, String assignedBy, TaskStatus status, TaskKind kind) {
    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null);
    }

    public boolean matches(TaskAssignment task) {
        if (assignedTo != null && !assignedTo.equals(task.assignedTo())) {
            return false;
        }
        if (assignedBy != null && !assignedBy.equals(task.assignedBy())) {
            return false;
        }
        if (status != null && task.status() != status) {
            return false;
        }
        return kind == null || task.kind() == kind;
    }
}
