package io.coordhub.task;

import io.coordhub.model.TaskKind;
import io.coordhub.model.TaskSpecification;

import java.util.Map;

/**
 * Caller-supplied part of a task; id, status and timestamps are assigned by the ledger.
 */
public record NewTask(
        TaskKind kind,
        String assignedTo,
        String assignedBy,
        Integer issueNumber,
        Integer pullRequestNumber,
        Map<String, Object> metadata,
        TaskSpecification specification
) {
}
