package io.coordhub.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * A unit of delegated work. {@code issueNumber}, {@code pullRequestNumber} and {@code specification} are optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskAssignment(
        String id,
        TaskKind kind,
        String assignedTo,
        String assignedBy,
        TaskStatus status,
        Instant createdAt,
        Instant updatedAt,
        Map<String, Object> metadata,
        Integer issueNumber,
        Integer pullRequestNumber,
        TaskSpecification specification
) {
    public TaskAssignment {
        metadata = Metadata.copyOf(metadata);
    }

    public TaskAssignment withStatus(TaskStatus nextStatus, Map<String, Object> metadataPatch, Instant now) {
        return new TaskAssignment(
                id,
                kind,
                assignedTo,
                assignedBy,
                nextStatus,
                createdAt,
                now,
                Metadata.merge(metadata, metadataPatch),
                issueNumber,
                pullRequestNumber,
                specification
        );
    }
}
