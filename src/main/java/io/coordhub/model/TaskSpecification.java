package io.coordhub.model;

import java.util.List;

public record TaskSpecification(
        String title,
        String description,
        List<String> requirements,
        List<String> acceptanceCriteria,
        Priority priority
) {
    public TaskSpecification {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        if (priority == null) priority = Priority.MEDIUM;
    }
}
