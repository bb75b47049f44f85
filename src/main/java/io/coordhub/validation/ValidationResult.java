package io.coordhub.validation;

import java.util.List;

public record ValidationResult(List<String> errors) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of());
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public String message() {
        return String.join("; ", errors);
    }
}
