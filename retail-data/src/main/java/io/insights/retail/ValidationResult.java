package io.insights.retail;

import java.util.List;

/**
 * Outcome of a structural check. Errors are in the order they were found; {@code valid} iff there are none.
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }

    public static ValidationResult ok() { return new ValidationResult(true, List.of()); }

    public String firstError() { return errors.isEmpty() ? "" : errors.get(0); }
}
