package com.stitchwork.core.validation;

import java.util.List;

/**
 * Verdict of a {@link StructuralValidator}.
 */
public record ValidationResult(boolean valid, List<String> diagnostics) {

    public ValidationResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult invalid(String... diagnostics) {
        return new ValidationResult(false, List.of(diagnostics));
    }
}
