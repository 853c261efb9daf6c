package com.stitchwork.core.validation;

/**
 * External structural checker (typically a parser) run over merged or patched content.
 */
@FunctionalInterface
public interface StructuralValidator {

    ValidationResult validate(byte[] content);

    /**
     * A validator that accepts everything.
     */
    static StructuralValidator permissive() {
        return content -> ValidationResult.ok();
    }
}
