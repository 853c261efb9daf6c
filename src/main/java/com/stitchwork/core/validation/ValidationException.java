package com.stitchwork.core.validation;

import com.stitchwork.core.EngineException;

import java.util.List;

/**
 * A patch or merged buffer failed structural validation. Retryable by the producing node.
 */
public class ValidationException extends EngineException {

    private final List<String> diagnostics;

    public ValidationException(String message, List<String> diagnostics) {
        super(diagnostics.isEmpty() ? message : message + ": " + String.join("; ", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<String> diagnostics() {
        return diagnostics;
    }
}
