package com.stitchwork.core.stitch;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Outcome of stitching a patch batch.
 *
 * @param accepted    true if every patch was applied and the result validated
 * @param buffer      merged bytes when accepted, otherwise the original bytes unchanged
 * @param applied     number of patches applied (0 when rejected)
 * @param diagnostics validator diagnostics for a rejected batch
 */
public record StitchResult(boolean accepted, byte[] buffer, int applied, List<String> diagnostics) {

    public StitchResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public String text() {
        return new String(buffer, StandardCharsets.UTF_8);
    }
}
