package com.stitchwork.core.stitch;

import com.stitchwork.core.EngineException;
import com.stitchwork.core.model.Patch;

import java.util.List;

/**
 * Patches submitted together overlap, share a start offset, or fall outside the buffer.
 * The whole batch is rejected.
 */
public class MergeConflictException extends EngineException {

    private final List<Patch> conflicting;

    public MergeConflictException(String message, List<Patch> conflicting) {
        super(message);
        this.conflicting = List.copyOf(conflicting);
    }

    public List<Patch> conflicting() {
        return conflicting;
    }
}
