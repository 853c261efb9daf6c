package com.stitchwork.core.stitch;

import com.stitchwork.core.metrics.EngineMetrics;
import com.stitchwork.core.model.Patch;
import com.stitchwork.core.validation.StructuralValidator;
import com.stitchwork.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Merges a batch of disjoint byte-range patches into one parent buffer.
 *
 * <p>Patches are applied from the highest start offset to the lowest, so a length change
 * never moves a range that is still to be applied and the result does not depend on the
 * order the patches were produced in. The merged buffer is then checked by the
 * {@link StructuralValidator}; a failing batch is rejected as a whole and the original
 * bytes are returned. The caller's array is never modified.
 */
public class PatchStitcher {

    private static final Logger log = LoggerFactory.getLogger(PatchStitcher.class);

    private static final Comparator<Patch> BY_START_DESCENDING =
            Comparator.comparingInt(Patch::start).reversed();

    private final StructuralValidator validator;
    private final EngineMetrics metrics;

    public PatchStitcher(StructuralValidator validator) {
        this(validator, null);
    }

    public PatchStitcher(StructuralValidator validator, EngineMetrics metrics) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.metrics = metrics;
    }

    /**
     * Stitches {@code patches} into {@code parent}.
     *
     * @throws MergeConflictException if a range falls outside the buffer, two ranges overlap,
     *                                 or two patches share a start offset
     */
    public StitchResult stitch(byte[] parent, List<Patch> patches) {
        Objects.requireNonNull(parent, "parent must not be null");
        if (patches.isEmpty()) {
            return new StitchResult(true, parent.clone(), 0, List.of());
        }

        var ordered = new ArrayList<>(patches);
        ordered.sort(BY_START_DESCENDING);
        checkRanges(parent.length, ordered);

        byte[] merged = parent;
        for (Patch patch : ordered) {
            merged = splice(merged, patch);
        }

        ValidationResult verdict = validator.validate(merged);
        if (!verdict.valid()) {
            log.info("Rejected batch of {} patch(es): {}", ordered.size(), verdict.diagnostics());
            record("invalid");
            return new StitchResult(false, parent.clone(), 0, verdict.diagnostics());
        }
        log.debug("Stitched {} patch(es), {} -> {} bytes", ordered.size(), parent.length, merged.length);
        record("merged");
        return new StitchResult(true, merged, ordered.size(), List.of());
    }

    /**
     * Replaces bytes {@code [start, end)} of {@code buffer} with the patch content, returning a new array.
     */
    static byte[] splice(byte[] buffer, Patch patch) {
        byte[] replacement = patch.replacementBytes();
        byte[] out = new byte[buffer.length - (patch.end() - patch.start()) + replacement.length];
        System.arraycopy(buffer, 0, out, 0, patch.start());
        System.arraycopy(replacement, 0, out, patch.start(), replacement.length);
        System.arraycopy(buffer, patch.end(), out, patch.start() + replacement.length, buffer.length - patch.end());
        return out;
    }

    /**
     * Expects {@code ordered} sorted by descending start.
     */
    private void checkRanges(int length, List<Patch> ordered) {
        for (Patch patch : ordered) {
            if (patch.end() > length) {
                record("conflict");
                throw new MergeConflictException("Patch [" + patch.start() + ", " + patch.end()
                        + ") from " + patch.nodeId() + " exceeds buffer length " + length, List.of(patch));
            }
        }
        for (int i = 1; i < ordered.size(); i++) {
            Patch higher = ordered.get(i - 1);
            Patch lower = ordered.get(i);
            if (lower.end() > higher.start() || lower.start() == higher.start()) {
                record("conflict");
                throw new MergeConflictException("Patches [" + lower.start() + ", " + lower.end() + ") from "
                        + lower.nodeId() + " and [" + higher.start() + ", " + higher.end() + ") from "
                        + higher.nodeId() + " conflict", List.of(lower, higher));
            }
        }
    }

    private void record(String outcome) {
        if (metrics != null) {
            metrics.recordStitch(outcome);
        }
    }
}
