package com.stitchwork.core.model;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A byte-range replacement: bytes {@code [start, end)} of the target buffer are
 * replaced by the UTF-8 encoding of {@code replacement}.
 *
 * @param start       first replaced byte (inclusive)
 * @param end         end of the replaced range (exclusive)
 * @param replacement new content
 * @param nodeId      node that produced the patch
 */
public record Patch(int start, int end, String replacement, String nodeId) implements Serializable {

    public Patch {
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid patch range [" + start + ", " + end + ")");
        }
    }

    public static Patch of(int start, int end, String replacement) {
        return new Patch(start, end, replacement, null);
    }

    public byte[] replacementBytes() {
        return replacement.getBytes(StandardCharsets.UTF_8);
    }

    public boolean overlaps(Patch other) {
        return start < other.end && other.start < end;
    }

    /**
     * Returns this patch moved by {@code delta} bytes, e.g. to express it relative to a span start.
     */
    public Patch shift(int delta) {
        return new Patch(start + delta, end + delta, replacement, nodeId);
    }
}
