package com.stitchwork.core.executor;

import com.stitchwork.core.model.ResultSummary;
import com.stitchwork.core.model.RunStatus;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Outcome of a finished run.
 *
 * @param runId         the run
 * @param status        overall status
 * @param results       per-node summaries in completion order
 * @param mergedFiles   stitched content of every source file the graph touches and that merged cleanly
 * @param rejectedPaths source files whose root-level stitch was rejected; their base content is unchanged
 * @param lastCheckpointId id of the last checkpoint taken, or null
 */
public record GraphRunResult(
    String runId,
    RunStatus status,
    Map<String, ResultSummary> results,
    Map<String, byte[]> mergedFiles,
    List<String> rejectedPaths,
    String lastCheckpointId
) {

    public GraphRunResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        mergedFiles = Collections.unmodifiableMap(new TreeMap<>(mergedFiles));
        rejectedPaths = List.copyOf(rejectedPaths);
    }

    public ResultSummary result(String nodeId) {
        return results.get(nodeId);
    }

    public Optional<String> mergedText(String path) {
        byte[] content = mergedFiles.get(path);
        return content == null ? Optional.empty() : Optional.of(new String(content, StandardCharsets.UTF_8));
    }
}
