package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Final artifact of a distributed task. {@code nodeResults} keeps arrival order and
 * {@code nodesUsed == nodeResults.size()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DistributedResult(String taskId, List<NodeResult> nodeResults, Reason.Result aggregatedResult,
                                double consensusLevel, long executionTime, int nodesUsed,
                                Map<String, Object> metadata) {
    public DistributedResult {
        requireNonNull(taskId);
        requireNonNull(aggregatedResult);
        nodeResults = List.copyOf(nodeResults);
        consensusLevel = Atom.Truth.clamp(consensusLevel);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (nodesUsed != nodeResults.size())
            throw new IllegalArgumentException("nodesUsed " + nodesUsed + " != " + nodeResults.size() + " node results");
    }
}
