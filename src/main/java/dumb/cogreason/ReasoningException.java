package dumb.cogreason;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task-level failure. Carries the failure kind and, for partial outages, the reason each failing
 * node gave.
 */
public class ReasoningException extends RuntimeException {

    public final Kind kind;
    @Nullable
    public final String taskId;
    public final Map<String, String> nodeErrors;

    public ReasoningException(Kind kind, @Nullable String taskId, String message) {
        this(kind, taskId, message, Map.of());
    }

    public ReasoningException(Kind kind, @Nullable String taskId, String message, Map<String, String> nodeErrors) {
        super(kind + ": " + message + (nodeErrors.isEmpty() ? "" : " " + nodeErrors));
        this.kind = kind;
        this.taskId = taskId;
        this.nodeErrors = Collections.unmodifiableMap(new LinkedHashMap<>(nodeErrors));
    }

    public enum Kind {
        /** No live capable node, or {@code requireAllNodes} could not be met. */
        NODE_UNAVAILABLE,
        TASK_TIMEOUT,
        CONSENSUS_NOT_REACHED,
        /** Zero usable node results. */
        AGGREGATION_FAILURE,
        INVALID_QUERY,
        NODE_EXECUTION_ERROR
    }
}
