package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/** One node's contribution to a task. {@code error} is set when the node call failed. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResult(String nodeId, Reason.Result result, long executionTime, double reliability,
                         @Nullable String error) {
    public NodeResult {
        requireNonNull(nodeId);
        requireNonNull(result);
        reliability = Atom.Truth.clamp(reliability);
    }

    public static NodeResult success(String nodeId, Reason.Result result, long executionTime, double reliability) {
        return new NodeResult(nodeId, result, executionTime, reliability, null);
    }

    public static NodeResult failure(String nodeId, String error, long executionTime, double reliability) {
        return new NodeResult(nodeId, Reason.Result.failure(error, "node"), executionTime, reliability, error);
    }

    @JsonIgnore
    public boolean ok() {
        return error == null;
    }

    @JsonIgnore
    public double confidence() {
        return result.confidence();
    }
}
