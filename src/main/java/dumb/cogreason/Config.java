package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.cogreason.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/** Coordinator configuration. Immutable; updates produce a new instance. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Config(
        int maxNodes,
        long defaultTimeoutMs,
        long heartbeatIntervalMs,
        long nodeTimeoutThresholdMs,
        Aggregator.Strategy defaultAggregationStrategy,
        double minConsensusLevel,
        Balancer.Strategy loadBalancingStrategy,
        FaultTolerance.Level faultToleranceLevel,
        boolean enablePerformanceMonitoring,
        int nodesPerTask,
        int minNodeResults,
        double similarityThreshold,
        double confidenceTolerance,
        int suspicionThreshold,
        long taskRetentionMs,
        int maxConcurrentTasks,
        double overloadThreshold) {

    static final int DEFAULT_MAX_NODES = 10;
    static final long DEFAULT_TIMEOUT_MS = 30_000;
    static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 5_000;
    static final long DEFAULT_NODE_TIMEOUT_MS = 15_000;
    static final double DEFAULT_MIN_CONSENSUS = 0.7;
    static final int DEFAULT_NODES_PER_TASK = 3;
    static final double DEFAULT_SIMILARITY = 0.8;
    static final double DEFAULT_CONFIDENCE_TOLERANCE = 0.1;
    static final int DEFAULT_SUSPICION_THRESHOLD = 3;
    static final long DEFAULT_TASK_RETENTION_MS = 300_000;
    static final int DEFAULT_MAX_CONCURRENT_TASKS = 16;
    static final double DEFAULT_OVERLOAD_THRESHOLD = 0.9;

    public Config {
        if (maxNodes < 0 || nodesPerTask < 0 || minNodeResults < 1 || maxConcurrentTasks < 1)
            throw new IllegalArgumentException("Node and task counts must be positive");
        if (defaultTimeoutMs <= 0 || heartbeatIntervalMs <= 0 || nodeTimeoutThresholdMs <= 0)
            throw new IllegalArgumentException("Timeouts and intervals must be positive");
        minConsensusLevel = Atom.Truth.clamp(minConsensusLevel);
        similarityThreshold = Atom.Truth.clamp(similarityThreshold);
        confidenceTolerance = Atom.Truth.clamp(confidenceTolerance);
        overloadThreshold = Atom.Truth.clamp(overloadThreshold);
    }

    @JsonCreator
    public Config(
            @JsonProperty("maxNodes") Integer maxNodes,
            @JsonProperty("defaultTimeoutMs") Long defaultTimeoutMs,
            @JsonProperty("heartbeatIntervalMs") Long heartbeatIntervalMs,
            @JsonProperty("nodeTimeoutThresholdMs") Long nodeTimeoutThresholdMs,
            @JsonProperty("defaultAggregationStrategy") Aggregator.Strategy defaultAggregationStrategy,
            @JsonProperty("minConsensusLevel") Double minConsensusLevel,
            @JsonProperty("loadBalancingStrategy") Balancer.Strategy loadBalancingStrategy,
            @JsonProperty("faultToleranceLevel") FaultTolerance.Level faultToleranceLevel,
            @JsonProperty("enablePerformanceMonitoring") Boolean enablePerformanceMonitoring,
            @JsonProperty("nodesPerTask") Integer nodesPerTask,
            @JsonProperty("minNodeResults") Integer minNodeResults,
            @JsonProperty("similarityThreshold") Double similarityThreshold,
            @JsonProperty("confidenceTolerance") Double confidenceTolerance,
            @JsonProperty("suspicionThreshold") Integer suspicionThreshold,
            @JsonProperty("taskRetentionMs") Long taskRetentionMs,
            @JsonProperty("maxConcurrentTasks") Integer maxConcurrentTasks,
            @JsonProperty("overloadThreshold") Double overloadThreshold) {
        this(
                maxNodes != null ? maxNodes : DEFAULT_MAX_NODES,
                defaultTimeoutMs != null ? defaultTimeoutMs : DEFAULT_TIMEOUT_MS,
                heartbeatIntervalMs != null ? heartbeatIntervalMs : DEFAULT_HEARTBEAT_INTERVAL_MS,
                nodeTimeoutThresholdMs != null ? nodeTimeoutThresholdMs : DEFAULT_NODE_TIMEOUT_MS,
                defaultAggregationStrategy != null ? defaultAggregationStrategy : Aggregator.Strategy.CONFIDENCE_WEIGHTED,
                minConsensusLevel != null ? minConsensusLevel : DEFAULT_MIN_CONSENSUS,
                loadBalancingStrategy != null ? loadBalancingStrategy : Balancer.Strategy.LEAST_LOADED,
                faultToleranceLevel != null ? faultToleranceLevel : FaultTolerance.Level.BASIC,
                enablePerformanceMonitoring != null ? enablePerformanceMonitoring : true,
                nodesPerTask != null ? nodesPerTask : DEFAULT_NODES_PER_TASK,
                minNodeResults != null ? minNodeResults : 1,
                similarityThreshold != null ? similarityThreshold : DEFAULT_SIMILARITY,
                confidenceTolerance != null ? confidenceTolerance : DEFAULT_CONFIDENCE_TOLERANCE,
                suspicionThreshold != null ? suspicionThreshold : DEFAULT_SUSPICION_THRESHOLD,
                taskRetentionMs != null ? taskRetentionMs : DEFAULT_TASK_RETENTION_MS,
                maxConcurrentTasks != null ? maxConcurrentTasks : DEFAULT_MAX_CONCURRENT_TASKS,
                overloadThreshold != null ? overloadThreshold : DEFAULT_OVERLOAD_THRESHOLD);
    }

    public static Config defaults() {
        return new Config(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static Config load(Path file) throws IOException {
        return Json.obj(Files.readString(file), Config.class);
    }

    /** This configuration with the fields present in {@code partial} replaced. */
    public Config merge(JsonNode partial) throws JsonProcessingException {
        return Json.merge(this, partial, Config.class);
    }

    @JsonIgnore
    public Duration nodeTimeout() {
        return Duration.ofMillis(nodeTimeoutThresholdMs);
    }

    @JsonIgnore
    public Duration heartbeatInterval() {
        return Duration.ofMillis(heartbeatIntervalMs);
    }
}
