package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.*;

import static java.util.Objects.requireNonNull;

/** A distributed reasoning task. Immutable; the queue replaces it on every patch. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(String id, Reason.Query query, Priority priority, Set<Capability> requiredCapabilities,
                   Constraints constraints, Status status, List<String> assignedNodes,
                   Instant createdAt, Instant updatedAt, long seq, @Nullable String error) {

    public Task {
        requireNonNull(id);
        requireNonNull(query);
        requireNonNull(priority);
        requireNonNull(constraints);
        requireNonNull(status);
        requireNonNull(createdAt);
        requireNonNull(updatedAt);
        requiredCapabilities = requiredCapabilities.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(requiredCapabilities));
        assignedNodes = assignedNodes == null ? List.of() : List.copyOf(assignedNodes);
    }

    static Task create(String id, long seq, Reason.Query query, Constraints c, Instant now) {
        var caps = c.requiredCapabilities() != null && !c.requiredCapabilities().isEmpty()
                ? c.requiredCapabilities() : Capability.requiredFor(query.type());
        return new Task(id, query, c.priority() != null ? c.priority() : Priority.MEDIUM, caps, c,
                Status.PENDING, List.of(), now, now, seq, null);
    }

    Task with(Status s, Instant now, @Nullable String error) {
        return new Task(id, query, priority, requiredCapabilities, constraints, s, assignedNodes, createdAt, now, seq,
                error != null ? error : this.error);
    }

    Task withAssigned(List<String> nodes, Instant now) {
        return new Task(id, query, priority, requiredCapabilities, constraints, status, nodes, createdAt, now, seq, error);
    }

    @JsonIgnore
    public boolean terminal() {
        return status.terminal();
    }

    public enum Priority {
        LOW, MEDIUM, HIGH, CRITICAL;

        @JsonCreator
        public static Priority of(String s) {
            return valueOf(s.toUpperCase());
        }

        @JsonValue
        public String label() {
            return name().toLowerCase();
        }
    }

    /**
     * pending → assigned → running → {completed | failed | timeout | cancelled}. Any non-terminal
     * state may be cancelled; a task that never gets nodes, or whose nodes never acknowledge, may
     * fail or time out before running.
     */
    public enum Status {
        PENDING, ASSIGNED, RUNNING, COMPLETED, FAILED, TIMEOUT, CANCELLED;

        @JsonCreator
        public static Status of(String s) {
            return valueOf(s.toUpperCase());
        }

        public boolean terminal() {
            return this == COMPLETED || this == FAILED || this == TIMEOUT || this == CANCELLED;
        }

        public boolean canTransitionTo(Status next) {
            return switch (this) {
                case PENDING -> next == ASSIGNED || next == FAILED || next == CANCELLED;
                case ASSIGNED -> next == RUNNING || next == FAILED || next == TIMEOUT || next == CANCELLED;
                case RUNNING -> next == COMPLETED || next == FAILED || next == TIMEOUT || next == CANCELLED;
                case COMPLETED, FAILED, TIMEOUT, CANCELLED -> false;
            };
        }

        @JsonValue
        public String label() {
            return name().toLowerCase();
        }
    }

    /**
     * Per-task limits and preferences. Null fields fall back to the coordinator's configuration.
     * {@code aggregation} and {@code balancing} override the configured strategies for this task.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Constraints(@Nullable Long maxExecutionTime, @Nullable Double minConfidence, @Nullable Integer maxNodes,
                              List<String> preferredNodes, List<String> excludedNodes, boolean requireAllNodes,
                              @Nullable Priority priority, @Nullable Set<Capability> requiredCapabilities,
                              @Nullable Aggregator.Strategy aggregation, @Nullable Balancer.Strategy balancing) {

        public static final Constraints NONE = new Constraints(null, null, null, List.of(), List.of(), false, null, null, null, null);

        public Constraints {
            preferredNodes = preferredNodes == null ? List.of() : List.copyOf(preferredNodes);
            excludedNodes = excludedNodes == null ? List.of() : List.copyOf(excludedNodes);
        }

        public Constraints maxExecutionTime(long ms) {
            return new Constraints(ms, minConfidence, maxNodes, preferredNodes, excludedNodes, requireAllNodes, priority, requiredCapabilities, aggregation, balancing);
        }

        public Constraints minConfidence(double c) {
            return new Constraints(maxExecutionTime, c, maxNodes, preferredNodes, excludedNodes, requireAllNodes, priority, requiredCapabilities, aggregation, balancing);
        }

        public Constraints maxNodes(int n) {
            return new Constraints(maxExecutionTime, minConfidence, n, preferredNodes, excludedNodes, requireAllNodes, priority, requiredCapabilities, aggregation, balancing);
        }

        public Constraints preferredNodes(String... ids) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, List.of(ids), excludedNodes, requireAllNodes, priority, requiredCapabilities, aggregation, balancing);
        }

        public Constraints excludedNodes(String... ids) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, preferredNodes, List.of(ids), requireAllNodes, priority, requiredCapabilities, aggregation, balancing);
        }

        public Constraints requireAllNodes(boolean b) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, preferredNodes, excludedNodes, b, priority, requiredCapabilities, aggregation, balancing);
        }

        public Constraints priority(Priority p) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, preferredNodes, excludedNodes, requireAllNodes, p, requiredCapabilities, aggregation, balancing);
        }

        public Constraints requiredCapabilities(Capability... caps) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, preferredNodes, excludedNodes, requireAllNodes, priority, EnumSet.copyOf(List.of(caps)), aggregation, balancing);
        }

        public Constraints aggregation(Aggregator.Strategy s) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, preferredNodes, excludedNodes, requireAllNodes, priority, requiredCapabilities, s, balancing);
        }

        public Constraints balancing(Balancer.Strategy s) {
            return new Constraints(maxExecutionTime, minConfidence, maxNodes, preferredNodes, excludedNodes, requireAllNodes, priority, requiredCapabilities, aggregation, s);
        }
    }
}
