package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dumb.cogreason.util.Events;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static dumb.cogreason.util.Log.*;
import static java.util.Objects.requireNonNull;

/**
 * Periodic failure handling: demotes nodes that stopped heartbeating, tops up the tasks they were
 * serving, and tracks nodes whose results keep disagreeing with the majority.
 */
public class FaultTolerance {

    private final Nodes nodes;
    private final Tasks tasks;
    private final Events events;
    private final Supplier<Config> config;
    private final Redistributor redistributor;
    private final ConcurrentMap<String, Integer> strikes = new ConcurrentHashMap<>();
    @Nullable
    private ScheduledExecutorService timer;

    FaultTolerance(Nodes nodes, Tasks tasks, Events events, Supplier<Config> config, Redistributor redistributor) {
        this.nodes = requireNonNull(nodes);
        this.tasks = requireNonNull(tasks);
        this.events = requireNonNull(events);
        this.config = requireNonNull(config);
        this.redistributor = requireNonNull(redistributor);
    }

    public synchronized void start(Duration interval) {
        if (timer != null) return;
        var t = Executors.newSingleThreadScheduledExecutor(r -> {
            var th = new Thread(r, "fault-tolerance");
            th.setDaemon(true);
            return th;
        });
        t.scheduleAtFixedRate(this::safeTick, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        timer = t;
        message("Fault tolerance started, checking every " + interval.toMillis() + "ms at level " + level().label());
    }

    public synchronized void stop() {
        if (timer == null) return;
        timer.shutdownNow();
        timer = null;
        message("Fault tolerance stopped");
    }

    public synchronized boolean running() {
        return timer != null;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            error("Fault tolerance check failed", e);
        }
    }

    /** One maintenance pass: detect, redistribute, evict old tasks, check load. */
    public void tick() {
        var failed = detectFailures();
        if (level().atLeast(Level.BASIC)) failed.forEach(this::redistributeTasks);
        tasks.cleanup();
        checkOverload();
    }

    public Level level() {
        return config.get().faultToleranceLevel();
    }

    /** Nodes newly demoted to offline by this call. */
    public Set<String> detectFailures() {
        return nodes.cleanupInactiveNodes();
    }

    /**
     * Replaces a failed node in each unfinished task it was serving. Only the missing share is
     * re-dispatched; results already received are kept.
     *
     * @return number of tasks that received a replacement
     */
    public int redistributeTasks(String nodeId) {
        var affected = tasks.assignedTo(nodeId).stream()
                .filter(t -> redistributor.awaiting(t.id(), nodeId))
                .toList();
        if (affected.isEmpty()) return 0;
        var replaced = 0;
        for (var t : affected) {
            var replacement = redistributor.topUp(t.id(), nodeId);
            if (replacement.isPresent()) {
                replaced++;
                message("Task " + t.id() + " moved from " + nodeId + " to " + replacement.get());
            } else {
                warning("Task " + t.id() + " lost node " + nodeId + " and no replacement is available");
            }
        }
        return replaced;
    }

    /**
     * Flags results that disagree with a strict majority. Below {@code high} this only reports;
     * from {@code high} on each flag counts as a strike against the node.
     */
    public Validation validateResults(@Nullable String taskId, List<NodeResult> results) {
        var ok = results.stream().filter(NodeResult::ok).toList();
        if (ok.size() < 3) return Validation.VALID;
        var majority = Aggregator.majority(Aggregator.groups(ok));
        if (majority.size() * 2 <= ok.size()) return Validation.VALID;

        var c = config.get();
        var reference = new Reason.Result(majority.get(0).result().conclusion(),
                majority.stream().mapToDouble(NodeResult::confidence).average().orElse(0), "", Map.of());
        var suspicious = ok.stream()
                .filter(r -> !Aggregator.agree(reference, r.result(), c))
                .map(NodeResult::nodeId)
                .collect(Collectors.toCollection(TreeSet::new));
        if (suspicious.isEmpty()) return Validation.VALID;

        if (level().atLeast(Level.HIGH)) {
            for (var id : suspicious) {
                var n = strikes.merge(id, 1, Integer::sum);
                warning("Node " + id + " disagreed with the majority" + (taskId != null ? " on " + taskId : "") + " (" + n + " strikes)");
                events.emit(new Event.SuspiciousNodeEvent(id, taskId, n));
            }
        }
        return new Validation(false, suspicious);
    }

    public int strikes(String nodeId) {
        return strikes.getOrDefault(nodeId, 0);
    }

    /** Nodes whose results are excluded from aggregation. Empty below the byzantine level. */
    public Set<String> suspects() {
        if (!level().atLeast(Level.BYZANTINE)) return Set.of();
        var threshold = config.get().suspicionThreshold();
        return strikes.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public void forget(String nodeId) {
        strikes.remove(nodeId);
    }

    /** Emits {@link Event.SystemOverloadedEvent} when mean active-node workload exceeds the threshold. */
    public boolean checkOverload() {
        var c = config.get();
        if (!c.enablePerformanceMonitoring()) return false;
        var active = nodes.getActiveNodes();
        if (active.isEmpty()) return false;
        var mean = active.stream().mapToDouble(Node::workload).average().orElse(0);
        if (mean <= c.overloadThreshold()) return false;
        var hot = active.stream().filter(n -> n.workload() > c.overloadThreshold()).map(Node::id)
                .collect(Collectors.toCollection(TreeSet::new));
        warning(String.format("System overloaded: mean workload %.2f across %d nodes", mean, active.size()));
        events.emit(new Event.SystemOverloadedEvent(hot, active.size(), c.overloadThreshold()));
        return true;
    }

    /** Supplies a replacement for a failed node within one task. */
    interface Redistributor {
        /** True while the task still waits for an answer from the node. */
        boolean awaiting(String taskId, String nodeId);

        Optional<String> topUp(String taskId, String failedNodeId);
    }

    public record Validation(boolean valid, Set<String> suspiciousNodes) {
        static final Validation VALID = new Validation(true, Set.of());

        public Validation {
            suspiciousNodes = Set.copyOf(suspiciousNodes);
        }
    }

    public enum Level {
        NONE, BASIC, HIGH, BYZANTINE;

        @JsonCreator
        public static Level of(String s) {
            return valueOf(s.toUpperCase());
        }

        public boolean atLeast(Level other) {
            return compareTo(other) >= 0;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase();
        }
    }
}
