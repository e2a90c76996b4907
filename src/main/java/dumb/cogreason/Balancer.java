package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static dumb.cogreason.util.Log.debug;

/**
 * Chooses which live nodes run a task. Exclusions are applied before any strategy, preferred nodes
 * are moved to the front of whatever order the strategy produces, and the result never exceeds the
 * requested node count.
 */
public class Balancer {

    private final AtomicInteger cursor = new AtomicInteger();
    private final Random random;

    public Balancer() {
        this(new Random());
    }

    Balancer(Random random) {
        this.random = random;
    }

    /** Node count a task asks for: its own {@code maxNodes}, else the configured fan-out, capped by {@code maxNodes}. */
    static int requested(Task.Constraints c, Config config) {
        var n = c.maxNodes() != null ? c.maxNodes() : config.nodesPerTask();
        return Math.max(0, Math.min(n, config.maxNodes()));
    }

    /**
     * Selects nodes for the task from the given active nodes. Returns fewer than requested when
     * fewer qualify, or none at all when the task requires every requested node and they are not
     * all available.
     */
    public List<Node> selectNodes(Task task, Collection<Node> active, Config config) {
        var c = task.constraints();
        var count = requested(c, config);
        if (count == 0) return List.of();

        var strategy = c.balancing() != null ? c.balancing() : config.loadBalancingStrategy();
        var required = task.requiredCapabilities();
        var excluded = Set.copyOf(c.excludedNodes());
        var candidates = active.stream()
                .filter(n -> !excluded.contains(n.id()))
                .filter(n -> strategy == Strategy.CAPABILITY_OPTIMIZED ? required.isEmpty() || n.coverage(required) > 0 : n.covers(required))
                .sorted(Comparator.comparingLong(Node::seq))
                .toList();

        if (c.requireAllNodes() && candidates.size() < count) {
            debug("Task " + task.id() + " needs " + count + " nodes, only " + candidates.size() + " qualify");
            return List.of();
        }

        var ordered = preferredFirst(order(strategy, candidates, required), c.preferredNodes());
        var selected = ordered.subList(0, Math.min(count, ordered.size()));
        debug("Task " + task.id() + " " + strategy.label() + " selected " + selected.stream().map(Node::id).toList());
        return List.copyOf(selected);
    }

    private List<Node> order(Strategy strategy, List<Node> candidates, Set<Capability> required) {
        var list = new ArrayList<>(candidates);
        switch (strategy) {
            case ROUND_ROBIN -> {
                if (!list.isEmpty()) Collections.rotate(list, -Math.floorMod(cursor.getAndIncrement(), list.size()));
            }
            case LEAST_LOADED -> list.sort(Comparator.comparingDouble(Node::workload)
                    .thenComparingInt(Node::inFlight)
                    .thenComparingLong(Node::seq));
            case PERFORMANCE_BASED -> list.sort(Comparator
                    .comparingDouble((Node n) -> -n.performance().reliability())
                    .thenComparingDouble(n -> n.performance().avgResponseTime())
                    .thenComparingLong(Node::seq));
            case CAPABILITY_OPTIMIZED -> list.sort(Comparator
                    .comparing((Node n) -> !n.covers(required))
                    .thenComparingDouble(n -> required.isEmpty() ? 0 : -(double) n.coverage(required) / required.size())
                    .thenComparingInt(n -> n.capabilities().size() - required.size())
                    .thenComparingDouble(Node::workload)
                    .thenComparingLong(Node::seq));
            case RANDOM -> Collections.shuffle(list, random);
        }
        return list;
    }

    private static List<Node> preferredFirst(List<Node> ordered, List<String> preferred) {
        if (preferred.isEmpty()) return ordered;
        var rank = new HashMap<String, Integer>();
        for (var i = 0; i < preferred.size(); i++) rank.putIfAbsent(preferred.get(i), i);
        var list = new ArrayList<>(ordered);
        list.sort(Comparator.comparingInt(n -> rank.getOrDefault(n.id(), Integer.MAX_VALUE)));
        return list;
    }

    public enum Strategy {
        ROUND_ROBIN("round-robin"),
        LEAST_LOADED("least-loaded"),
        PERFORMANCE_BASED("performance-based"),
        /** Full coverage first; partially capable nodes only fill remaining slots. */
        CAPABILITY_OPTIMIZED("capability-optimized"),
        RANDOM("random");

        private final String label;

        Strategy(String label) {
            this.label = label;
        }

        @JsonCreator
        public static Strategy of(String s) {
            for (var v : values())
                if (v.label.equalsIgnoreCase(s) || v.name().equalsIgnoreCase(s)) return v;
            throw new IllegalArgumentException("Unknown load balancing strategy: " + s);
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
