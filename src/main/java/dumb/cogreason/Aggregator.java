package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.ToDoubleFunction;

import static dumb.cogreason.util.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Reduces node results to one answer. Every strategy is an order-independent reduction; ties are
 * broken on node id or conclusion signature, never on arrival order.
 */
public class Aggregator {

    private static final Comparator<NodeResult> STRONGEST = Comparator
            .comparingDouble(NodeResult::confidence).reversed()
            .thenComparing(NodeResult::nodeId);

    /** Σc² / Σc: each confidence weighted by itself. Zero when every confidence is zero. */
    public static double confidenceWeighted(List<Double> confidences) {
        double num = 0, den = 0;
        for (var c : confidences) {
            num += c * c;
            den += c;
        }
        return den > 0 ? num / den : 0;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 1;
        var inter = a.stream().filter(b::contains).count();
        var union = a.size() + b.size() - inter;
        return (double) inter / union;
    }

    /**
     * Two results agree when their conclusion signature sets overlap at least
     * {@code similarityThreshold} (Jaccard) and their confidences are within
     * {@code confidenceTolerance}.
     */
    public static boolean agree(Reason.Result a, Reason.Result b, Config config) {
        return jaccard(Atom.signatures(a.conclusion()), Atom.signatures(b.conclusion())) >= config.similarityThreshold()
                && Math.abs(a.confidence() - b.confidence()) <= config.confidenceTolerance() + 1e-9;
    }

    /** Fraction of results agreeing with the aggregate; zero when none do. */
    public static double consensusLevel(Reason.Result aggregate, List<NodeResult> results, Config config) {
        if (results.isEmpty()) return 0;
        var agreeing = results.stream().filter(r -> agree(aggregate, r.result(), config)).count();
        return (double) agreeing / results.size();
    }

    /** Groups by exact conclusion signature set; the key is the joined sorted signatures. */
    static Map<String, List<NodeResult>> groups(List<NodeResult> results) {
        var g = new TreeMap<String, List<NodeResult>>();
        for (var r : results)
            g.computeIfAbsent(String.join("\n", Atom.signatures(r.result().conclusion())), k -> new ArrayList<>()).add(r);
        return g;
    }

    /** Largest group; ties go to the higher total confidence, then the smaller key. */
    static List<NodeResult> majority(Map<String, List<NodeResult>> groups) {
        List<NodeResult> best = null;
        double bestWeight = -1;
        for (var g : groups.values()) {
            var weight = g.stream().mapToDouble(NodeResult::confidence).sum();
            if (best == null || g.size() > best.size() || (g.size() == best.size() && weight > bestWeight + 1e-12)) {
                best = g;
                bestWeight = weight;
            }
        }
        return best;
    }

    /**
     * Aggregates successful node results.
     *
     * @throws ReasoningException {@code AGGREGATION_FAILURE} for an empty input,
     *                            {@code CONSENSUS_NOT_REACHED} when consensus-based agreement is too low
     */
    public Aggregation aggregate(String taskId, List<NodeResult> results, Strategy strategy, Config config) {
        requireNonNull(strategy);
        if (results.isEmpty())
            throw new ReasoningException(ReasoningException.Kind.AGGREGATION_FAILURE, taskId, "No node results to aggregate");

        var a = switch (strategy) {
            case MAJORITY_VOTE -> majorityVote(results);
            case WEIGHTED_AVERAGE -> weighted(results, r -> 1, config);
            case CONFIDENCE_WEIGHTED -> weighted(results, NodeResult::confidence, config);
            case PERFORMANCE_WEIGHTED -> weighted(results, NodeResult::reliability, config);
            case CONSENSUS_BASED -> consensusBased(taskId, results, config);
            case BEST_RESULT -> best(results, config);
        };
        debug("Task " + taskId + " aggregated " + results.size() + " results by " + strategy.label()
                + ", consensus " + String.format("%.3f", a.consensusLevel()));
        return new Aggregation(a.result(), a.consensusLevel(), strategy, a.selectedNode());
    }

    private static Aggregation majorityVote(List<NodeResult> results) {
        var groups = groups(results);
        var winner = majority(groups);
        var representative = winner.stream().min(STRONGEST).orElseThrow();
        var confidence = winner.stream().mapToDouble(NodeResult::confidence).average().orElse(0);
        var r = new Reason.Result(representative.result().conclusion(), confidence,
                "Majority of " + winner.size() + "/" + results.size() + " nodes agreed",
                Map.of("groups", groups.size(), "agreeingNodes", winner.stream().map(NodeResult::nodeId).sorted().toList()));
        return new Aggregation(r, (double) winner.size() / results.size(), Strategy.MAJORITY_VOTE, null);
    }

    private static Aggregation weighted(List<NodeResult> results, ToDoubleFunction<NodeResult> weight, Config config) {
        double num = 0, den = 0;
        for (var r : results) {
            var w = weight.applyAsDouble(r);
            num += w * r.confidence();
            den += w;
        }
        var confidence = den > 0 ? num / den : results.stream().mapToDouble(NodeResult::confidence).average().orElse(0);
        var r = new Reason.Result(union(results), confidence, "Combined " + results.size() + " node results", Map.of());
        return new Aggregation(r, consensusLevel(r, results, config), null, null);
    }

    private static Aggregation consensusBased(String taskId, List<NodeResult> results, Config config) {
        var winner = majority(groups(results));
        var level = (double) winner.size() / results.size();
        if (level + 1e-9 < config.minConsensusLevel()) {
            throw new ReasoningException(ReasoningException.Kind.CONSENSUS_NOT_REACHED, taskId,
                    String.format("consensus %.3f below required %.3f", level, config.minConsensusLevel()));
        }
        var confidence = confidenceWeighted(winner.stream().map(NodeResult::confidence).toList());
        var r = new Reason.Result(union(winner), confidence,
                "Consensus of " + winner.size() + "/" + results.size() + " nodes",
                Map.of("agreeingNodes", winner.stream().map(NodeResult::nodeId).sorted().toList()));
        return new Aggregation(r, level, Strategy.CONSENSUS_BASED, null);
    }

    private static Aggregation best(List<NodeResult> results, Config config) {
        var top = results.stream().min(STRONGEST).orElseThrow();
        var r = top.result();
        return new Aggregation(r, consensusLevel(r, results, config), Strategy.BEST_RESULT, top.nodeId());
    }

    /** Conclusions deduplicated by signature, keeping the most confident atom, sorted by signature. */
    static List<Atom> union(List<NodeResult> results) {
        var bySig = new TreeMap<String, Atom>();
        for (var r : results) {
            for (var a : r.result().conclusion()) {
                bySig.merge(a.signature(), a, (x, y) -> {
                    var cmp = Double.compare(x.confidence(), y.confidence());
                    if (cmp == 0) cmp = Double.compare(x.strength(), y.strength());
                    if (cmp == 0) cmp = -x.toString().compareTo(y.toString());
                    return cmp >= 0 ? x : y;
                });
            }
        }
        return new ArrayList<>(bySig.values());
    }

    /** {@code selectedNode} is set only when one node's result was taken unchanged. */
    public record Aggregation(Reason.Result result, double consensusLevel, Strategy strategy, @Nullable String selectedNode) {
    }

    public enum Strategy {
        MAJORITY_VOTE("majority-vote"),
        WEIGHTED_AVERAGE("weighted-average"),
        CONFIDENCE_WEIGHTED("confidence-weighted"),
        PERFORMANCE_WEIGHTED("performance-weighted"),
        CONSENSUS_BASED("consensus-based"),
        BEST_RESULT("best-result");

        private final String label;

        Strategy(String label) {
            this.label = label;
        }

        @JsonCreator
        public static Strategy of(String s) {
            for (var v : values())
                if (v.label.equalsIgnoreCase(s) || v.name().equalsIgnoreCase(s)) return v;
            throw new IllegalArgumentException("Unknown aggregation strategy: " + s);
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
