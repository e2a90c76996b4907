package dumb.cogreason;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static dumb.cogreason.AbstractTest.concept;
import static dumb.cogreason.AbstractTest.ok;
import static org.junit.jupiter.api.Assertions.*;

public class AggregatorTest {

    private static final Config CONFIG = Config.defaults();
    private final Aggregator aggregator = new Aggregator();

    private static final Atom A = concept("A"), B = concept("B");

    /** Two agree on A, one dissents with B. */
    private static List<NodeResult> mixed() {
        return List.of(ok("n1", 0.9, 1.0, A), ok("n2", 0.6, 0.5, A), ok("n3", 0.3, 0.5, B));
    }

    private Aggregator.Aggregation run(Aggregator.Strategy s, List<NodeResult> results) {
        return aggregator.aggregate("task_1", results, s, CONFIG);
    }

    @Test
    void majorityVoteReportsGroupShare() {
        var a = run(Aggregator.Strategy.MAJORITY_VOTE, mixed());
        assertEquals(2.0 / 3, a.consensusLevel(), 1e-3);
        assertEquals(List.of("A"), a.result().conclusion().stream().map(Atom::name).toList());
        assertEquals(0.75, a.result().confidence(), 1e-9);
    }

    @Test
    void majorityTieGoesToHigherConfidence() {
        var a = run(Aggregator.Strategy.MAJORITY_VOTE, List.of(ok("n1", 0.4, 1, A), ok("n2", 0.9, 1, B)));
        assertEquals("B", a.result().conclusion().get(0).name());
        assertEquals(0.5, a.consensusLevel(), 1e-9);
    }

    @Test
    void weightedStrategiesUseTheirWeights() {
        assertEquals(0.6, run(Aggregator.Strategy.WEIGHTED_AVERAGE, mixed()).result().confidence(), 1e-9);
        assertEquals(0.7, run(Aggregator.Strategy.CONFIDENCE_WEIGHTED, mixed()).result().confidence(), 1e-9);
        assertEquals(0.675, run(Aggregator.Strategy.PERFORMANCE_WEIGHTED, mixed()).result().confidence(), 1e-9);
    }

    @Test
    void weightedStrategiesUnionConclusions() {
        var a = run(Aggregator.Strategy.CONFIDENCE_WEIGHTED, mixed());
        assertEquals(List.of("A", "B"), a.result().conclusion().stream().map(Atom::name).sorted().toList());
        assertEquals(0, a.consensusLevel(), "no single node matches the union");
    }

    @Test
    void identicalResultsReachFullConsensus() {
        var same = List.of(ok("n1", 0.8, 1, A), ok("n2", 0.8, 1, A), ok("n3", 0.8, 1, A));
        var a = run(Aggregator.Strategy.CONFIDENCE_WEIGHTED, same);
        assertEquals(1.0, a.consensusLevel(), 1e-9);
        assertEquals(0.8, a.result().confidence(), 1e-9);
    }

    @Test
    void consensusBasedRejectsWeakAgreement() {
        var e = assertThrows(ReasoningException.class, () -> run(Aggregator.Strategy.CONSENSUS_BASED, mixed()));
        assertEquals(ReasoningException.Kind.CONSENSUS_NOT_REACHED, e.kind);
        assertEquals("task_1", e.taskId);

        var strong = List.of(ok("n1", 0.8, 1, A), ok("n2", 0.7, 1, A), ok("n3", 0.9, 1, A), ok("n4", 0.2, 1, B));
        var a = run(Aggregator.Strategy.CONSENSUS_BASED, strong);
        assertEquals(0.75, a.consensusLevel(), 1e-9);
        assertEquals(List.of("A"), a.result().conclusion().stream().map(Atom::name).toList());
    }

    @Test
    void bestResultPassesThrough() {
        var best = ok("n1", 0.9, 1.0, A);
        var a = run(Aggregator.Strategy.BEST_RESULT, mixed());
        assertEquals(best.result().conclusion(), a.result().conclusion());
        assertEquals(best.confidence(), a.result().confidence());
        assertEquals(best.result().explanation(), a.result().explanation());
        assertEquals(best.result().metadata(), a.result().metadata());
        assertEquals("n1", a.selectedNode());
        assertEquals(1.0 / 3, a.consensusLevel(), 1e-9);
    }

    @Test
    void noResultsIsAnAggregationFailure() {
        for (var s : Aggregator.Strategy.values()) {
            var e = assertThrows(ReasoningException.class, () -> run(s, List.of()));
            assertEquals(ReasoningException.Kind.AGGREGATION_FAILURE, e.kind);
        }
    }

    @ParameterizedTest
    @EnumSource(value = Aggregator.Strategy.class, names = "CONSENSUS_BASED", mode = EnumSource.Mode.EXCLUDE)
    void arrivalOrderDoesNotMatter(Aggregator.Strategy s) {
        var forward = run(s, mixed());
        var reversed = new ArrayList<>(mixed());
        Collections.reverse(reversed);
        var backward = run(s, reversed);
        assertEquals(forward.result().conclusion(), backward.result().conclusion());
        assertEquals(forward.result().confidence(), backward.result().confidence(), 1e-12);
        assertEquals(forward.consensusLevel(), backward.consensusLevel(), 1e-12);
    }

    @Test
    void confidenceWeightingOfNothingIsZero() {
        assertEquals(0, Aggregator.confidenceWeighted(List.of()));
        assertEquals(0, Aggregator.confidenceWeighted(List.of(0.0, 0.0)));
        assertEquals(0.5, Aggregator.confidenceWeighted(List.of(0.5, 0.5)), 1e-12);
    }

    @Test
    void similarityUsesJaccardAndTolerance() {
        var ab = Reason.Result.of(List.of(A, B), 0.8, "");
        assertTrue(Aggregator.agree(Reason.Result.of(List.of(), 0.5, ""), Reason.Result.of(List.of(), 0.55, ""), CONFIG));
        assertTrue(Aggregator.agree(ab, Reason.Result.of(List.of(B, A.withTruth(0.1, 0.1)), 0.75, ""), CONFIG));
        assertFalse(Aggregator.agree(ab, Reason.Result.of(List.of(A), 0.8, ""), CONFIG));
        assertFalse(Aggregator.agree(ab, Reason.Result.of(List.of(A, B), 0.5, ""), CONFIG));
    }
}
