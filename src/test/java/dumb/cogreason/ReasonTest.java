package dumb.cogreason;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ReasonTest {

    private Knowledge k;
    private Reason.Engines engines;

    @BeforeEach
    void setUp() {
        k = new Knowledge();
        engines = Reason.Engines.standard(k);
    }

    private static Atom implication(Atom from, Atom to, double s, double c) {
        return new Atom(null, Reason.IMPLICATION, null, new Atom.Truth(s, c), List.of(from, to), Map.of());
    }

    private static Atom evaluation(String predicate, String arg, double s) {
        return new Atom(null, Reason.EVALUATION, null, new Atom.Truth(s, 0.9),
                List.of(Atom.node("PredicateNode", predicate), Atom.node("ConceptNode", arg)), Map.of());
    }

    @Test
    void deductionAppliesModusPonens() {
        k.addAtom(Atom.node("ConceptNode", "rain", 0.9, 0.9));
        k.addAtom(implication(Atom.node("ConceptNode", "rain"), Atom.node("ConceptNode", "wet"), 0.9, 0.9));

        var r = engines.reason(Reason.Query.of(Reason.TYPE_DEDUCTIVE));
        assertEquals(1, r.conclusion().size());
        var wet = r.conclusion().get(0);
        assertEquals("wet", wet.name());
        assertEquals(0.81, wet.strength(), 1e-9);
        assertEquals(0.81, wet.confidence(), 1e-9);
        assertEquals(0.729, r.confidence(), 1e-9);
        assertEquals(Reason.TYPE_DEDUCTIVE, r.metadata().get("reasoningType"));
    }

    @Test
    void deductionIgnoresWeakAntecedents() {
        k.addAtom(Atom.node("ConceptNode", "rain", 0.6, 0.9));
        k.addAtom(implication(Atom.node("ConceptNode", "rain"), Atom.node("ConceptNode", "wet"), 0.9, 0.9));

        var r = engines.reason(Reason.Query.of(Reason.TYPE_DEDUCTIVE));
        assertTrue(r.conclusion().isEmpty());
        assertEquals(0, r.confidence());
    }

    @Test
    void inductionGeneralisesRepeatedObservations() {
        k.addAtom(evaluation("likes", "a", 0.9));
        k.addAtom(evaluation("likes", "b", 0.8));
        k.addAtom(evaluation("likes", "c", 0.2));
        k.addAtom(evaluation("hates", "a", 0.9));

        var r = engines.reason(Reason.Query.of(Reason.TYPE_INDUCTIVE));
        assertEquals(1, r.conclusion().size());
        var pattern = r.conclusion().get(0);
        assertEquals("pattern_likes", pattern.name());
        assertEquals(2.0 / 3, pattern.strength(), 1e-9);
        assertEquals(0.3, pattern.confidence(), 1e-9);
        assertEquals(0.55, r.confidence(), 1e-9);
    }

    @Test
    void abductionPrefersKnownCauses() {
        var wetGrass = evaluation("wet", "grass", 1).withId(null);
        var observation = new Atom(null, wetGrass.type(), null, null, wetGrass.outgoing(), Map.of());
        k.addAtom(implication(Atom.node("ConceptNode", "rain"), observation, 0.8, 0.9));

        var r = engines.reason(Reason.Query.of(Reason.TYPE_ABDUCTIVE, observation));
        assertEquals(1, r.conclusion().size());
        var cause = r.conclusion().get(0);
        assertEquals("rain", cause.name());
        assertEquals(0.8, cause.strength(), 1e-9);
        assertEquals(0.72, cause.confidence(), 1e-9);
    }

    @Test
    void abductionFallsBackToGenericHypothesis() {
        var r = engines.reason(Reason.Query.of(Reason.TYPE_ABDUCTIVE, evaluation("wet", "road", 1)));
        assertEquals(1, r.conclusion().size());
        assertEquals(0.3, r.confidence(), 1e-9);
    }

    @Test
    void patternMatchingReportsMatchedFraction() {
        k.addAtom(Atom.node("ConceptNode", "cat"));
        var r = engines.reason(Reason.Query.of(Reason.TYPE_PATTERN_MATCHING, Atom.node("ConceptNode", "cat"), Atom.node("ConceptNode", "unicorn")));
        assertEquals(1, r.conclusion().size());
        assertEquals(0.5, r.confidence(), 1e-9);
    }

    @Test
    void domainAnalysisFlagsIssues() {
        var r = engines.reason(Reason.Query.of(Reason.TYPE_CODE_ANALYSIS,
                Atom.node("ConceptNode", "doubtful", 0.1, 0.9),
                Atom.link("MemberLink")));
        assertEquals(3, r.conclusion().size());
        assertEquals(0.5, r.confidence(), 1e-9);
        assertEquals("AnalysisSummary", r.conclusion().get(2).type());
    }

    @Test
    void unknownTypeFallsBackToHybrid() {
        k.addAtom(Atom.node("ConceptNode", "rain", 0.9, 0.9));
        k.addAtom(implication(Atom.node("ConceptNode", "rain"), Atom.node("ConceptNode", "wet"), 0.9, 0.9));
        var q = Reason.Query.of("mystery", Atom.node("ConceptNode", "rain"));

        var confidences = new ArrayList<Double>();
        var conclusions = 0;
        for (var type : engines.types()) {
            var part = engines.engine(type).orElseThrow().reason(q);
            confidences.add(part.confidence());
            conclusions += part.conclusion().size();
        }

        var r = engines.reason(q);
        assertEquals(Reason.TYPE_HYBRID, r.metadata().get("reasoningType"));
        assertEquals(Aggregator.confidenceWeighted(confidences), r.confidence(), 1e-9);
        assertEquals(conclusions, r.conclusion().size());
    }

    @Test
    void enginesAreTotal() {
        var e = new Reason.BaseEngine(k) {
            @Override
            public String type() {
                return "broken";
            }

            @Override
            protected Reason.Result doReason(Reason.Query query) {
                throw new IllegalStateException("index corrupted");
            }
        };
        var r = e.reason(Reason.Query.of("broken"));
        assertEquals(0, r.confidence());
        assertTrue(r.conclusion().isEmpty());
        assertTrue(r.failed());
        assertTrue(r.explanation().contains("index corrupted"));
    }

    @Test
    void malformedQueriesReportProblems() {
        var atoms = new ArrayList<Atom>();
        atoms.add(null);
        assertFalse(new Reason.Query(" ", atoms, null, null).problems().isEmpty());
        assertTrue(Reason.Query.of(Reason.TYPE_DEDUCTIVE).problems().isEmpty());
    }
}
