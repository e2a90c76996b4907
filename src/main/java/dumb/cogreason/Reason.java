package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static dumb.cogreason.util.Log.message;
import static dumb.cogreason.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Local reasoning: the query/result records, the engine contract and the built-in engine variants.
 */
public class Reason {
    public static final String TYPE_DEDUCTIVE = "deductive";
    public static final String TYPE_INDUCTIVE = "inductive";
    public static final String TYPE_ABDUCTIVE = "abductive";
    public static final String TYPE_PATTERN_MATCHING = "pattern-matching";
    public static final String TYPE_CODE_ANALYSIS = "code-analysis";
    public static final String TYPE_HYBRID = "hybrid";

    static final String IMPLICATION = "ImplicationLink";
    static final String EVALUATION = "EvaluationLink";
    static final String VARIABLE = "VariableNode";

    private static final double TRUE_STRENGTH = 0.7;
    private static final double TRUE_CONFIDENCE = 0.5;
    private static final int MIN_INDUCTION_OBSERVATIONS = 3;
    private static final int DEFAULT_MAX_HYPOTHESES = 5;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Query(String type, List<Atom> atoms, Map<String, Object> context, Map<String, Object> parameters) {
        public Query {
            requireNonNull(type);
            atoms = atoms == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(atoms));
            context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
            parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }

        public static Query of(String type, Atom... atoms) {
            return new Query(type, List.of(atoms), Map.of(), Map.of());
        }

        /** Problems that make the query unfit for dispatch; empty when well formed. */
        public List<String> problems() {
            var p = new ArrayList<String>();
            if (type.isBlank()) p.add("query type is blank");
            if (atoms.stream().anyMatch(Objects::isNull)) p.add("query atoms contain null");
            return p;
        }

        int intParam(String key, int def) {
            return parameters.get(key) instanceof Number n ? n.intValue() : def;
        }

        double doubleParam(String key, double def) {
            return parameters.get(key) instanceof Number n ? n.doubleValue() : def;
        }

        boolean boolParam(String key) {
            return Boolean.TRUE.equals(parameters.get(key));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(List<Atom> conclusion, double confidence, String explanation, Map<String, Object> metadata) {
        public Result {
            conclusion = conclusion == null ? List.of() : List.copyOf(conclusion);
            confidence = Atom.Truth.clamp(confidence);
            explanation = explanation == null ? "" : explanation;
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }

        public static Result of(List<Atom> conclusion, double confidence, String explanation) {
            return new Result(conclusion, confidence, explanation, Map.of());
        }

        public static Result failure(String explanation, String reasoningType) {
            return new Result(List.of(), 0, explanation, Map.of("error", true, "reasoningType", reasoningType));
        }

        public Result withMetadata(Map<String, Object> extra) {
            var m = new LinkedHashMap<>(metadata);
            m.putAll(extra);
            return new Result(conclusion, confidence, explanation, m);
        }

        @JsonIgnore
        public boolean failed() {
            return Boolean.TRUE.equals(metadata.get("error"));
        }
    }

    /** A reasoning capability. Implementations are total: failures come back as a zero-confidence result. */
    public interface Engine {
        String type();

        Result reason(Query query);
    }

    abstract static class BaseEngine implements Engine {
        protected final Knowledge knowledge;

        BaseEngine(Knowledge knowledge) {
            this.knowledge = requireNonNull(knowledge);
        }

        @Override
        public final Result reason(Query query) {
            try {
                var r = doReason(query);
                return r.withMetadata(Map.of("reasoningType", type()));
            } catch (RuntimeException e) {
                warning("Engine " + type() + " failed: " + e);
                return Result.failure("Reasoning failed: " + e.getMessage(), type());
            }
        }

        protected abstract Result doReason(Query query);

        /** Query atoms followed by stored atoms of the given type. */
        protected List<Atom> withStored(Query q, String type) {
            return Stream.concat(q.atoms().stream(), knowledge.queryAtoms(Knowledge.Pattern.ofType(type)).stream()).toList();
        }

        /** Best known truth of an atom: its own, else the strongest stored atom of the same shape. */
        protected Optional<Atom.Truth> truthOf(Atom a) {
            if (a.truthValue() != null) return Optional.of(a.truthValue());
            return knowledge.queryAtoms(Knowledge.Pattern.like(a)).stream()
                    .map(Atom::truthValue)
                    .filter(Objects::nonNull)
                    .max(Comparator.comparingDouble(t -> t.strength() * t.confidence()));
        }
    }

    /** Modus ponens over implication links from the query and the store. */
    static class Deductive extends BaseEngine {
        Deductive(Knowledge k) {
            super(k);
        }

        @Override
        public String type() {
            return TYPE_DEDUCTIVE;
        }

        @Override
        protected Result doReason(Query q) {
            var conclusions = new ArrayList<Atom>();
            var seen = new HashSet<String>();
            for (var imp : withStored(q, IMPLICATION)) {
                if (imp.outgoing().size() != 2 || imp.truthValue() == null) continue;
                var antecedent = imp.outgoing().get(0);
                var consequent = imp.outgoing().get(1);
                var at = truthOf(antecedent).orElse(null);
                if (at == null || at.strength() <= TRUE_STRENGTH || at.confidence() <= TRUE_CONFIDENCE) continue;
                var it = imp.truthValue();
                var derived = consequent.withId(null).withTruth(at.strength() * it.strength(), Math.min(at.confidence(), it.confidence()) * 0.9);
                if (seen.add(derived.signature())) conclusions.add(derived);
            }
            var confidence = conclusions.isEmpty() ? 0 :
                    Math.min(0.95, conclusions.stream().mapToDouble(Atom::confidence).average().orElse(0) * 0.9);
            return new Result(conclusions, confidence,
                    "Deductive reasoning applied " + conclusions.size() + " inference rules",
                    Map.of("inferenceSteps", conclusions.size()));
        }
    }

    /** Generalises over evaluation links that share a predicate. */
    static class Inductive extends BaseEngine {
        Inductive(Knowledge k) {
            super(k);
        }

        @Override
        public String type() {
            return TYPE_INDUCTIVE;
        }

        @Override
        protected Result doReason(Query q) {
            var groups = new TreeMap<String, List<Atom>>();
            withStored(q, EVALUATION).stream()
                    .filter(a -> EVALUATION.equals(a.type()) && !a.outgoing().isEmpty())
                    .forEach(a -> {
                        var p = a.outgoing().get(0);
                        groups.computeIfAbsent(p.name() != null ? p.name() : p.type(), k -> new ArrayList<>()).add(a);
                    });

            var min = q.intParam("minObservations", MIN_INDUCTION_OBSERVATIONS);
            var patterns = new ArrayList<Atom>();
            var observations = 0;
            for (var e : groups.entrySet()) {
                var obs = e.getValue();
                observations += obs.size();
                if (obs.size() < min) continue;
                var positive = obs.stream().filter(o -> o.strength() > 0.5).count();
                var x = Atom.node(VARIABLE, "$X");
                patterns.add(new Atom(null, IMPLICATION, "pattern_" + e.getKey(),
                        new Atom.Truth((double) positive / obs.size(), Math.min(0.9, obs.size() / 10.0)),
                        List.of(x, new Atom(null, EVALUATION, e.getKey(), null, List.of(x), Map.of())),
                        Map.of("observations", obs.size())));
            }
            var confidence = patterns.isEmpty() || observations == 0 ? 0 :
                    Math.min(0.9, (double) patterns.size() / groups.size() * 0.7 + 0.2);
            return new Result(patterns, confidence,
                    "Inductive reasoning found " + patterns.size() + " generalizations from " + observations + " observations",
                    Map.of("observationCount", observations));
        }
    }

    /** Proposes causes for observations, preferring known implications that explain them. */
    static class Abductive extends BaseEngine {
        Abductive(Knowledge k) {
            super(k);
        }

        @Override
        public String type() {
            return TYPE_ABDUCTIVE;
        }

        @Override
        protected Result doReason(Query q) {
            var observations = q.atoms().stream().filter(a -> EVALUATION.equals(a.type())).toList();
            var rules = withStored(q, IMPLICATION).stream().filter(r -> r.outgoing().size() == 2).toList();

            var hypotheses = new ArrayList<Atom>();
            var seen = new HashSet<String>();
            for (var obs : observations) {
                var sig = obs.signature();
                var explained = false;
                var obsConfidence = obs.truthValue() != null ? obs.confidence() : 1;
                for (var r : rules) {
                    if (!r.outgoing().get(1).signature().equals(sig)) continue;
                    explained = true;
                    var cause = r.outgoing().get(0).withId(null)
                            .withTruth(r.strength(), r.confidence() * obsConfidence * 0.8)
                            .withMetadata("explains", sig);
                    if (seen.add(cause.signature())) hypotheses.add(cause);
                }
                if (!explained && seen.add("?" + sig)) {
                    hypotheses.add(new Atom(null, IMPLICATION, "hypothesis_" + (obs.name() != null ? obs.name() : obs.type()),
                            new Atom.Truth(0.5, 0.3), List.of(Atom.node(VARIABLE, "$Cause"), obs.withId(null)), Map.of()));
                }
            }
            hypotheses.sort(Comparator.comparingDouble((Atom h) -> -h.strength() * h.confidence()).thenComparing(Atom::signature));
            var top = hypotheses.subList(0, Math.min(hypotheses.size(), q.intParam("maxHypotheses", DEFAULT_MAX_HYPOTHESES)));
            var confidence = top.stream().mapToDouble(Atom::confidence).average().orElse(0);
            return new Result(top, confidence,
                    "Abductive reasoning generated " + top.size() + " plausible explanations",
                    Map.of("hypothesesGenerated", hypotheses.size()));
        }
    }

    /** Uses each query atom as a pattern against the store. */
    static class PatternMatching extends BaseEngine {
        PatternMatching(Knowledge k) {
            super(k);
        }

        @Override
        public String type() {
            return TYPE_PATTERN_MATCHING;
        }

        @Override
        protected Result doReason(Query q) {
            if (q.atoms().isEmpty()) return Result.of(List.of(), 0, "No patterns supplied");
            var partial = q.boolParam("partial");
            var found = new LinkedHashMap<String, Atom>();
            var matched = 0;
            for (var a : q.atoms()) {
                var pattern = Knowledge.Pattern.like(a);
                var hits = knowledge.queryAtoms(partial ? pattern.asPartial() : pattern);
                if (!hits.isEmpty()) matched++;
                hits.forEach(h -> found.putIfAbsent(h.id(), h));
            }
            return new Result(new ArrayList<>(found.values()), (double) matched / q.atoms().size(),
                    "Pattern matching found " + found.size() + " atoms for " + matched + "/" + q.atoms().size() + " patterns",
                    Map.of("patterns", q.atoms().size(), "matches", found.size()));
        }
    }

    /** Structural analysis: flags weakly believed atoms and links without members. */
    static class DomainAnalysis extends BaseEngine {
        DomainAnalysis(Knowledge k) {
            super(k);
        }

        @Override
        public String type() {
            return TYPE_CODE_ANALYSIS;
        }

        @Override
        protected Result doReason(Query q) {
            var atoms = q.atoms();
            if (atoms.isEmpty()) return Result.of(List.of(), 0, "Nothing to analyse");
            var threshold = q.doubleParam("issueThreshold", 0.3);
            var issues = new ArrayList<Atom>();
            var types = new TreeMap<String, Integer>();
            for (var a : atoms) {
                types.merge(a.type(), 1, Integer::sum);
                if (a.truthValue() != null && a.strength() < threshold)
                    issues.add(new Atom(null, "AnalysisIssue", "weak-belief", new Atom.Truth(1 - a.strength(), a.confidence()), List.of(a.withId(null)), Map.of()));
                if (a.type().endsWith("Link") && a.outgoing().isEmpty())
                    issues.add(new Atom(null, "AnalysisIssue", "dangling-link", new Atom.Truth(1, 0.9), List.of(a.withId(null)), Map.of()));
            }
            var domain = q.context().getOrDefault("domain", "general").toString();
            var conclusion = new ArrayList<Atom>(issues);
            conclusion.add(new Atom(null, "AnalysisSummary", domain, null, List.of(), Map.of("atomTypes", types, "issues", issues.size())));
            var confidence = 1 - 0.5 * Math.min(1, (double) issues.size() / atoms.size());
            return new Result(conclusion, confidence, "Analysed " + atoms.size() + " atoms, found " + issues.size() + " issues",
                    Map.of("domain", domain));
        }
    }

    /**
     * Runs every other engine, concatenates conclusions and averages confidence with the same
     * confidence-weighted rule the distributed aggregator uses.
     */
    static class Hybrid implements Engine {
        private final Engines engines;

        Hybrid(Engines engines) {
            this.engines = engines;
        }

        @Override
        public String type() {
            return TYPE_HYBRID;
        }

        @Override
        public Result reason(Query query) {
            var results = engines.variants().stream()
                    .filter(e -> e != this)
                    .map(e -> e.reason(query))
                    .toList();
            if (results.isEmpty()) return Result.failure("No reasoning engines available", TYPE_HYBRID);
            var conclusion = results.stream().flatMap(r -> r.conclusion().stream()).toList();
            var confidence = Aggregator.confidenceWeighted(results.stream().map(Result::confidence).toList());
            return new Result(conclusion, confidence, "Hybrid reasoning combined " + results.size() + " engines",
                    Map.of("reasoningType", TYPE_HYBRID, "engines", results.size()));
        }
    }

    /** Routes queries by type; unknown types go to the hybrid engine. */
    public static class Engines {
        private final Map<String, Engine> byType = new ConcurrentHashMap<>();
        private final Hybrid hybrid = new Hybrid(this);

        public static Engines standard(Knowledge k) {
            var e = new Engines();
            e.add(new Deductive(k));
            e.add(new Inductive(k));
            e.add(new Abductive(k));
            e.add(new PatternMatching(k));
            e.add(new DomainAnalysis(k));
            return e;
        }

        public void add(Engine engine) {
            if (byType.putIfAbsent(engine.type(), engine) != null) {
                warning("Reasoning engine " + engine.type() + " already registered.");
                return;
            }
            message("Reasoning engine registered: " + engine.type());
        }

        public Optional<Engine> engine(String type) {
            return Optional.ofNullable(byType.get(type));
        }

        Collection<Engine> variants() {
            return byType.values().stream().sorted(Comparator.comparing(Engine::type)).toList();
        }

        public Set<String> types() {
            return new TreeSet<>(byType.keySet());
        }

        public Result reason(@Nullable Query query) {
            if (query == null) return Result.failure("No query", TYPE_HYBRID);
            return engine(query.type()).orElse(hybrid).reason(query);
        }
    }
}
