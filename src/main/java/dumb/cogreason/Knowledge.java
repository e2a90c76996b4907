package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static dumb.cogreason.Coordinator.id;
import static dumb.cogreason.util.Log.debug;

/**
 * In-memory atom store. Mutations of one atom are serialised by the map; different atoms proceed
 * concurrently.
 */
public class Knowledge {
    public static final String ID_PREFIX_ATOM = "atom_";

    private final ConcurrentMap<String, Atom> atoms = new ConcurrentHashMap<>();

    /** Upserts; assigns an id when absent. */
    public String addAtom(Atom atom) {
        var id = atom.id() != null ? atom.id() : id(ID_PREFIX_ATOM);
        atoms.put(id, atom.id() != null ? atom : atom.withId(id));
        return id;
    }

    public Optional<Atom> getAtom(String id) {
        return Optional.ofNullable(atoms.get(id));
    }

    public List<Atom> queryAtoms(Pattern pattern) {
        return atoms.values().stream()
                .filter(pattern::matches)
                .sorted(Comparator.comparing(Atom::id))
                .toList();
    }

    public boolean removeAtom(String id) {
        return atoms.remove(id) != null;
    }

    public boolean updateAtom(String id, Patch patch) {
        var updated = atoms.computeIfPresent(id, (k, existing) -> patch.applyTo(existing));
        if (updated != null) debug("Updated atom " + id);
        return updated != null;
    }

    public int size() {
        return atoms.size();
    }

    public void clear() {
        atoms.clear();
    }

    /**
     * Predicate over type, name, truth and outgoing shape. Null fields match anything. Exact matching
     * by default: names compare equal and outgoing arity must agree. With {@code partial}, names
     * match by substring and the outgoing patterns only need to match a prefix.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Pattern(@Nullable String type, @Nullable String name, @Nullable List<Pattern> outgoing,
                          @Nullable Atom.Truth minTruth, boolean partial) {

        public static Pattern ofType(String type) {
            return new Pattern(type, null, null, null, false);
        }

        public static Pattern of(String type, String name) {
            return new Pattern(type, name, null, null, false);
        }

        /** Pattern with the same type, name and outgoing shape as the atom. */
        public static Pattern like(Atom atom) {
            var out = atom.outgoing().isEmpty() ? null : atom.outgoing().stream().map(Pattern::like).toList();
            return new Pattern(atom.type(), atom.name(), out, null, false);
        }

        public Pattern withMinTruth(double strength, double confidence) {
            return new Pattern(type, name, outgoing, new Atom.Truth(strength, confidence), partial);
        }

        public Pattern asPartial() {
            return new Pattern(type, name, outgoing, minTruth, true);
        }

        public boolean matches(Atom atom) {
            if (type != null && !type.equals(atom.type())) return false;
            if (name != null) {
                if (atom.name() == null) return false;
                if (partial ? !atom.name().contains(name) : !name.equals(atom.name())) return false;
            }
            if (minTruth != null) {
                var tv = atom.truthValue();
                if (tv == null || tv.strength() < minTruth.strength() || tv.confidence() < minTruth.confidence())
                    return false;
            }
            if (outgoing != null) {
                var out = atom.outgoing();
                if (partial ? out.size() < outgoing.size() : out.size() != outgoing.size()) return false;
                for (var i = 0; i < outgoing.size(); i++) {
                    var sub = outgoing.get(i);
                    if (partial && !sub.partial) sub = sub.asPartial();
                    if (!sub.matches(out.get(i))) return false;
                }
            }
            return true;
        }
    }

    /** Partial update; null fields keep the existing value. The id never changes. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Patch(@Nullable String type, @Nullable String name, @Nullable Atom.Truth truthValue,
                        @Nullable List<Atom> outgoing, @Nullable Map<String, Object> metadata) {

        public static Patch truth(double strength, double confidence) {
            return new Patch(null, null, new Atom.Truth(strength, confidence), null, null);
        }

        Atom applyTo(Atom a) {
            Map<String, Object> m = a.metadata();
            if (metadata != null) {
                m = new LinkedHashMap<>(a.metadata());
                m.putAll(metadata);
            }
            return new Atom(a.id(),
                    type != null ? type : a.type(),
                    name != null ? name : a.name(),
                    truthValue != null ? truthValue : a.truthValue(),
                    outgoing != null ? outgoing : a.outgoing(),
                    m);
        }
    }
}
