package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dumb.cogreason.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Typed knowledge record. Identity is the id; everything else is an immutable value, replaced
 * wholesale on update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Atom(@Nullable String id, String type, @Nullable String name, @Nullable Truth truthValue,
                   List<Atom> outgoing, Map<String, Object> metadata) {

    public Atom {
        requireNonNull(type);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Atom node(String type, String name) {
        return new Atom(null, type, name, null, List.of(), Map.of());
    }

    public static Atom node(String type, String name, double strength, double confidence) {
        return new Atom(null, type, name, new Truth(strength, confidence), List.of(), Map.of());
    }

    public static Atom link(String type, Atom... outgoing) {
        return new Atom(null, type, null, null, List.of(outgoing), Map.of());
    }

    public Atom withId(String id) {
        return new Atom(id, type, name, truthValue, outgoing, metadata);
    }

    public Atom withTruth(double strength, double confidence) {
        return new Atom(id, type, name, new Truth(strength, confidence), outgoing, metadata);
    }

    public Atom withMetadata(String key, Object value) {
        var m = new LinkedHashMap<>(metadata);
        m.put(key, value);
        return new Atom(id, type, name, truthValue, outgoing, m);
    }

    @JsonIgnore
    public double strength() {
        return truthValue == null ? 0 : truthValue.strength();
    }

    @JsonIgnore
    public double confidence() {
        return truthValue == null ? 0 : truthValue.confidence();
    }

    /** Structural shape: type, name and outgoing shapes. Ids, truth values and metadata are left out. */
    @JsonIgnore
    public Map<String, Object> shape() {
        var m = new LinkedHashMap<String, Object>();
        m.put("type", type);
        if (name != null) m.put("name", name);
        if (!outgoing.isEmpty()) m.put("outgoing", outgoing.stream().map(Atom::shape).toList());
        return m;
    }

    /** Canonical string of {@link #shape()}; structurally equal atoms have equal signatures. */
    @JsonIgnore
    public String signature() {
        return Json.canonicalStr(shape());
    }

    public static SortedSet<String> signatures(Collection<Atom> atoms) {
        var s = new TreeSet<String>();
        atoms.forEach(a -> s.add(a.signature()));
        return s;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("(").append(type);
        if (name != null) sb.append(' ').append(name);
        outgoing.forEach(o -> sb.append(' ').append(o));
        sb.append(')');
        if (truthValue != null) sb.append(truthValue);
        return sb.toString();
    }

    /** Probabilistic belief; both fields are clamped to [0,1]. */
    public record Truth(double strength, double confidence) {
        public Truth {
            strength = clamp(strength);
            confidence = clamp(confidence);
        }

        public static double clamp(double v) {
            return Double.isNaN(v) ? 0 : Math.max(0, Math.min(1, v));
        }

        @Override
        public String toString() {
            return String.format("<%.2f,%.2f>", strength, confidence);
        }
    }
}
