package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/** Reasoning skill a node advertises. Serialised by its label. */
public enum Capability {
    DEDUCTIVE("deductive"),
    INDUCTIVE("inductive"),
    ABDUCTIVE("abductive"),
    PATTERN_MATCHING("pattern-matching"),
    CODE_ANALYSIS("code-analysis"),
    MULTI_MODAL("multi-modal"),
    TENSOR_PROCESSING("tensor-processing"),
    CROSS_MODAL_FUSION("cross-modal-fusion");

    public final String label;

    Capability(String label) {
        this.label = label;
    }

    public static Optional<Capability> byLabel(String label) {
        return Arrays.stream(values()).filter(c -> c.label.equalsIgnoreCase(label)).findFirst();
    }

    @JsonCreator
    public static Capability fromLabel(String label) {
        return byLabel(label).or(() -> {
            try {
                return Optional.of(valueOf(label.toUpperCase().replace('-', '_')));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }).orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + label));
    }

    /** Capabilities a query of the given type needs; unknown types need deductive. */
    public static Set<Capability> requiredFor(String queryType) {
        return switch (queryType) {
            case "inductive" -> Set.of(INDUCTIVE);
            case "abductive" -> Set.of(ABDUCTIVE);
            case "code-analysis" -> Set.of(CODE_ANALYSIS);
            case "pattern-matching" -> Set.of(PATTERN_MATCHING);
            default -> Set.of(DEDUCTIVE);
        };
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
