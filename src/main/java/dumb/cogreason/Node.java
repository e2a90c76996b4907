package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Registry view of a remote reasoning worker. Immutable; the registry swaps in new copies when
 * heartbeats, assignments and completions arrive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Node(String id, String endpoint, Set<Capability> capabilities, Status status,
                   Instant lastHeartbeat, Performance performance, double workload, int inFlight,
                   long seq, Map<String, Object> metadata) {

    public Node {
        requireNonNull(id);
        requireNonNull(endpoint);
        requireNonNull(status);
        requireNonNull(lastHeartbeat);
        requireNonNull(performance);
        capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        workload = Atom.Truth.clamp(workload);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static Node registered(String id, long seq, Registration r, Instant now) {
        return new Node(id, r.endpoint(), r.capabilities(), Status.ONLINE, now, Performance.initial(), 0, 0, seq, r.metadata());
    }

    public boolean live(Instant now, Duration timeout) {
        return Duration.between(lastHeartbeat, now).compareTo(timeout) < 0;
    }

    /** Live and in a state that accepts work. */
    public boolean active(Instant now, Duration timeout) {
        return status.available() && live(now, timeout);
    }

    public boolean covers(Collection<Capability> required) {
        return capabilities.containsAll(required);
    }

    public long coverage(Collection<Capability> required) {
        return required.stream().filter(capabilities::contains).count();
    }

    Node withStatus(Status s) {
        return new Node(id, endpoint, capabilities, s, lastHeartbeat, performance, workload, inFlight, seq, metadata);
    }

    Node withHeartbeat(Heartbeat hb, Instant now) {
        return new Node(id, endpoint, capabilities, hb.status(), now,
                hb.performance() != null ? hb.performance() : performance, hb.workload(), inFlight, seq, metadata);
    }

    Node assigned() {
        return new Node(id, endpoint, capabilities, status, lastHeartbeat, performance, workload, inFlight + 1, seq, metadata);
    }

    Node abandoned() {
        return new Node(id, endpoint, capabilities, status, lastHeartbeat, performance, workload, Math.max(0, inFlight - 1), seq, metadata);
    }

    Node released(long elapsedMs, boolean success) {
        return new Node(id, endpoint, capabilities, status, lastHeartbeat, performance.record(elapsedMs, success),
                workload, Math.max(0, inFlight - 1), seq, metadata);
    }

    public enum Status {
        ONLINE, BUSY, ERROR, MAINTENANCE, OFFLINE;

        @JsonCreator
        public static Status of(String s) {
            return valueOf(s.toUpperCase());
        }

        public boolean available() {
            return this == ONLINE || this == BUSY;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase();
        }
    }

    /** Rolling statistics; response time in milliseconds. */
    public record Performance(double avgResponseTime, long tasksCompleted, long tasksErrored, double reliability) {
        static final double EMA_KEEP = 0.9;

        public Performance {
            reliability = Atom.Truth.clamp(reliability);
            avgResponseTime = Math.max(0, avgResponseTime);
        }

        public static Performance initial() {
            return new Performance(0, 0, 0, 1);
        }

        @JsonIgnore
        public long total() {
            return tasksCompleted + tasksErrored;
        }

        public Performance record(long elapsedMs, boolean success) {
            var avg = total() == 0 ? elapsedMs : EMA_KEEP * avgResponseTime + (1 - EMA_KEEP) * elapsedMs;
            var done = tasksCompleted + (success ? 1 : 0);
            var err = tasksErrored + (success ? 0 : 1);
            return new Performance(avg, done, err, (double) done / (done + err));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Registration(String endpoint, Set<Capability> capabilities, @Nullable Map<String, Object> metadata,
                               @Nullable String authToken) {
        public Registration {
            if (endpoint == null || endpoint.isBlank())
                throw new IllegalArgumentException("Registration requires an endpoint");
            if (capabilities == null || capabilities.isEmpty())
                throw new IllegalArgumentException("Registration requires at least one capability");
            capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        }

        public static Registration of(String endpoint, Capability... capabilities) {
            return new Registration(endpoint, EnumSet.copyOf(List.of(capabilities)), null, null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Heartbeat(String nodeId, Status status, double workload, @Nullable Performance performance,
                            @Nullable Instant timestamp) {
        public Heartbeat {
            requireNonNull(nodeId);
            requireNonNull(status);
            workload = Atom.Truth.clamp(workload);
        }

        public static Heartbeat of(String nodeId, Status status, double workload) {
            return new Heartbeat(nodeId, status, workload, null, Instant.now());
        }
    }
}
