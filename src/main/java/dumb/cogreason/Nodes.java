package dumb.cogreason;

import dumb.cogreason.util.Events;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static dumb.cogreason.Coordinator.id;
import static dumb.cogreason.util.Log.debug;
import static dumb.cogreason.util.Log.message;
import static dumb.cogreason.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Node registry. Each node's record is replaced atomically under its own map entry, so heartbeats,
 * assignments and cleanup never contend on a shared lock.
 */
public class Nodes {
    public static final String ID_PREFIX_NODE = "node_";

    private final ConcurrentMap<String, Node> nodes = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong();
    private final Events events;
    private final Clock clock;
    private final Supplier<Config> config;

    Nodes(Events events, Clock clock, Supplier<Config> config) {
        this.events = requireNonNull(events);
        this.clock = requireNonNull(clock);
        this.config = requireNonNull(config);
    }

    /** Every registration gets a fresh id; identical payloads are not deduplicated. */
    public String register(Node.Registration r) {
        var nodeId = id(ID_PREFIX_NODE);
        var node = Node.registered(nodeId, seq.incrementAndGet(), r, clock.instant());
        nodes.put(nodeId, node);
        message("Node " + nodeId + " registered at " + r.endpoint() + " with capabilities: " + r.capabilities());
        events.emit(new Event.NodeRegisteredEvent(node));
        return nodeId;
    }

    public boolean deregister(String nodeId) {
        var removed = nodes.remove(nodeId);
        if (removed == null) return false;
        message("Node " + nodeId + " deregistered");
        events.emit(new Event.NodeDeregisteredEvent(nodeId));
        return true;
    }

    /** Unknown node ids are ignored. */
    public void processHeartbeat(Node.Heartbeat hb) {
        var before = new Node[1];
        var after = nodes.computeIfPresent(hb.nodeId(), (k, n) -> {
            before[0] = n;
            return n.withHeartbeat(hb, clock.instant());
        });
        if (after == null) {
            debug("Heartbeat from unknown node " + hb.nodeId() + " ignored");
            return;
        }
        events.emit(new Event.NodeHeartbeatEvent(hb));
        if (before[0].status() != after.status()) statusChanged(after.id(), before[0].status(), after.status());
    }

    public Optional<Node> get(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<Node> all() {
        return nodes.values().stream().sorted(Comparator.comparingLong(Node::seq)).toList();
    }

    public List<Node> getActiveNodes() {
        var now = clock.instant();
        var timeout = config.get().nodeTimeout();
        return all().stream().filter(n -> n.active(now, timeout)).toList();
    }

    public List<Node> findNodesByCapability(Capability cap) {
        return getActiveNodes().stream().filter(n -> n.capabilities().contains(cap)).toList();
    }

    /** Demotes every stale node to offline and returns the ids that changed. */
    public Set<String> cleanupInactiveNodes() {
        var timeout = config.get().nodeTimeout();
        var demoted = new LinkedHashSet<String>();
        for (var n : all()) {
            if (n.status() == Node.Status.OFFLINE) continue;
            var prior = new Node.Status[1];
            nodes.computeIfPresent(n.id(), (k, cur) -> {
                if (cur.status() == Node.Status.OFFLINE || cur.live(clock.instant(), timeout)) return cur;
                prior[0] = cur.status();
                return cur.withStatus(Node.Status.OFFLINE);
            });
            if (prior[0] != null) {
                warning("Node " + n.id() + " missed heartbeats for " + timeout.toMillis() + "ms, marking offline");
                demoted.add(n.id());
                statusChanged(n.id(), prior[0], Node.Status.OFFLINE);
            }
        }
        return demoted;
    }

    void assign(String nodeId) {
        nodes.computeIfPresent(nodeId, (k, n) -> n.assigned());
    }

    void release(String nodeId, long elapsedMs, boolean success) {
        nodes.computeIfPresent(nodeId, (k, n) -> n.released(elapsedMs, success));
    }

    /** Frees the node's slot for a call nobody waits on any more, without touching its performance. */
    void abandon(String nodeId) {
        nodes.computeIfPresent(nodeId, (k, n) -> n.abandoned());
    }

    private void statusChanged(String nodeId, Node.Status from, Node.Status to) {
        message("Node " + nodeId + " status " + from.label() + " -> " + to.label());
        events.emit(new Event.NodeStatusChangedEvent(nodeId, from, to));
    }
}
