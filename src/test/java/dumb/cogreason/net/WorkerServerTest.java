package dumb.cogreason.net;

import dumb.cogreason.*;
import dumb.cogreason.util.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerServerTest {

    private static final long TIMEOUT_SECONDS = 5;

    private Worker worker;
    private WorkerServer server;
    private String endpoint;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        var k = new Knowledge();
        k.addAtom(Atom.node("ConceptNode", "rain", 0.9, 0.9));
        k.addAtom(new Atom(null, "ImplicationLink", null, new Atom.Truth(0.9, 0.9),
                List.of(Atom.node("ConceptNode", "rain"), Atom.node("ConceptNode", "wet")), Map.of()));
        worker = new Worker("remote", EnumSet.of(Capability.DEDUCTIVE, Capability.PATTERN_MATCHING), Reason.Engines.standard(k));
        server = new WorkerServer(new InetSocketAddress("localhost", 0), worker);
        server.start();
        port = server.started().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        endpoint = "ws://localhost:" + port;
    }

    @AfterEach
    void tearDown() {
        server.stop();
        worker.shutdown();
    }

    private static <T> T get(CompletableFuture<T> f) throws Exception {
        return f.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static void waitFor(BooleanSupplier condition, String what) throws InterruptedException {
        var deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("Timed out waiting for " + what);
            Thread.sleep(10);
        }
    }

    /** Heartbeat every 100ms, offline after 400ms of silence. */
    private static Config fastLiveness() throws Exception {
        return Json.obj("{\"heartbeatIntervalMs\":100,\"nodeTimeoutThresholdMs\":400}", Config.class);
    }

    private static Reason.Query deduction() {
        return Reason.Query.of(Reason.TYPE_DEDUCTIVE);
    }

    @Test
    void remoteWorkerAnswersRequests() throws Exception {
        var client = new WebSocketNodeClient(URI.create(endpoint));
        try {
            assertEquals(Set.of(Capability.DEDUCTIVE, Capability.PATTERN_MATCHING), get(client.getCapabilities()));

            var r = get(client.executeTask(Reason.Query.of(Reason.TYPE_DEDUCTIVE), Task.Constraints.NONE));
            assertEquals("wet", r.conclusion().get(0).name());
            assertEquals(0.729, r.confidence(), 1e-9);

            var status = get(client.getStatus());
            assertEquals(Node.Status.ONLINE, status.status());
            assertEquals(1, status.performance().tasksCompleted());
            assertEquals(1, server.connections());
        } finally {
            client.close();
        }
    }

    @Test
    void remoteRejectionKeepsItsKind() throws Exception {
        var client = new WebSocketNodeClient(URI.create(endpoint));
        try {
            var e = assertThrows(ExecutionException.class,
                    () -> get(client.executeTask(Reason.Query.of(" "), Task.Constraints.NONE)));
            var cause = assertInstanceOf(ReasoningException.class, e.getCause());
            assertEquals(ReasoningException.Kind.INVALID_QUERY, cause.kind);
        } finally {
            client.close();
        }
    }

    @Test
    void remoteShutdownTakesWorkerOffline() throws Exception {
        var client = new WebSocketNodeClient(URI.create(endpoint));
        try {
            get(client.shutdown());
            assertEquals(Node.Status.OFFLINE, worker.status());
        } finally {
            client.close();
        }
    }

    @Test
    void coordinatorReasonsThroughRemoteWorkers() throws Exception {
        try (var connector = new WebSocketConnector()) {
            var coordinator = new Coordinator(Config.defaults(), connector);
            try {
                var caps = get(connector.capabilities(endpoint));
                var nodeId = coordinator.registerNode(new Node.Registration(endpoint, caps, null, null));

                var r = coordinator.submitTask(Reason.Query.of(Reason.TYPE_DEDUCTIVE));
                assertEquals(1, r.nodesUsed());
                assertEquals(nodeId, r.nodeResults().get(0).nodeId());
                assertEquals("wet", r.aggregatedResult().conclusion().get(0).name());
                assertEquals(1.0, r.consensusLevel(), 1e-9);
            } finally {
                coordinator.stop();
            }
        }
    }

    @Test
    void remoteNodeStaysLiveWhileWorkerIsUp() throws Exception {
        try (var connector = new WebSocketConnector()) {
            var coordinator = new Coordinator(fastLiveness(), connector);
            try {
                coordinator.start();
                var nodeId = coordinator.registerNode(new Node.Registration(endpoint, get(connector.capabilities(endpoint)), null, null));
                assertEquals(1, coordinator.submitTask(deduction()).nodesUsed());

                Thread.sleep(1000);

                assertEquals(List.of(nodeId), coordinator.getActiveNodes().stream().map(Node::id).toList());
                assertEquals(Node.Status.ONLINE, coordinator.nodes.get(nodeId).orElseThrow().status());
                var r = coordinator.submitTask(deduction());
                assertEquals("wet", r.aggregatedResult().conclusion().get(0).name());
            } finally {
                coordinator.stop();
            }
        }
    }

    @Test
    void restartedWorkerIsReachableAgain() throws Exception {
        try (var connector = new WebSocketConnector()) {
            var coordinator = new Coordinator(fastLiveness(), connector);
            try {
                coordinator.start();
                var nodeId = coordinator.registerNode(new Node.Registration(endpoint, get(connector.capabilities(endpoint)), null, null));
                assertEquals(1, coordinator.submitTask(deduction()).nodesUsed());

                server.stop();
                waitFor(() -> coordinator.nodes.get(nodeId).orElseThrow().status() == Node.Status.OFFLINE, "worker marked offline");

                server = new WorkerServer(new InetSocketAddress("localhost", port), worker);
                server.start();
                get(server.started());
                waitFor(() -> coordinator.getActiveNodes().size() == 1, "restarted worker back online");

                var r = coordinator.submitTask(deduction());
                assertEquals(nodeId, r.nodeResults().get(0).nodeId());
                assertTrue(r.nodeResults().get(0).ok());
            } finally {
                coordinator.stop();
            }
        }
    }

    @Test
    void timedOutRemoteCallIsForgotten() throws Exception {
        var silent = new WorkerServer(new InetSocketAddress("localhost", 0), new Silent());
        silent.start();
        var silentEndpoint = "ws://localhost:" + get(silent.started());
        try (var connector = new WebSocketConnector()) {
            var coordinator = new Coordinator(Config.defaults(), connector);
            try {
                var nodeId = coordinator.registerNode(new Node.Registration(silentEndpoint, Set.of(Capability.DEDUCTIVE), null, null));
                var f = coordinator.submit(deduction(), Task.Constraints.NONE.maxExecutionTime(300));
                var client = (WebSocketNodeClient) connector.connect(coordinator.nodes.get(nodeId).orElseThrow()).orElseThrow();
                waitFor(() -> client.pending() == 1, "request sent");

                var e = assertThrows(ExecutionException.class, () -> get(f));
                assertEquals(ReasoningException.Kind.TASK_TIMEOUT, assertInstanceOf(ReasoningException.class, e.getCause()).kind);
                waitFor(() -> client.pending() == 0, "abandoned request dropped");
                assertEquals(0, coordinator.nodes.get(nodeId).orElseThrow().inFlight());
            } finally {
                coordinator.stop();
                silent.stop();
            }
        }
    }

    /** Accepts tasks and never answers them. */
    private static final class Silent implements NodeClient {
        @Override
        public CompletableFuture<Reason.Result> executeTask(Reason.Query query, Task.Constraints constraints) {
            return new CompletableFuture<>();
        }

        @Override
        public CompletableFuture<Set<Capability>> getCapabilities() {
            return CompletableFuture.completedFuture(Set.of(Capability.DEDUCTIVE));
        }

        @Override
        public CompletableFuture<NodeClient.Status> getStatus() {
            return CompletableFuture.completedFuture(new NodeClient.Status(Node.Status.ONLINE, 0, Node.Performance.initial()));
        }

        @Override
        public CompletableFuture<Void> shutdown() {
            return CompletableFuture.completedFuture(null);
        }
    }

    @Test
    void unsupportedEndpointsAreNotConnected() {
        try (var connector = new WebSocketConnector()) {
            var n = new Node("node_1", "local://x", Set.of(Capability.DEDUCTIVE), Node.Status.ONLINE, Instant.EPOCH,
                    Node.Performance.initial(), 0, 0, 1, Map.of());
            assertTrue(connector.connect(n).isEmpty());
            assertThrows(ExecutionException.class, () -> get(connector.capabilities("http://localhost:1")));
        }
    }
}
