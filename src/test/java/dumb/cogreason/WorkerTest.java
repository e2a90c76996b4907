package dumb.cogreason;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static dumb.cogreason.AbstractTest.await;
import static dumb.cogreason.AbstractTest.concept;
import static dumb.cogreason.AbstractTest.waitFor;
import static org.junit.jupiter.api.Assertions.*;

public class WorkerTest {

    private final CountDownLatch gate = new CountDownLatch(1);
    private Worker worker;

    /** Holds every query until the gate opens. */
    private final class Gated implements Reason.Engine {
        @Override
        public String type() {
            return "gated";
        }

        @Override
        public Reason.Result reason(Reason.Query query) {
            try {
                if (!gate.await(AbstractTest.TEST_WAIT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS))
                    return Reason.Result.failure("gate never opened", type());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Reason.Result.failure("interrupted", type());
            }
            return Reason.Result.of(List.of(concept("done")), 0.9, "released");
        }
    }

    @BeforeEach
    void setUp() {
        var engines = new Reason.Engines();
        engines.add(new Gated());
        worker = new Worker("w1", Set.of(Capability.DEDUCTIVE), engines, 2, Executors.newCachedThreadPool(),
                Clock.fixed(AbstractTest.EPOCH, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
        worker.shutdown();
    }

    private static Reason.Query gated() {
        return Reason.Query.of("gated", concept("x"));
    }

    @Test
    void answersThroughItsEngines() {
        gate.countDown();
        var r = await(worker.executeTask(gated(), Task.Constraints.NONE));
        assertEquals(0.9, r.confidence());
        assertEquals(0, worker.activeTasks());
        var p = await(worker.getStatus()).performance();
        assertEquals(1, p.tasksCompleted());
        assertEquals(1, p.reliability());
    }

    @Test
    void rejectsWorkBeyondCapacity() {
        var first = worker.executeTask(gated(), Task.Constraints.NONE);
        var second = worker.executeTask(gated(), Task.Constraints.NONE);
        assertEquals(Node.Status.BUSY, worker.status());
        assertEquals(1.0, worker.workload());

        var e = assertThrows(ReasoningException.class, () -> await(worker.executeTask(gated(), Task.Constraints.NONE)));
        assertEquals(ReasoningException.Kind.NODE_EXECUTION_ERROR, e.kind);

        gate.countDown();
        await(first);
        await(second);
        assertEquals(Node.Status.ONLINE, worker.status());
        assertEquals(0, worker.workload());
    }

    @Test
    void malformedQueryIsRejected() {
        var e = assertThrows(ReasoningException.class, () -> await(worker.executeTask(Reason.Query.of(" "), Task.Constraints.NONE)));
        assertEquals(ReasoningException.Kind.INVALID_QUERY, e.kind);
        assertEquals(0, worker.activeTasks());
    }

    @Test
    void shutdownDrainsInFlightWork() {
        var inFlight = worker.executeTask(gated(), Task.Constraints.NONE);
        var stopped = worker.shutdown();
        assertFalse(stopped.isDone());
        assertEquals(Node.Status.MAINTENANCE, worker.status());
        assertSame(stopped, worker.shutdown());

        var e = assertThrows(ReasoningException.class, () -> await(worker.executeTask(gated(), Task.Constraints.NONE)));
        assertEquals(ReasoningException.Kind.NODE_EXECUTION_ERROR, e.kind);

        gate.countDown();
        assertEquals(0.9, await(inFlight).confidence());
        await(stopped);
        assertEquals(Node.Status.OFFLINE, worker.status());
    }

    @Test
    void heartbeatsReportStatusUntilOffline() {
        var beats = new CopyOnWriteArrayList<Node.Heartbeat>();
        worker.startHeartbeats("node_7", beats::add, Duration.ofMillis(20));
        waitFor(() -> beats.size() >= 2, "two heartbeats");
        var hb = beats.get(0);
        assertEquals("node_7", hb.nodeId());
        assertEquals(Node.Status.ONLINE, hb.status());
        assertEquals(AbstractTest.EPOCH, hb.timestamp());

        await(worker.shutdown());
        assertEquals(Node.Status.OFFLINE, beats.get(beats.size() - 1).status());
    }

    @Test
    void needsACapability() {
        assertThrows(IllegalArgumentException.class, () -> new Worker("empty", Set.of(), new Reason.Engines()));
    }

    @Test
    void registrationCarriesCapabilities() {
        var r = worker.registration("ws://localhost:9000");
        assertEquals("ws://localhost:9000", r.endpoint());
        assertEquals(Set.of(Capability.DEDUCTIVE), r.capabilities());
        assertEquals(Set.of(Capability.DEDUCTIVE), await(worker.getCapabilities()));
    }
}
