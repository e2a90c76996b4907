package dumb.cogreason;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TasksTest {

    private AbstractTest.TestClock clock;
    private Tasks tasks;

    @BeforeEach
    void setUp() {
        clock = new AbstractTest.TestClock(AbstractTest.EPOCH);
        tasks = new Tasks(clock, Config::defaults);
    }

    private Task submit(Task.Priority p) {
        var t = tasks.create(Reason.Query.of(Reason.TYPE_DEDUCTIVE), Task.Constraints.NONE.priority(p));
        tasks.enqueue(t);
        clock.advance(Duration.ofMillis(1));
        return t;
    }

    @Test
    void dequeueNeverSkipsHigherPriority() {
        var rnd = new Random(42);
        var priorities = Task.Priority.values();
        for (var i = 0; i < 50; i++) submit(priorities[rnd.nextInt(priorities.length)]);

        var previous = Task.Priority.CRITICAL;
        Task t;
        while ((t = tasks.dequeue().orElse(null)) != null) {
            assertTrue(t.priority().compareTo(previous) <= 0, "dequeued " + t.priority() + " after " + previous);
            previous = t.priority();
            tasks.updateTask(t.id(), Task.Status.ASSIGNED, List.of("node_x"));
        }
    }

    @Test
    void earliestSubmittedWinsWithinPriority() {
        var first = submit(Task.Priority.HIGH);
        var low = submit(Task.Priority.LOW);
        var second = submit(Task.Priority.HIGH);

        assertEquals(first.id(), tasks.dequeue().orElseThrow().id());
        assertEquals(second.id(), tasks.dequeue().orElseThrow().id());
        assertEquals(low.id(), tasks.dequeue().orElseThrow().id());
        assertTrue(tasks.dequeue().isEmpty());
    }

    @Test
    void defaultsToMediumPriorityAndInferredCapabilities() {
        var t = tasks.create(Reason.Query.of(Reason.TYPE_ABDUCTIVE), Task.Constraints.NONE);
        assertEquals(Task.Priority.MEDIUM, t.priority());
        assertEquals(Set.of(Capability.ABDUCTIVE), t.requiredCapabilities());
        assertEquals(Task.Status.PENDING, t.status());

        var custom = tasks.create(Reason.Query.of("mystery"), Task.Constraints.NONE.requiredCapabilities(Capability.TENSOR_PROCESSING));
        assertEquals(Set.of(Capability.TENSOR_PROCESSING), custom.requiredCapabilities());
        assertEquals(Set.of(Capability.DEDUCTIVE), Capability.requiredFor("mystery"));
    }

    @Test
    void cancelledTasksAreNotDequeued() {
        var a = submit(Task.Priority.CRITICAL);
        var b = submit(Task.Priority.LOW);
        assertTrue(tasks.transition(a.id(), Task.Status.CANCELLED, "cancelled").isPresent());
        assertEquals(b.id(), tasks.dequeue().orElseThrow().id());
    }

    @Test
    void followsTheStateMachine() {
        var t = submit(Task.Priority.MEDIUM);
        assertTrue(tasks.transition(t.id(), Task.Status.RUNNING, null).isEmpty(), "pending cannot skip to running");
        assertTrue(tasks.updateTask(t.id(), Task.Status.ASSIGNED, List.of("node_a")).isPresent());
        assertTrue(tasks.transition(t.id(), Task.Status.RUNNING, null).isPresent());
        assertTrue(tasks.transition(t.id(), Task.Status.COMPLETED, null).isPresent());
        assertTrue(tasks.transition(t.id(), Task.Status.CANCELLED, null).isEmpty(), "terminal states are final");

        var done = tasks.getTask(t.id()).orElseThrow();
        assertEquals(Task.Status.COMPLETED, done.status());
        assertEquals(List.of("node_a"), done.assignedNodes());
    }

    @ParameterizedTest
    @EnumSource(value = Task.Status.class, names = {"COMPLETED", "FAILED", "TIMEOUT", "CANCELLED"})
    void terminalStatesHaveNoExits(Task.Status terminal) {
        assertTrue(terminal.terminal());
        for (var next : Task.Status.values()) assertFalse(terminal.canTransitionTo(next));
    }

    @Test
    void everyLiveStateCanBeCancelled() {
        for (var s : List.of(Task.Status.PENDING, Task.Status.ASSIGNED, Task.Status.RUNNING))
            assertTrue(s.canTransitionTo(Task.Status.CANCELLED));
    }

    @Test
    void tracksTasksPerNode() {
        var t = submit(Task.Priority.MEDIUM);
        tasks.updateTask(t.id(), Task.Status.ASSIGNED, List.of("node_a", "node_b"));
        assertEquals(1, tasks.assignedTo("node_a").size());
        assertTrue(tasks.assignedTo("node_c").isEmpty());
        tasks.transition(t.id(), Task.Status.FAILED, "boom");
        assertTrue(tasks.assignedTo("node_a").isEmpty());
        assertEquals("boom", tasks.getTask(t.id()).orElseThrow().error());
    }

    @Test
    void cleanupEvictsOnlyOldTerminalTasks() {
        var old = submit(Task.Priority.MEDIUM);
        var live = submit(Task.Priority.MEDIUM);
        tasks.transition(old.id(), Task.Status.CANCELLED, null);

        clock.advance(Duration.ofMillis(Config.defaults().taskRetentionMs() + 1));
        var recent = submit(Task.Priority.MEDIUM);
        tasks.transition(recent.id(), Task.Status.CANCELLED, null);

        assertEquals(1, tasks.cleanup());
        assertTrue(tasks.getTask(old.id()).isEmpty());
        assertTrue(tasks.getTask(live.id()).isPresent());
        assertTrue(tasks.getTask(recent.id()).isPresent());
    }

    @Test
    void statsCountEveryStatus() {
        var ids = new ArrayList<String>();
        for (var i = 0; i < 3; i++) ids.add(submit(Task.Priority.MEDIUM).id());
        tasks.transition(ids.get(0), Task.Status.CANCELLED, null);

        var stats = tasks.getStats();
        assertEquals(Task.Status.values().length, stats.size());
        assertEquals(2L, stats.get(Task.Status.PENDING).longValue());
        assertEquals(1L, stats.get(Task.Status.CANCELLED).longValue());
        assertEquals(0L, stats.get(Task.Status.COMPLETED).longValue());
    }
}
