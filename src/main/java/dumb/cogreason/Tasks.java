package dumb.cogreason;

import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static dumb.cogreason.Coordinator.id;
import static dumb.cogreason.util.Log.debug;
import static dumb.cogreason.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Task queue: FIFO within each priority class, highest class first. Task records are patched
 * atomically per task id.
 */
public class Tasks {
    public static final String ID_PREFIX_TASK = "task_";

    static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparing(Task::priority, Comparator.reverseOrder())
            .thenComparing(Task::createdAt)
            .thenComparingLong(Task::seq);

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentSkipListSet<Task> pending = new ConcurrentSkipListSet<>(DISPATCH_ORDER);
    private final AtomicLong seq = new AtomicLong();
    private final Clock clock;
    private final Supplier<Config> config;

    Tasks(Clock clock, Supplier<Config> config) {
        this.clock = requireNonNull(clock);
        this.config = requireNonNull(config);
    }

    Task create(Reason.Query query, Task.Constraints constraints) {
        return Task.create(id(ID_PREFIX_TASK), seq.incrementAndGet(), query, constraints, clock.instant());
    }

    /** Accepts any task; capability shortfalls are only discovered at dispatch. */
    public void enqueue(Task task) {
        tasks.put(task.id(), task);
        if (task.status() == Task.Status.PENDING) pending.add(task);
        debug("Task " + task.id() + " enqueued with priority " + task.priority().label());
    }

    /** Highest priority pending task, earliest submitted first. */
    public Optional<Task> dequeue() {
        Task head;
        while ((head = pending.pollFirst()) != null) {
            var current = tasks.get(head.id());
            if (current != null && current.status() == Task.Status.PENDING) return Optional.of(current);
        }
        return Optional.empty();
    }

    public Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Patches status and/or assigned nodes. A status change must be a legal transition; otherwise
     * nothing changes and the result is empty.
     */
    public Optional<Task> updateTask(String taskId, @Nullable Task.Status status, @Nullable List<String> assignedNodes) {
        return updateTask(taskId, status, assignedNodes, null);
    }

    Optional<Task> updateTask(String taskId, @Nullable Task.Status status, @Nullable List<String> assignedNodes, @Nullable String error) {
        var changed = new boolean[1];
        var result = tasks.computeIfPresent(taskId, (k, t) -> {
            if (status != null && status != t.status() && !t.status().canTransitionTo(status)) {
                debug("Task " + taskId + " rejected transition " + t.status().label() + " -> " + status.label());
                return t;
            }
            var next = t;
            if (status != null && status != t.status()) next = next.with(status, clock.instant(), error);
            if (assignedNodes != null) next = next.withAssigned(assignedNodes, clock.instant());
            changed[0] = next != t;
            return next;
        });
        if (result == null || !changed[0]) return Optional.empty();
        if (status != null && result.status() == status && status != Task.Status.PENDING) pending.remove(result);
        return Optional.of(result);
    }

    public Optional<Task> transition(String taskId, Task.Status status, @Nullable String error) {
        return updateTask(taskId, status, null, error);
    }

    /** Non-terminal tasks that list the node among their assignments. */
    public List<Task> assignedTo(String nodeId) {
        return tasks.values().stream()
                .filter(t -> !t.terminal() && t.assignedNodes().contains(nodeId))
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    public List<Task> all() {
        return tasks.values().stream().sorted(Comparator.comparingLong(Task::seq)).toList();
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Evicts terminal tasks that finished longer ago than the retention window. */
    public int cleanup() {
        var cutoff = clock.instant().minus(Duration.ofMillis(config.get().taskRetentionMs()));
        var evicted = 0;
        for (var t : List.copyOf(tasks.values())) {
            if (t.terminal() && t.updatedAt().isBefore(cutoff) && tasks.remove(t.id(), t)) evicted++;
        }
        if (evicted > 0) message("Evicted " + evicted + " finished tasks");
        return evicted;
    }

    public Map<Task.Status, Long> getStats() {
        var stats = new EnumMap<Task.Status, Long>(Task.Status.class);
        for (var s : Task.Status.values()) stats.put(s, 0L);
        tasks.values().forEach(t -> stats.merge(t.status(), 1L, Long::sum));
        return stats;
    }
}
