package dumb.cogreason;

import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static dumb.cogreason.util.Log.*;
import static java.util.Objects.requireNonNull;

/**
 * A reasoning node: runs queries against local engines with bounded concurrency and reports its
 * status through periodic heartbeats.
 */
public class Worker implements NodeClient {
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 5;

    public final String name;
    private final Set<Capability> capabilities;
    private final Reason.Engines engines;
    private final int maxConcurrentTasks;
    private final ExecutorService exe;
    private final Clock clock;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicReference<Node.Performance> performance = new AtomicReference<>(Node.Performance.initial());
    private final CompletableFuture<Void> drained = new CompletableFuture<>();
    private volatile Node.Status status = Node.Status.ONLINE;
    private volatile boolean draining;
    @Nullable
    private CompletableFuture<Void> stopped;
    @Nullable
    private volatile ScheduledExecutorService heartbeats;
    @Nullable
    private volatile Runnable heartbeatTask;

    public Worker(String name, Set<Capability> capabilities, Reason.Engines engines) {
        this(name, capabilities, engines, DEFAULT_MAX_CONCURRENT_TASKS, Executors.newCachedThreadPool(), Clock.systemUTC());
    }

    /** The executor becomes owned by the worker and is shut down with it. */
    public Worker(String name, Set<Capability> capabilities, Reason.Engines engines, int maxConcurrentTasks,
                  ExecutorService exe, Clock clock) {
        if (capabilities.isEmpty()) throw new IllegalArgumentException("Worker " + name + " needs at least one capability");
        if (maxConcurrentTasks < 1) throw new IllegalArgumentException("maxConcurrentTasks must be positive");
        this.name = requireNonNull(name);
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        this.engines = requireNonNull(engines);
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.exe = requireNonNull(exe);
        this.clock = requireNonNull(clock);
    }

    public Node.Registration registration(String endpoint) {
        return new Node.Registration(endpoint, capabilities, null, null);
    }

    @Override
    public CompletableFuture<Reason.Result> executeTask(Reason.Query query, Task.Constraints constraints) {
        if (!status.available() || draining)
            return CompletableFuture.failedFuture(new ReasoningException(ReasoningException.Kind.NODE_EXECUTION_ERROR, null,
                    "Worker " + name + " is " + status.label()));
        var problems = query.problems();
        if (!problems.isEmpty())
            return CompletableFuture.failedFuture(new ReasoningException(ReasoningException.Kind.INVALID_QUERY, null, String.join("; ", problems)));

        int n;
        do {
            n = active.get();
            if (n >= maxConcurrentTasks)
                return CompletableFuture.failedFuture(new ReasoningException(ReasoningException.Kind.NODE_EXECUTION_ERROR, null,
                        "Worker " + name + " at capacity (" + maxConcurrentTasks + " tasks)"));
        } while (!active.compareAndSet(n, n + 1));
        refreshStatus();

        var start = System.nanoTime();
        try {
            return CompletableFuture.supplyAsync(() -> engines.reason(query), exe)
                    .whenComplete((r, e) -> finished(start, e == null && !r.failed()));
        } catch (RejectedExecutionException e) {
            finished(start, false);
            return CompletableFuture.failedFuture(new ReasoningException(ReasoningException.Kind.NODE_EXECUTION_ERROR, null,
                    "Worker " + name + " rejected the task: " + e.getMessage()));
        }
    }

    private void finished(long startNanos, boolean success) {
        var elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        performance.updateAndGet(p -> p.record(elapsed, success));
        var left = active.decrementAndGet();
        refreshStatus();
        if (left == 0 && draining) drained.complete(null);
    }

    private void refreshStatus() {
        var s = status;
        if (s == Node.Status.ONLINE || s == Node.Status.BUSY)
            status = active.get() >= maxConcurrentTasks ? Node.Status.BUSY : Node.Status.ONLINE;
    }

    public double workload() {
        return Math.min(1, (double) active.get() / maxConcurrentTasks);
    }

    public int activeTasks() {
        return active.get();
    }

    public Node.Status status() {
        return status;
    }

    @Override
    public CompletableFuture<Set<Capability>> getCapabilities() {
        return CompletableFuture.completedFuture(capabilities);
    }

    @Override
    public CompletableFuture<NodeClient.Status> getStatus() {
        return CompletableFuture.completedFuture(new NodeClient.Status(status, workload(), performance.get()));
    }

    public Node.Heartbeat heartbeat(String nodeId) {
        return new Node.Heartbeat(nodeId, status, workload(), performance.get(), clock.instant());
    }

    /** Publishes a heartbeat immediately and then every {@code interval} until stopped. */
    public synchronized void startHeartbeats(String nodeId, Consumer<Node.Heartbeat> sink, Duration interval) {
        stopHeartbeats();
        var s = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
        Runnable beat = () -> {
            try {
                sink.accept(heartbeat(nodeId));
            } catch (RuntimeException e) {
                warning("Worker " + name + " heartbeat failed: " + e.getMessage());
            }
        };
        heartbeatTask = beat;
        s.scheduleAtFixedRate(beat, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        heartbeats = s;
    }

    public synchronized void stopHeartbeats() {
        var s = heartbeats;
        if (s != null) s.shutdownNow();
        heartbeats = null;
    }

    /**
     * Stops accepting work, waits for active tasks, then goes offline. A final heartbeat announces
     * the offline status when heartbeats are running.
     */
    @Override
    public synchronized CompletableFuture<Void> shutdown() {
        if (stopped != null) return stopped;
        draining = true;
        status = Node.Status.MAINTENANCE;
        message("Worker " + name + " shutting down, " + active.get() + " tasks in flight");
        if (active.get() == 0) drained.complete(null);
        stopped = drained.thenRun(() -> {
            status = Node.Status.OFFLINE;
            var beat = heartbeatTask;
            if (beat != null && heartbeats != null) beat.run();
            stopHeartbeats();
            exe.shutdown();
            message("Worker " + name + " offline");
        });
        return stopped;
    }

    @Override
    public String toString() {
        return "Worker[" + name + " " + capabilities + " " + status.label() + "]";
    }
}
