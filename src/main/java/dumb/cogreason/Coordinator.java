package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.cogreason.net.WebSocketConnector;
import dumb.cogreason.net.WorkerServer;
import dumb.cogreason.util.Events;
import dumb.cogreason.util.Json;
import dumb.cogreason.util.Log;
import org.jetbrains.annotations.Nullable;

import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static dumb.cogreason.util.Log.*;
import static java.util.Objects.requireNonNull;

/**
 * Turns one reasoning query into parallel node executions and a single aggregated answer.
 * Tasks are dispatched in priority order, at most {@code maxConcurrentTasks} at a time; each
 * dispatched task waits on all of its nodes under one deadline.
 */
public class Coordinator {
    public static final AtomicLong id = new AtomicLong(System.currentTimeMillis());

    static final long THROUGHPUT_WINDOW_MS = 60_000;
    static final double HEALTHY_ACTIVE_RATIO = 0.5;
    static final double HEALTHY_OVERLOADED_RATIO = 0.3;
    static final double HEALTHY_WORKLOAD = 0.9;
    static final double HEALTHY_RELIABILITY = 0.8;
    private static final int EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 2;

    public final Events events;
    public final Nodes nodes;
    public final Tasks tasks;
    public final Balancer balancer;
    public final Aggregator aggregator;
    public final FaultTolerance faultTolerance;

    private final NodeClient.Connector connector;
    private final Clock clock;
    private final AtomicReference<Config> config;
    private final ExecutorService exe = Executors.newCachedThreadPool(daemon("coordinator"));
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(daemon("coordinator-timer"));
    private final ConcurrentMap<String, Run> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<DistributedResult>> futures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, NodeClient> clients = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<Long> completions = new ConcurrentLinkedQueue<>();
    private final AtomicInteger slots = new AtomicInteger();
    @Nullable
    private ScheduledFuture<?> poller;

    public Coordinator(Config config, NodeClient.Connector connector) {
        this(config, connector, Clock.systemUTC());
    }

    public Coordinator(Config config, NodeClient.Connector connector, Clock clock) {
        this.config = new AtomicReference<>(requireNonNull(config));
        this.connector = requireNonNull(connector);
        this.clock = requireNonNull(clock);
        this.events = new Events(Executors.newSingleThreadExecutor(daemon("events")));
        Log.setEvents(events);
        this.nodes = new Nodes(events, clock, this.config::get);
        this.tasks = new Tasks(clock, this.config::get);
        this.balancer = new Balancer();
        this.aggregator = new Aggregator();
        this.faultTolerance = new FaultTolerance(nodes, tasks, events, this.config::get, new Redistribution());
    }

    public static String id(String prefix) {
        return prefix + id.incrementAndGet();
    }

    private static ThreadFactory daemon(String name) {
        var n = new AtomicInteger();
        return r -> {
            var t = new Thread(r, name + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static void main(String[] args) {
        String configFile = null, queryFile = null;
        Integer port = null;
        var endpoints = new ArrayList<String>();

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = args[++i];
                    case "-p", "--port" -> port = Integer.parseInt(args[++i]);
                    case "-n", "--node" -> endpoints.add(args[++i]);
                    case "-q", "--query" -> queryFile = args[++i];
                    default -> warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                error(String.format("Error parsing argument for %s: %s", (i > 0 ? args[i - 1] : args[i]), e.getMessage()));
                printUsageAndExit();
            }
        }

        try {
            var cfg = configFile != null ? Config.load(Path.of(configFile)) : Config.defaults();
            if (port != null) serveWorker(port);
            else coordinate(cfg, endpoints, queryFile);
        } catch (Exception e) {
            error("Startup failed", e);
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [-c config.json] (-p port | -n ws://host:port ... [-q query.json])%n", Coordinator.class.getName());
        System.exit(1);
    }

    private static void serveWorker(int port) throws InterruptedException {
        var knowledge = new Knowledge();
        var worker = new Worker("worker-" + port, EnumSet.allOf(Capability.class), Reason.Engines.standard(knowledge));
        var server = new WorkerServer(new InetSocketAddress(port), worker);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
        Thread.currentThread().join();
    }

    private static void coordinate(Config cfg, List<String> endpoints, @Nullable String queryFile) throws Exception {
        var connector = new WebSocketConnector();
        var c = new Coordinator(cfg, connector);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            c.stop();
            connector.close();
        }));
        c.start();
        for (var e : endpoints) {
            var caps = connector.capabilities(e).get(cfg.defaultTimeoutMs(), TimeUnit.MILLISECONDS);
            c.registerNode(new Node.Registration(e, caps, null, null));
        }
        if (queryFile == null) {
            Thread.currentThread().join();
            return;
        }
        var query = Json.obj(Files.readString(Path.of(queryFile)), Reason.Query.class);
        System.out.println(Json.str(c.submitTask(query, Task.Constraints.NONE)));
        c.stop();
        connector.close();
    }

    public synchronized void start() {
        var c = config.get();
        faultTolerance.start(c.heartbeatInterval());
        schedulePolling(c.heartbeatInterval());
        message("Coordinator started: " + c.loadBalancingStrategy().label() + " balancing, "
                + c.defaultAggregationStrategy().label() + " aggregation, fault tolerance " + c.faultToleranceLevel().label());
    }

    /** Cancels unfinished tasks and releases threads. */
    public synchronized void stop() {
        faultTolerance.stop();
        if (poller != null) poller.cancel(false);
        poller = null;
        tasks.all().stream().filter(t -> !t.terminal()).forEach(t -> cancelTask(t.id()));
        shutdownExecutor(timer, "Coordinator timer");
        shutdownExecutor(exe, "Coordinator executor");
        clients.values().forEach(NodeClient::close);
        clients.clear();
        message("Coordinator stopped");
        Log.clearEvents(events);
        events.shutdown();
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor.isShutdown()) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                warning(name + " did not terminate gracefully, forcing shutdown.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public Config getConfig() {
        return config.get();
    }

    /** Merges the given fields into the configuration. Malformed input leaves it unchanged. */
    public boolean updateConfig(JsonNode partial) {
        if (partial == null || !partial.isObject()) {
            error("Config update must be a JSON object");
            return false;
        }
        try {
            var before = config.get();
            var next = before.merge(partial);
            config.set(next);
            message("Configuration updated: " + Json.str(partial));
            if (next.heartbeatIntervalMs() != before.heartbeatIntervalMs() && faultTolerance.running()) {
                faultTolerance.stop();
                faultTolerance.start(next.heartbeatInterval());
                schedulePolling(next.heartbeatInterval());
            }
            return true;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            error("Rejected configuration update: " + e.getMessage());
            return false;
        }
    }

    public boolean updateConfig(String partialJson) {
        try {
            return updateConfig(Json.obj(partialJson, JsonNode.class));
        } catch (JsonProcessingException e) {
            error("Rejected configuration update: " + e.getMessage());
            return false;
        }
    }

    public String registerNode(Node.Registration registration) {
        return nodes.register(registration);
    }

    /** Removes the node; tasks still waiting on it get a replacement when fault tolerance allows. */
    public boolean deregisterNode(String nodeId) {
        if (!nodes.deregister(nodeId)) return false;
        faultTolerance.forget(nodeId);
        var client = clients.remove(nodeId);
        if (client != null) client.close();
        if (faultTolerance.level().atLeast(FaultTolerance.Level.BASIC)) faultTolerance.redistributeTasks(nodeId);
        return true;
    }

    public void sendHeartbeat(Node.Heartbeat heartbeat) {
        nodes.processHeartbeat(heartbeat);
    }

    private synchronized void schedulePolling(Duration interval) {
        if (poller != null) poller.cancel(false);
        var ms = interval.toMillis();
        poller = timer.scheduleAtFixedRate(() -> {
            try {
                pollNodes();
            } catch (RuntimeException e) {
                error("Node status poll failed", e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
    }

    /**
     * Asks every registered node for its status and records the answers as heartbeats. Offline
     * nodes are asked too, so a restarted worker comes back. Runs every heartbeat interval once started.
     */
    public void pollNodes() {
        var wait = config.get().heartbeatIntervalMs();
        for (var n : nodes.all()) {
            client(n).ifPresent(cl -> cl.getStatus()
                    .orTimeout(wait, TimeUnit.MILLISECONDS)
                    .whenComplete((s, e) -> {
                        if (e != null) debug("Node " + n.id() + " did not answer status poll: " + describe(e));
                        else sendHeartbeat(new Node.Heartbeat(n.id(), s.status(), s.workload(), s.performance(), clock.instant()));
                    }));
        }
    }

    public List<Node> getActiveNodes() {
        return nodes.getActiveNodes();
    }

    public List<Node> getNodesByCapability(Capability capability) {
        return nodes.findNodesByCapability(capability);
    }

    public Optional<Task> getTaskStatus(String taskId) {
        return tasks.getTask(taskId);
    }

    /**
     * Submits and waits for the result.
     *
     * @throws ReasoningException    when the task fails, times out or is rejected
     * @throws CancellationException when the task is cancelled while waiting
     */
    public DistributedResult submitTask(Reason.Query query, Task.Constraints constraints) {
        try {
            return submit(query, constraints).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ReasoningException re) throw re;
            if (e.getCause() instanceof CancellationException ce) throw ce;
            throw new ReasoningException(ReasoningException.Kind.NODE_EXECUTION_ERROR, null, String.valueOf(e.getCause()));
        }
    }

    public DistributedResult submitTask(Reason.Query query) {
        return submitTask(query, Task.Constraints.NONE);
    }

    /** Queues a task. The future fails with {@link ReasoningException}, or is cancelled by {@link #cancelTask}. */
    public CompletableFuture<DistributedResult> submit(Reason.Query query, @Nullable Task.Constraints constraints) {
        var c = constraints != null ? constraints : Task.Constraints.NONE;
        var problems = new ArrayList<>(query.problems());
        problems.addAll(problems(c));
        if (!problems.isEmpty()) {
            var msg = String.join("; ", problems);
            warning("Rejected query: " + msg);
            return CompletableFuture.failedFuture(new ReasoningException(ReasoningException.Kind.INVALID_QUERY, null, msg));
        }
        var task = tasks.create(query, c);
        var future = new CompletableFuture<DistributedResult>();
        futures.put(task.id(), future);
        tasks.enqueue(task);
        message("Task " + task.id() + " submitted: " + query.type() + " requiring " + task.requiredCapabilities());
        events.emit(new Event.TaskCreatedEvent(task));
        pump();
        return future;
    }

    private static List<String> problems(Task.Constraints c) {
        var p = new ArrayList<String>();
        if (c.maxExecutionTime() != null && c.maxExecutionTime() <= 0) p.add("maxExecutionTime must be positive");
        if (c.maxNodes() != null && c.maxNodes() < 0) p.add("maxNodes must not be negative");
        if (c.minConfidence() != null && (c.minConfidence() < 0 || c.minConfidence() > 1))
            p.add("minConfidence must be within [0,1]");
        return p;
    }

    /** Forces a non-terminal task to cancelled. Outstanding node answers are discarded when they arrive. */
    public boolean cancelTask(String taskId) {
        if (tasks.transition(taskId, Task.Status.CANCELLED, "cancelled").isEmpty()) return false;
        var run = runs.get(taskId);
        if (run != null) {
            List<CompletableFuture<Reason.Result>> abandoned;
            synchronized (run) {
                abandoned = unanswered(run);
                run.outstanding.clear();
                close(run);
            }
            abandoned.forEach(call -> call.cancel(false));
        }
        var f = futures.remove(taskId);
        if (f != null) f.cancel(false);
        message("Task " + taskId + " cancelled");
        events.emit(new Event.TaskFailedEvent(taskId, Task.Status.CANCELLED, null, "cancelled"));
        return true;
    }

    private void pump() {
        var max = config.get().maxConcurrentTasks();
        while (true) {
            var n = slots.get();
            if (n >= max) return;
            if (!slots.compareAndSet(n, n + 1)) continue;
            var next = tasks.dequeue();
            if (next.isEmpty()) {
                slots.decrementAndGet();
                return;
            }
            var task = next.get();
            try {
                exe.execute(() -> dispatch(task));
            } catch (RejectedExecutionException e) {
                slots.decrementAndGet();
                fail(task.id(), Task.Status.FAILED, ReasoningException.Kind.NODE_UNAVAILABLE, "Coordinator is stopping", Map.of());
                return;
            }
        }
    }

    private void release() {
        slots.decrementAndGet();
        pump();
    }

    private void dispatch(Task task) {
        try {
            var c = config.get();
            var selected = balancer.selectNodes(task, nodes.getActiveNodes(), c);
            if (selected.isEmpty()) {
                fail(task.id(), Task.Status.FAILED, ReasoningException.Kind.NODE_UNAVAILABLE, unavailable(task, c), Map.of());
                release();
                return;
            }
            var ids = selected.stream().map(Node::id).toList();
            if (tasks.updateTask(task.id(), Task.Status.ASSIGNED, ids).isEmpty()) {
                release();
                return;
            }
            message("Task " + task.id() + " assigned to " + ids);
            events.emit(new Event.TaskAssignedEvent(task.id(), ids));

            var timeout = task.constraints().maxExecutionTime() != null ? task.constraints().maxExecutionTime() : c.defaultTimeoutMs();
            var run = new Run(task, c);
            runs.put(task.id(), run);
            synchronized (run) {
                run.deadline = timer.schedule(() -> expire(run), timeout, TimeUnit.MILLISECONDS);
                run.dispatching = true;
                selected.forEach(n -> send(run, n));
                run.dispatching = false;
                if (!run.done && run.outstanding.isEmpty()) finish(run, Set.of());
            }
            deliver(run);
        } catch (RuntimeException e) {
            error("Dispatch of " + task.id() + " failed", e);
            var run = runs.get(task.id());
            if (run != null) {
                synchronized (run) {
                    if (close(run)) fail(run, Task.Status.FAILED, ReasoningException.Kind.NODE_EXECUTION_ERROR, String.valueOf(e), Map.of());
                }
                deliver(run);
            } else {
                fail(task.id(), Task.Status.FAILED, ReasoningException.Kind.NODE_EXECUTION_ERROR, String.valueOf(e), Map.of());
                release();
            }
        }
    }

    private static String unavailable(Task task, Config c) {
        var k = task.constraints();
        if (Balancer.requested(k, c) == 0) return "Task " + task.id() + " allows no nodes (maxNodes=0)";
        if (k.requireAllNodes())
            return "Task " + task.id() + " requires " + Balancer.requested(k, c) + " nodes with " + task.requiredCapabilities() + ", not all available";
        return "No live node with capabilities " + task.requiredCapabilities() + " for task " + task.id();
    }

    /** The node's cached client, reconnecting when the cached one was closed. */
    private Optional<NodeClient> client(Node n) {
        return Optional.ofNullable(clients.compute(n.id(), (k, cached) -> {
            if (cached != null && !cached.closed()) return cached;
            if (cached != null) {
                debug("Client for " + k + " closed, reconnecting to " + n.endpoint());
                cached.close();
            }
            return connector.connect(n).orElse(null);
        }));
    }

    /** Called with the run's lock held. */
    private void send(Run run, Node node) {
        var nodeId = node.id();
        run.dispatched.add(nodeId);
        var client = client(node);
        if (client.isEmpty()) {
            warning("Node " + nodeId + " has no reachable endpoint " + node.endpoint());
            run.results.add(NodeResult.failure(nodeId, "No client for endpoint " + node.endpoint(), 0, node.performance().reliability()));
            return;
        }
        nodes.assign(nodeId);
        run.outstanding.add(nodeId);
        var start = System.nanoTime();
        CompletableFuture<Reason.Result> call;
        try {
            call = client.get().executeTask(run.task.query(), run.task.constraints());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (!call.isCompletedExceptionally() && !run.acked) {
            run.acked = true;
            tasks.transition(run.task.id(), Task.Status.RUNNING, null)
                    .ifPresent(t -> message("Task " + t.id() + " running"));
        }
        run.calls.put(nodeId, call);
        call.whenComplete((r, e) -> arrived(run, nodeId, start, r, e));
    }

    private void arrived(Run run, String nodeId, long startNanos, @Nullable Reason.Result r, @Nullable Throwable e) {
        var elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        var success = e == null && r != null && !r.failed();
        if (e instanceof CancellationException) {
            boolean expired;
            synchronized (run) {
                expired = run.expired;
            }
            if (expired) nodes.release(nodeId, elapsed, false);
            else nodes.abandon(nodeId);
            debug("Call to " + nodeId + " for " + run.task.id() + " cancelled");
            return;
        }
        nodes.release(nodeId, elapsed, success);
        synchronized (run) {
            if (run.done || !run.outstanding.remove(nodeId)) {
                debug("Late answer from " + nodeId + " for " + run.task.id() + " discarded");
                return;
            }
            var reliability = nodes.get(nodeId).map(n -> n.performance().reliability()).orElse(0.0);
            NodeResult nr;
            if (success) {
                nr = NodeResult.success(nodeId, r, elapsed, reliability);
            } else {
                var reason = e != null ? describe(e) : r != null ? r.explanation() : "no result";
                warning("Node " + nodeId + " failed on " + run.task.id() + ": " + reason);
                nr = NodeResult.failure(nodeId, reason, elapsed, reliability);
            }
            run.results.add(nr);
            if (!run.dispatching && run.outstanding.isEmpty()) finish(run, Set.of());
        }
        deliver(run);
    }

    private static String describe(Throwable e) {
        var cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private void expire(Run run) {
        List<CompletableFuture<Reason.Result>> abandoned;
        synchronized (run) {
            if (run.done) return;
            var late = new LinkedHashSet<>(run.outstanding);
            abandoned = unanswered(run);
            run.outstanding.clear();
            run.expired = true;
            if (!late.isEmpty()) warning("Task " + run.task.id() + " deadline passed, no answer from " + late);
            finish(run, late);
        }
        deliver(run);
        abandoned.forEach(call -> call.cancel(false));
    }

    /** Calls still awaited. Called with the run's lock held. */
    private static List<CompletableFuture<Reason.Result>> unanswered(Run run) {
        return run.outstanding.stream().map(run.calls::get).filter(Objects::nonNull).toList();
    }

    /** Completes the caller's future outside the run's lock; a no-op while this thread still holds it. */
    private static void deliver(Run run) {
        if (Thread.holdsLock(run)) return;
        List<Runnable> ready;
        synchronized (run) {
            ready = List.copyOf(run.deliveries);
            run.deliveries.clear();
        }
        ready.forEach(Runnable::run);
    }

    /** Marks the run finished; true only for the first caller. Called with the run's lock held. */
    private boolean close(Run run) {
        if (run.done) return false;
        run.done = true;
        runs.remove(run.task.id(), run);
        if (run.deadline != null) run.deadline.cancel(false);
        release();
        return true;
    }

    /** Decides the task's outcome from what arrived. Called with the run's lock held. */
    private void finish(Run run, Set<String> timedOut) {
        if (!close(run)) return;
        var c = run.config;
        var task = run.task;
        var k = task.constraints();
        var taskId = task.id();

        var ok = run.results.stream().filter(NodeResult::ok).toList();
        var failedNodes = new LinkedHashMap<String, String>();
        run.results.stream().filter(r -> !r.ok()).forEach(r -> failedNodes.put(r.nodeId(), r.error()));
        var nodeErrors = new LinkedHashMap<>(failedNodes);
        run.evicted.forEach(nodeErrors::putIfAbsent);
        timedOut.forEach(id -> nodeErrors.putIfAbsent(id, "timed out"));

        if (k.requireAllNodes() && !timedOut.isEmpty()) {
            fail(run, Task.Status.TIMEOUT, ReasoningException.Kind.TASK_TIMEOUT, "Not every required node answered in time", nodeErrors);
            return;
        }
        if (k.requireAllNodes() && !failedNodes.isEmpty()) {
            fail(run, Task.Status.FAILED, ReasoningException.Kind.NODE_EXECUTION_ERROR, "Required nodes failed", nodeErrors);
            return;
        }
        if (ok.size() < c.minNodeResults()) {
            var msg = ok.size() + " successful node results, " + c.minNodeResults() + " needed";
            if (!timedOut.isEmpty())
                fail(run, Task.Status.TIMEOUT, ReasoningException.Kind.TASK_TIMEOUT, msg, nodeErrors);
            else if (!nodeErrors.isEmpty())
                fail(run, Task.Status.FAILED, ReasoningException.Kind.NODE_EXECUTION_ERROR, msg, nodeErrors);
            else
                fail(run, Task.Status.FAILED, ReasoningException.Kind.AGGREGATION_FAILURE, msg, nodeErrors);
            return;
        }

        if (faultTolerance.level().atLeast(FaultTolerance.Level.HIGH)) faultTolerance.validateResults(taskId, ok);
        var excluded = new LinkedHashMap<String, String>();
        var suspects = faultTolerance.suspects();
        var minConfidence = k.minConfidence() != null ? k.minConfidence() : 0;
        var usable = new ArrayList<NodeResult>();
        for (var r : ok) {
            if (suspects.contains(r.nodeId())) excluded.put(r.nodeId(), "suspect");
            else if (r.confidence() < minConfidence) excluded.put(r.nodeId(), "below minConfidence");
            else usable.add(r);
        }

        var strategy = k.aggregation() != null ? k.aggregation() : c.defaultAggregationStrategy();
        Aggregator.Aggregation a;
        try {
            a = aggregator.aggregate(taskId, usable, strategy, c);
        } catch (ReasoningException e) {
            fail(run, Task.Status.FAILED, e.kind, e.getMessage(), nodeErrors);
            return;
        }

        var meta = new LinkedHashMap<String, Object>();
        meta.put("aggregationStrategy", strategy.label());
        if (a.selectedNode() != null) meta.put("selectedNode", a.selectedNode());
        meta.put("faultToleranceLevel", faultTolerance.level().label());
        var participation = new LinkedHashMap<String, Integer>();
        run.results.forEach(r -> participation.put(r.nodeId(), r.ok() ? 1 : 0));
        meta.put("participation", participation);
        if (!timedOut.isEmpty()) meta.put("timedOutNodes", List.copyOf(timedOut));
        if (!failedNodes.isEmpty()) meta.put("failedNodes", failedNodes);
        if (!run.evicted.isEmpty()) meta.put("evictedNodes", new LinkedHashMap<>(run.evicted));
        if (!run.redistributed.isEmpty()) meta.put("redistributed", List.copyOf(run.redistributed));
        if (!excluded.isEmpty()) meta.put("excludedNodes", excluded);
        meta.put("qualityMetrics", Map.of(
                "consistency", a.consensusLevel(),
                "recall", (double) ok.size() / run.dispatched.size(),
                "reliability", ok.stream().mapToDouble(NodeResult::reliability).average().orElse(0)));
        meta.put("distributionEfficiency", run.results.isEmpty() ? 0.0 : (double) ok.size() / run.results.size());

        var result = new DistributedResult(taskId, run.results, a.result(), a.consensusLevel(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - run.startNanos), run.results.size(), meta);

        if (tasks.getTask(taskId).map(t -> t.status() == Task.Status.ASSIGNED).orElse(false))
            tasks.transition(taskId, Task.Status.RUNNING, null);
        if (tasks.transition(taskId, Task.Status.COMPLETED, null).isEmpty()) return;
        completions.add(clock.millis());
        message(String.format("Task %s completed by %d nodes, consensus %.3f, confidence %.3f",
                taskId, result.nodesUsed(), result.consensusLevel(), result.aggregatedResult().confidence()));
        var f = futures.remove(taskId);
        if (f != null) run.deliveries.add(() -> f.complete(result));
        events.emit(new Event.TaskCompletedEvent(result));
        if (result.consensusLevel() >= c.minConsensusLevel())
            events.emit(new Event.ConsensusReachedEvent(taskId, result.consensusLevel(), result.nodesUsed()));
    }

    private void fail(String taskId, Task.Status status, ReasoningException.Kind kind, String msg, Map<String, String> nodeErrors) {
        var e = failed(taskId, status, kind, msg, nodeErrors);
        var f = futures.remove(taskId);
        if (e != null && f != null) f.completeExceptionally(e);
    }

    /** Like {@link #fail(String, Task.Status, ReasoningException.Kind, String, Map)}, deferring the future to {@link #deliver}. */
    private void fail(Run run, Task.Status status, ReasoningException.Kind kind, String msg, Map<String, String> nodeErrors) {
        var e = failed(run.task.id(), status, kind, msg, nodeErrors);
        var f = futures.remove(run.task.id());
        if (e != null && f != null) run.deliveries.add(() -> f.completeExceptionally(e));
    }

    @Nullable
    private ReasoningException failed(String taskId, Task.Status status, ReasoningException.Kind kind, String msg, Map<String, String> nodeErrors) {
        if (tasks.transition(taskId, status, msg).isEmpty()) return null;
        var e = new ReasoningException(kind, taskId, msg, nodeErrors);
        error("Task " + taskId + " " + status.label() + ": " + e.getMessage());
        events.emit(new Event.TaskFailedEvent(taskId, status, kind, e.getMessage()));
        return e;
    }

    /** Replaces an evicted node within a running task. */
    Optional<String> topUp(String taskId, String failedNodeId) {
        var run = runs.get(taskId);
        if (run == null) return Optional.empty();
        try {
            return replace(run, failedNodeId);
        } finally {
            deliver(run);
            CompletableFuture<Reason.Result> lost;
            synchronized (run) {
                lost = run.evicted.containsKey(failedNodeId) ? run.calls.get(failedNodeId) : null;
            }
            if (lost != null) lost.cancel(false);
        }
    }

    private Optional<String> replace(Run run, String failedNodeId) {
        var taskId = run.task.id();
        synchronized (run) {
            if (run.done || !run.outstanding.remove(failedNodeId)) return Optional.empty();
            run.evicted.put(failedNodeId, "node went offline");

            var excluded = new ArrayList<>(run.task.constraints().excludedNodes());
            excluded.addAll(run.dispatched);
            var k = run.task.constraints();
            var substitute = new Task(taskId, run.task.query(), run.task.priority(), run.task.requiredCapabilities(),
                    new Task.Constraints(k.maxExecutionTime(), k.minConfidence(), 1, k.preferredNodes(), excluded,
                            false, k.priority(), k.requiredCapabilities(), k.aggregation(), k.balancing()),
                    run.task.status(), run.task.assignedNodes(), run.task.createdAt(), run.task.updatedAt(), run.task.seq(), null);
            var picked = balancer.selectNodes(substitute, nodes.getActiveNodes(), config.get());
            if (picked.isEmpty()) {
                if (run.outstanding.isEmpty()) finish(run, Set.of());
                return Optional.empty();
            }
            var replacement = picked.get(0);
            run.redistributed.add(replacement.id());
            var assigned = tasks.getTask(taskId).map(Task::assignedNodes).orElse(List.of()).stream()
                    .filter(id -> !id.equals(failedNodeId)).collect(Collectors.toCollection(ArrayList::new));
            assigned.add(replacement.id());
            tasks.updateTask(taskId, null, assigned);
            events.emit(new Event.TaskRedistributedEvent(taskId, failedNodeId, replacement.id()));
            send(run, replacement);
            if (!run.done && run.outstanding.isEmpty()) finish(run, Set.of());
            return Optional.of(replacement.id());
        }
    }

    public Stats getSystemStats() {
        var now = clock.millis();
        while (true) {
            var head = completions.peek();
            if (head == null || now - head <= THROUGHPUT_WINDOW_MS) break;
            completions.poll();
        }
        var all = nodes.all();
        var active = nodes.getActiveNodes();
        var utilization = new LinkedHashMap<String, Double>();
        active.forEach(n -> utilization.put(n.id(), n.workload()));
        var caps = new EnumMap<Capability, Integer>(Capability.class);
        active.forEach(n -> n.capabilities().forEach(cap -> caps.merge(cap, 1, Integer::sum)));
        var perTask = tasks.getStats();
        return new Stats(all.size(), active.size(), perTask,
                perTask.get(Task.Status.PENDING).intValue(),
                (int) (perTask.get(Task.Status.ASSIGNED) + perTask.get(Task.Status.RUNNING)),
                completions.size() / (THROUGHPUT_WINDOW_MS / 1000.0),
                active.stream().filter(n -> n.performance().total() > 0).mapToDouble(n -> n.performance().avgResponseTime()).average().orElse(0),
                active.stream().mapToDouble(Node::workload).average().orElse(0),
                utilization, caps, clock.instant());
    }

    public Health healthCheck() {
        var c = config.get();
        var active = nodes.getActiveNodes();
        var issues = new ArrayList<String>();
        if (active.isEmpty()) {
            issues.add("No active reasoning nodes");
        } else {
            if (active.size() < c.maxNodes() * HEALTHY_ACTIVE_RATIO)
                issues.add("Only " + active.size() + " of " + c.maxNodes() + " nodes active");
            var busy = active.stream().filter(n -> n.workload() > HEALTHY_WORKLOAD).count();
            if (busy > active.size() * HEALTHY_OVERLOADED_RATIO)
                issues.add(busy + " of " + active.size() + " nodes overloaded");
            active.stream().filter(n -> n.performance().reliability() < HEALTHY_RELIABILITY)
                    .forEach(n -> issues.add(String.format("Node %s reliability %.2f", n.id(), n.performance().reliability())));
        }
        return new Health(issues.isEmpty(), issues);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Stats(int totalNodes, int activeNodes, Map<Task.Status, Long> tasks, int pendingTasks,
                        int runningTasks, double throughput, double avgResponseTime, double averageUtilization,
                        Map<String, Double> nodeUtilization, Map<Capability, Integer> capabilityDistribution,
                        Instant timestamp) {
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Health(boolean healthy, List<String> issues) {
        public Health {
            issues = List.copyOf(issues);
        }
    }

    /** Per-task execution state; every field is guarded by the instance's monitor. */
    private static final class Run {
        final Task task;
        final Config config;
        final long startNanos = System.nanoTime();
        final List<NodeResult> results = new ArrayList<>();
        final Set<String> outstanding = new LinkedHashSet<>();
        final Set<String> dispatched = new LinkedHashSet<>();
        final Map<String, String> evicted = new LinkedHashMap<>();
        final List<String> redistributed = new ArrayList<>();
        final Map<String, CompletableFuture<Reason.Result>> calls = new HashMap<>();
        final List<Runnable> deliveries = new ArrayList<>();
        @Nullable
        ScheduledFuture<?> deadline;
        boolean dispatching, acked, done, expired;

        Run(Task task, Config config) {
            this.task = task;
            this.config = config;
        }
    }

    private final class Redistribution implements FaultTolerance.Redistributor {
        @Override
        public Optional<String> topUp(String taskId, String failedNodeId) {
            return Coordinator.this.topUp(taskId, failedNodeId);
        }

        @Override
        public boolean awaiting(String taskId, String nodeId) {
            var run = runs.get(taskId);
            if (run == null) return false;
            synchronized (run) {
                return !run.done && run.outstanding.contains(nodeId);
            }
        }
    }
}
