package dumb.cogreason.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogreason.Coordinator;
import dumb.cogreason.NodeClient;
import dumb.cogreason.Protocol;
import dumb.cogreason.Protocol.Signal;
import dumb.cogreason.ReasoningException;
import dumb.cogreason.Task;
import dumb.cogreason.util.Json;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.jetbrains.annotations.Nullable;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArraySet;

import static dumb.cogreason.Protocol.*;
import static dumb.cogreason.util.Log.*;

/** Serves one worker to remote coordinators over WebSocket. */
public class WorkerServer {
    private static final int STOP_TIMEOUT_MS = 1000;

    private final InetSocketAddress address;
    private final NodeClient worker;
    private final Set<WebSocket> clients = new CopyOnWriteArraySet<>();
    private final CompletableFuture<Integer> started = new CompletableFuture<>();
    @Nullable
    private WebSocketServer server;

    public WorkerServer(InetSocketAddress address, NodeClient worker) {
        this.address = address;
        this.worker = worker;
    }

    public synchronized void start() {
        if (server != null) return;
        server = new WebSocketServer(address) {
            @Override
            public void onOpen(WebSocket conn, ClientHandshake handshake) {
                clients.add(conn);
                message("Coordinator connected: " + conn.getRemoteSocketAddress());
            }

            @Override
            public void onClose(WebSocket conn, int code, String reason, boolean remote) {
                clients.remove(conn);
                message("Coordinator disconnected: " + conn.getRemoteSocketAddress() + " code: " + code + " reason: " + reason);
            }

            @Override
            public void onMessage(WebSocket conn, String message) {
                handleMessage(conn, message);
            }

            @Override
            public void onError(WebSocket conn, Exception ex) {
                error("WebSocket error: " + (conn != null ? conn.getRemoteSocketAddress() : "unknown"), ex);
                if (conn != null) clients.remove(conn);
                else started.completeExceptionally(ex);
            }

            @Override
            public void onStart() {
                message("Worker server started on port " + getPort());
                started.complete(getPort());
            }
        };
        server.setReuseAddr(true);
        server.start();
    }

    /** Completes with the bound port once the server accepts connections. */
    public CompletableFuture<Integer> started() {
        return started;
    }

    public synchronized void stop() {
        if (server == null) return;
        try {
            server.stop(STOP_TIMEOUT_MS);
            message("Worker server stopped.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error("Interrupted while stopping worker server", e);
        }
        server = null;
        clients.clear();
    }

    public int connections() {
        return clients.size();
    }

    private void handleMessage(WebSocket conn, String text) {
        Signal signal;
        try {
            signal = Signal.parse(text);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            error("Unparseable signal: " + text.substring(0, Math.min(text.length(), MAX_PARSE_PREVIEW)) + "... Error: " + e.getMessage());
            send(conn, new Signal(Coordinator.id(ID_PREFIX_SIGNAL), SIGNAL_ERROR,
                    Json.node().put("message", "Failed to parse signal"), null));
            return;
        }

        CompletableFuture<?> reply;
        try {
            reply = switch (signal.type()) {
                case SIGNAL_EXECUTE_TASK -> {
                    var ex = Json.obj(signal.payload(), Protocol.Execute.class);
                    yield worker.executeTask(ex.query(), ex.constraints() != null ? ex.constraints() : Task.Constraints.NONE);
                }
                case SIGNAL_GET_STATUS -> worker.getStatus();
                case SIGNAL_GET_CAPABILITIES -> worker.getCapabilities().thenApply(c -> Map.of("capabilities", c));
                case SIGNAL_SHUTDOWN -> worker.shutdown().thenApply(v -> Map.of("status", "offline"));
                default -> CompletableFuture.failedFuture(new IllegalArgumentException("Unknown signal type: " + signal.type()));
            };
        } catch (JsonProcessingException | RuntimeException e) {
            reply = CompletableFuture.failedFuture(new ReasoningException(ReasoningException.Kind.INVALID_QUERY, null, e.getMessage()));
        }

        reply.whenComplete((value, e) -> {
            if (e == null) {
                send(conn, signal.reply(value));
            } else {
                var cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                var kind = cause instanceof ReasoningException re ? re.kind : ReasoningException.Kind.NODE_EXECUTION_ERROR;
                warning("Signal " + signal.type() + " " + signal.id() + " failed: " + cause.getMessage());
                send(conn, signal.error(String.valueOf(cause.getMessage()), kind));
            }
        });
    }

    private static void send(WebSocket conn, Signal s) {
        if (conn.isOpen()) conn.send(s.json());
        else debug("Dropped reply " + s.inReplyToId() + ", connection closed");
    }
}
