package dumb.cogreason.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.cogreason.*;
import dumb.cogreason.Protocol.Signal;
import dumb.cogreason.util.Json;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import static dumb.cogreason.Protocol.*;
import static dumb.cogreason.util.Log.*;

/** {@link NodeClient} for a worker served by {@link WorkerServer}. Requests wait for the connection to open. */
public class WebSocketNodeClient implements NodeClient {

    private final URI endpoint;
    private final ConcurrentMap<String, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> open = new CompletableFuture<>();
    private final WebSocketClient socket;

    public WebSocketNodeClient(URI endpoint) {
        this.endpoint = endpoint;
        this.socket = new WebSocketClient(endpoint) {
            @Override
            public void onOpen(ServerHandshake handshake) {
                message("Connected to worker " + endpoint);
                open.complete(null);
            }

            @Override
            public void onMessage(String text) {
                handleMessage(text);
            }

            @Override
            public void onClose(int code, String reason, boolean remote) {
                message("Worker connection " + endpoint + " closed, code: " + code + " reason: " + reason);
                var e = unavailable("connection closed: " + reason);
                open.completeExceptionally(e);
                pending.values().forEach(f -> f.completeExceptionally(e));
                pending.clear();
            }

            @Override
            public void onError(Exception ex) {
                warning("Worker connection " + endpoint + " error: " + ex.getMessage());
                open.completeExceptionally(unavailable(String.valueOf(ex.getMessage())));
            }
        };
        socket.connect();
    }

    private ReasoningException unavailable(String why) {
        return new ReasoningException(ReasoningException.Kind.NODE_EXECUTION_ERROR, null, "Worker " + endpoint + " " + why);
    }

    private void handleMessage(String text) {
        Signal s;
        try {
            s = Signal.parse(text);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            error("Unparseable reply from " + endpoint + ": " + text.substring(0, Math.min(text.length(), MAX_PARSE_PREVIEW)));
            return;
        }
        var f = s.inReplyToId() != null ? pending.remove(s.inReplyToId()) : null;
        if (f == null) {
            debug("Unsolicited " + s.type() + " from " + endpoint);
            return;
        }
        if (SIGNAL_ERROR.equals(s.type())) {
            var kindNode = s.payload().get("kind");
            var kind = ReasoningException.Kind.NODE_EXECUTION_ERROR;
            if (kindNode != null) {
                try {
                    kind = ReasoningException.Kind.valueOf(kindNode.asText());
                } catch (IllegalArgumentException e) {
                    debug("Unknown error kind " + kindNode.asText() + " from " + endpoint);
                }
            }
            f.completeExceptionally(new ReasoningException(kind, null, s.payload().path("message").asText("remote error")));
        } else {
            f.complete(s.payload());
        }
    }

    /**
     * Sends once the connection is open. The reply is read by {@code reply}; cancelling or timing out
     * the returned future drops the wait for the reply.
     */
    private <T> CompletableFuture<T> request(String type, Object payload, Function<JsonNode, T> reply) {
        var s = Signal.request(type, payload);
        var f = new CompletableFuture<JsonNode>();
        pending.put(s.id(), f);
        f.whenComplete((v, e) -> pending.remove(s.id()));
        open.whenComplete((v, e) -> {
            if (e != null) {
                f.completeExceptionally(e);
                return;
            }
            if (f.isDone()) return;
            try {
                socket.send(s.json());
            } catch (RuntimeException x) {
                f.completeExceptionally(unavailable("send failed: " + x.getMessage()));
            }
        });
        var r = f.thenApply(reply);
        r.whenComplete((v, e) -> f.cancel(false));
        return r;
    }

    /** Requests still waiting for a reply. */
    public int pending() {
        return pending.size();
    }

    private static <T> T read(JsonNode n, Class<T> type) {
        try {
            return Json.obj(n, type);
        } catch (JsonProcessingException e) {
            throw new CompletionException(e);
        }
    }

    @Override
    public CompletableFuture<Reason.Result> executeTask(Reason.Query query, Task.Constraints constraints) {
        return request(SIGNAL_EXECUTE_TASK, new Protocol.Execute(query, constraints), n -> read(n, Reason.Result.class));
    }

    @Override
    public CompletableFuture<Set<Capability>> getCapabilities() {
        return request(SIGNAL_GET_CAPABILITIES, Json.node(), n -> {
            var caps = EnumSet.noneOf(Capability.class);
            n.path("capabilities").forEach(c -> Capability.byLabel(c.asText()).ifPresent(caps::add));
            return caps;
        });
    }

    @Override
    public CompletableFuture<NodeClient.Status> getStatus() {
        return request(SIGNAL_GET_STATUS, Json.node(), n -> read(n, NodeClient.Status.class));
    }

    @Override
    public CompletableFuture<Void> shutdown() {
        return request(SIGNAL_SHUTDOWN, Json.node(), n -> null);
    }

    @Override
    public boolean closed() {
        return socket.isClosing() || socket.isClosed();
    }

    @Override
    public void close() {
        socket.close();
    }
}
