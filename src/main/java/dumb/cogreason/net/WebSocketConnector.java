package dumb.cogreason.net;

import dumb.cogreason.Capability;
import dumb.cogreason.Node;
import dumb.cogreason.NodeClient;

import java.net.URI;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static dumb.cogreason.util.Log.warning;

/** Resolves {@code ws://} and {@code wss://} endpoints, one shared connection per endpoint. */
public class WebSocketConnector implements NodeClient.Connector, AutoCloseable {

    private final ConcurrentMap<String, WebSocketNodeClient> clients = new ConcurrentHashMap<>();

    static boolean supports(String endpoint) {
        return endpoint.startsWith("ws://") || endpoint.startsWith("wss://");
    }

    @Override
    public Optional<NodeClient> connect(Node node) {
        return client(node.endpoint()).map(c -> c);
    }

    private Optional<WebSocketNodeClient> client(String endpoint) {
        if (!supports(endpoint)) return Optional.empty();
        try {
            return Optional.of(clients.compute(endpoint, (e, c) -> c == null || c.closed() ? new WebSocketNodeClient(URI.create(e)) : c));
        } catch (IllegalArgumentException e) {
            warning("Invalid worker endpoint " + endpoint + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Asks a not yet registered worker what it can do. */
    public CompletableFuture<Set<Capability>> capabilities(String endpoint) {
        return client(endpoint)
                .map(WebSocketNodeClient::getCapabilities)
                .orElseGet(() -> CompletableFuture.failedFuture(new IllegalArgumentException("Unsupported endpoint " + endpoint)));
    }

    @Override
    public void close() {
        clients.values().forEach(WebSocketNodeClient::close);
        clients.clear();
    }
}
