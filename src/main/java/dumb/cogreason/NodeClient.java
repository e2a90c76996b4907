package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static dumb.cogreason.util.Log.message;

/**
 * The coordinator's view of one reasoning worker. All calls are asynchronous; a future that never
 * completes models a node that stopped answering.
 */
public interface NodeClient {

    CompletableFuture<Reason.Result> executeTask(Reason.Query query, Task.Constraints constraints);

    CompletableFuture<Set<Capability>> getCapabilities();

    CompletableFuture<Status> getStatus();

    CompletableFuture<Void> shutdown();

    /** True once the transport is gone for good; the coordinator then asks its connector again. */
    default boolean closed() {
        return false;
    }

    /** Releases transport resources. The remote worker keeps running. */
    default void close() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Status(Node.Status status, double workload, Node.Performance performance) {
    }

    /** Resolves a registered node's endpoint to a client. */
    @FunctionalInterface
    interface Connector {
        Optional<NodeClient> connect(Node node);

        static Local local() {
            return new Local();
        }
    }

    /** In-process endpoints, bound by name. */
    class Local implements Connector {
        private final Map<String, NodeClient> bound = new ConcurrentHashMap<>();

        public Local bind(String endpoint, NodeClient client) {
            bound.put(endpoint, client);
            message("Bound local endpoint " + endpoint);
            return this;
        }

        @Override
        public Optional<NodeClient> connect(Node node) {
            return Optional.ofNullable(bound.get(node.endpoint()));
        }
    }
}
