package dumb.cogreason;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogreason.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @Test
    void defaults() {
        var c = Config.defaults();
        assertEquals(10, c.maxNodes());
        assertEquals(30_000, c.defaultTimeoutMs());
        assertEquals(Duration.ofSeconds(5), c.heartbeatInterval());
        assertEquals(Duration.ofSeconds(15), c.nodeTimeout());
        assertEquals(Aggregator.Strategy.CONFIDENCE_WEIGHTED, c.defaultAggregationStrategy());
        assertEquals(0.7, c.minConsensusLevel());
        assertEquals(Balancer.Strategy.LEAST_LOADED, c.loadBalancingStrategy());
        assertEquals(FaultTolerance.Level.BASIC, c.faultToleranceLevel());
        assertTrue(c.enablePerformanceMonitoring());
        assertEquals(3, c.nodesPerTask());
        assertEquals(1, c.minNodeResults());
    }

    @Test
    void loadsPartialFileOverDefaults(@TempDir Path dir) throws Exception {
        var file = dir.resolve("coordinator.json");
        Files.writeString(file, """
                {
                  "maxNodes": 4,
                  "loadBalancingStrategy": "performance-based",
                  "defaultAggregationStrategy": "majority-vote",
                  "faultToleranceLevel": "byzantine",
                  "somethingElse": true
                }
                """);
        var c = Config.load(file);
        assertEquals(4, c.maxNodes());
        assertEquals(Balancer.Strategy.PERFORMANCE_BASED, c.loadBalancingStrategy());
        assertEquals(Aggregator.Strategy.MAJORITY_VOTE, c.defaultAggregationStrategy());
        assertEquals(FaultTolerance.Level.BYZANTINE, c.faultToleranceLevel());
        assertEquals(Config.DEFAULT_HEARTBEAT_INTERVAL_MS, c.heartbeatIntervalMs());
    }

    @Test
    void mergeReplacesOnlyGivenFields() throws Exception {
        var c = Config.defaults().merge(Json.the.readTree("{\"minConsensusLevel\":0.9,\"nodesPerTask\":5}"));
        assertEquals(0.9, c.minConsensusLevel());
        assertEquals(5, c.nodesPerTask());
        assertEquals(Config.defaults().loadBalancingStrategy(), c.loadBalancingStrategy());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"maxNodes\":-1}", Config.class));
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"heartbeatIntervalMs\":0}", Config.class));
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"loadBalancingStrategy\":\"fastest\"}", Config.class));
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"faultToleranceLevel\":\"paranoid\"}", Config.class));
    }

    @Test
    void ratiosAreClamped() throws Exception {
        var c = Json.obj("{\"minConsensusLevel\":1.5,\"similarityThreshold\":-0.2}", Config.class);
        assertEquals(1.0, c.minConsensusLevel());
        assertEquals(0.0, c.similarityThreshold());
    }

    @Test
    void writesStrategyLabels() throws Exception {
        var tree = Json.the.readTree(Json.str(Config.defaults()));
        assertEquals("least-loaded", tree.get("loadBalancingStrategy").asText());
        assertEquals("confidence-weighted", tree.get("defaultAggregationStrategy").asText());
        assertEquals("basic", tree.get("faultToleranceLevel").asText());
        assertNull(tree.get("nodeTimeout"));
        assertEquals(Config.defaults(), Json.obj(tree, Config.class));
    }
}
