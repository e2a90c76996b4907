package dumb.cogreason.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import static dumb.cogreason.util.Log.error;

public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /** Key-sorted, whitespace-free output; equal values always serialise to equal strings. */
    public static final ObjectMapper canonical = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public static String str(Object obj) {
        try {
            return the.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            error("Error serializing object to JSON", e);
            return "{}";
        }
    }

    public static String canonicalStr(Object obj) {
        try {
            return canonical.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value has no canonical JSON form: " + obj, e);
        }
    }

    public static JsonNode node(Object obj) {
        try {
            return the.valueToTree(obj);
        } catch (IllegalArgumentException e) {
            error("Error converting object to JsonNode", e);
            return the.createObjectNode();
        }
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(JsonNode json, Class<T> valueType) throws JsonProcessingException {
        return the.treeToValue(json, valueType);
    }

    /** Overlays the fields of {@code patch} onto the JSON form of {@code base} and reads the result back. */
    public static <T> T merge(T base, JsonNode patch, Class<T> valueType) throws JsonProcessingException {
        if (patch == null || !patch.isObject())
            throw new IllegalArgumentException("Patch must be a JSON object");
        var tree = (ObjectNode) the.valueToTree(base);
        tree.setAll((ObjectNode) patch);
        return the.treeToValue(tree, valueType);
    }

    public static ObjectNode node() {
        return the.createObjectNode();
    }
}
