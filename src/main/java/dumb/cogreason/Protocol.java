package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.cogreason.util.Json;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/** Coordinator/worker wire format: JSON signals, replies matched by {@code inReplyToId}. */
public class Protocol {

    // Coordinator -> worker
    public static final String SIGNAL_EXECUTE_TASK = "execute_task";
    public static final String SIGNAL_GET_STATUS = "get_status";
    public static final String SIGNAL_GET_CAPABILITIES = "get_capabilities";
    public static final String SIGNAL_SHUTDOWN = "shutdown";

    // Worker -> coordinator
    public static final String SIGNAL_RESULT = "result";
    public static final String SIGNAL_ERROR = "error";

    public static final String ID_PREFIX_SIGNAL = "sig_";
    public static final int MAX_PARSE_PREVIEW = 100;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Signal(String id, String type, JsonNode payload, @Nullable String inReplyToId) {
        public Signal {
            requireNonNull(id);
            requireNonNull(type);
            payload = payload == null ? Json.node() : payload;
        }

        public static Signal request(String type, Object payload) {
            return new Signal(Coordinator.id(ID_PREFIX_SIGNAL), type, Json.node(payload), null);
        }

        public Signal reply(Object payload) {
            return new Signal(Coordinator.id(ID_PREFIX_SIGNAL), SIGNAL_RESULT, Json.node(payload), id);
        }

        public Signal error(String message, @Nullable ReasoningException.Kind kind) {
            var p = Json.node().put("message", message);
            if (kind != null) p.put("kind", kind.name());
            return new Signal(Coordinator.id(ID_PREFIX_SIGNAL), SIGNAL_ERROR, p, id);
        }

        public static Signal parse(String text) throws JsonProcessingException {
            var s = Json.obj(text, Signal.class);
            if (s.id().isBlank() || s.type().isBlank())
                throw new IllegalArgumentException("Signal is missing id or type");
            return s;
        }

        public String json() {
            return Json.str(this);
        }
    }

    /** Payload of {@link #SIGNAL_EXECUTE_TASK}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Execute(Reason.Query query, @Nullable Task.Constraints constraints) {
        public Execute {
            requireNonNull(query);
        }
    }
}
