package dumb.cogreason;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.cogreason.util.Events;
import dumb.cogreason.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "eventType",
        visible = true)
@JsonSubTypes({
        @Type(value = Event.NodeRegisteredEvent.class, name = "NodeRegisteredEvent"),
        @Type(value = Event.NodeDeregisteredEvent.class, name = "NodeDeregisteredEvent"),
        @Type(value = Event.NodeHeartbeatEvent.class, name = "NodeHeartbeatEvent"),
        @Type(value = Event.NodeStatusChangedEvent.class, name = "NodeStatusChangedEvent"),
        @Type(value = Event.TaskCreatedEvent.class, name = "TaskCreatedEvent"),
        @Type(value = Event.TaskAssignedEvent.class, name = "TaskAssignedEvent"),
        @Type(value = Event.TaskCompletedEvent.class, name = "TaskCompletedEvent"),
        @Type(value = Event.TaskFailedEvent.class, name = "TaskFailedEvent"),
        @Type(value = Event.TaskRedistributedEvent.class, name = "TaskRedistributedEvent"),
        @Type(value = Event.ConsensusReachedEvent.class, name = "ConsensusReachedEvent"),
        @Type(value = Event.SuspiciousNodeEvent.class, name = "SuspiciousNodeEvent"),
        @Type(value = Event.SystemOverloadedEvent.class, name = "SystemOverloadedEvent"),
        @Type(value = Events.LogMessageEvent.class, name = "LogMessageEvent")
})
public interface Event {

    /** Task this event concerns, if any. */
    @Nullable
    default String assocTask() {
        return null;
    }

    default JsonNode toJson() {
        return Json.node(this);
    }

    String getEventType();

    interface TaskEvent extends Event {
        String taskId();

        @Override
        default String assocTask() {
            return taskId();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record NodeRegisteredEvent(Node node) implements Event {
        @Override
        public String getEventType() {
            return "NodeRegisteredEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record NodeDeregisteredEvent(String nodeId) implements Event {
        @Override
        public String getEventType() {
            return "NodeDeregisteredEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record NodeHeartbeatEvent(Node.Heartbeat heartbeat) implements Event {
        @Override
        public String getEventType() {
            return "NodeHeartbeatEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record NodeStatusChangedEvent(String nodeId, Node.Status from, Node.Status to) implements Event {
        @Override
        public String getEventType() {
            return "NodeStatusChangedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TaskCreatedEvent(Task task) implements TaskEvent {
        @Override
        public String taskId() {
            return task.id();
        }

        @Override
        public String getEventType() {
            return "TaskCreatedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TaskAssignedEvent(String taskId, List<String> nodeIds) implements TaskEvent {
        @Override
        public String getEventType() {
            return "TaskAssignedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TaskCompletedEvent(DistributedResult result) implements TaskEvent {
        @Override
        public String taskId() {
            return result.taskId();
        }

        @Override
        public String getEventType() {
            return "TaskCompletedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TaskFailedEvent(String taskId, Task.Status status, @Nullable ReasoningException.Kind kind,
                           String error) implements TaskEvent {
        @Override
        public String getEventType() {
            return "TaskFailedEvent";
        }
    }

    /** A dead node's share of a running task was handed to {@code replacementNodeId}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TaskRedistributedEvent(String taskId, String failedNodeId, String replacementNodeId) implements TaskEvent {
        @Override
        public String getEventType() {
            return "TaskRedistributedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ConsensusReachedEvent(String taskId, double consensusLevel, int nodesUsed) implements TaskEvent {
        @Override
        public String getEventType() {
            return "ConsensusReachedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SuspiciousNodeEvent(String nodeId, @Nullable String taskId, int strikes) implements Event {
        @Override
        public String assocTask() {
            return taskId;
        }

        @Override
        public String getEventType() {
            return "SuspiciousNodeEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SystemOverloadedEvent(Set<String> overloadedNodes, int activeNodes, double threshold) implements Event {
        @Override
        public String getEventType() {
            return "SystemOverloadedEvent";
        }
    }
}
