package dumb.cogreason.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import dumb.cogreason.Event;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Asynchronous publish/subscribe bus. A listener registered for a type receives every event that is
 * an instance of it, so {@code on(Event.class, ...)} observes everything.
 */
public class Events {
    public final ExecutorService exe;
    private final ConcurrentMap<Class<? extends Event>, CopyOnWriteArrayList<Consumer<Event>>> listeners = new ConcurrentHashMap<>();

    public Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<Event> listener, Event event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            Log.error("Error processing event listener for " + event.getClass().getSimpleName(), e);
        }
    }

    public <T extends Event> Subscription on(Class<T> eventType, Consumer<T> listener) {
        Consumer<Event> wrapped = event -> listener.accept(eventType.cast(event));
        var list = listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        list.add(wrapped);
        return () -> list.remove(wrapped);
    }

    public int listenerCount() {
        return listeners.values().stream().mapToInt(CopyOnWriteArrayList::size).sum();
    }

    public void emit(Event event) {
        if (exe.isShutdown()) return;
        try {
            exe.execute(() -> listeners.forEach((type, list) -> {
                if (type.isInstance(event)) list.forEach(listener -> exeSafe(listener, event));
            }));
        } catch (RejectedExecutionException e) {
            Log.debug("Dropped " + event.getEventType() + " emitted during shutdown");
        }
    }

    public void shutdown() {
        exe.shutdown();
    }

    /** Handle returned by {@link #on}; closing it detaches the listener. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LogMessageEvent(String message, Log.LogLevel level) implements Event {
        public LogMessageEvent {
            requireNonNull(message);
            requireNonNull(level);
        }

        @Override
        public String getEventType() {
            return "LogMessageEvent";
        }
    }
}
