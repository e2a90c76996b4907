package dumb.cogreason.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

public class Log {

    private static final Logger logger = LoggerFactory.getLogger("cogreason");

    private static volatile Events events;

    public static void setEvents(Events events) {
        Log.events = requireNonNull(events);
    }

    public static void clearEvents(Events events) {
        if (Log.events == events) Log.events = null;
    }

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
        publish(message + ": " + t.getMessage(), LogLevel.ERROR);
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
        publish(message, level);
    }

    private static void publish(String message, LogLevel level) {
        var e = events;
        if (e != null && level != LogLevel.DEBUG)
            e.emit(new Events.LogMessageEvent(message, level));
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
