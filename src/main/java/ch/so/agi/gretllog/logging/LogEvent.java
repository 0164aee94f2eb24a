package ch.so.agi.gretllog.logging;

import java.time.Instant;

/**
 * A rendered message as delivered to {@link LogEventListener}s.
 */
public final class LogEvent {

    private final String loggerName;
    private final Level level;
    private final String message;
    private final Instant timestamp;

    public LogEvent(String loggerName, Level level, String message, Instant timestamp) {
        this.loggerName = loggerName;
        this.level = level;
        this.message = message;
        this.timestamp = timestamp;
    }

    public String getLoggerName() {
        return loggerName;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return timestamp + " " + level + " " + loggerName + ": " + message;
    }
}
