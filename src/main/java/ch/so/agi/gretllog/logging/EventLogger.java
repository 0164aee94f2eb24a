package ch.so.agi.gretllog.logging;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Sink that turns messages into {@link LogEvent}s for UI code. Events are
 * handed to a dispatcher, typically the UI thread's queue such as
 * {@code SwingUtilities::invokeLater}, and the logging thread never waits for
 * the listeners. Events reach the listeners in the order the dispatcher runs
 * them.
 * <p>
 * For every event the listeners registered for its level run first, then the
 * listeners registered for all messages.
 */
public class EventLogger extends BaseLogger {

    private final Executor dispatcher;
    private final Map<Level, List<LogEventListener>> levelListeners = new EnumMap<>(Level.class);
    private final List<LogEventListener> messageListeners = new CopyOnWriteArrayList<>();

    public EventLogger(String name, Executor dispatcher) {
        this(name, Level.TRACE, dispatcher);
    }

    public EventLogger(String name, Level minLevel, Executor dispatcher) {
        super(name, minLevel);
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        for (Level level : Level.values()) {
            levelListeners.put(level, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * @param level    level the listener is interested in
     * @param listener called on the dispatcher for each event of {@code level}
     */
    public void addListener(Level level, LogEventListener listener) {
        levelListeners.get(Objects.requireNonNull(level, "level")).add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @param listener called on the dispatcher for every event
     */
    public void addMessageListener(LogEventListener listener) {
        messageListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(LogEventListener listener) {
        boolean removed = messageListeners.remove(listener);
        for (List<LogEventListener> listeners : levelListeners.values()) {
            removed |= listeners.remove(listener);
        }
        return removed;
    }

    @Override
    protected void doLog(Level level, String msg) {
        LogEvent event = new LogEvent(getName(), level, msg, Instant.now());
        dispatcher.execute(() -> fire(event));
    }

    private void fire(LogEvent event) {
        for (LogEventListener listener : levelListeners.get(event.getLevel())) {
            notify(listener, event);
        }
        for (LogEventListener listener : messageListeners) {
            notify(listener, event);
        }
    }

    private void notify(LogEventListener listener, LogEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            STATUS.log(java.util.logging.Level.WARNING, "Log event listener of '" + getName() + "' failed", e);
        }
    }
}
