package ch.so.agi.gretllog.logging;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Broadcasts to a list of member loggers with a single point of filtering:
 * the composite's own level decides whether a message is delivered, and every
 * member is opened to {@link Level#TRACE} when it is added. The composite is a
 * chain node itself, so it can sit inside a chain like any other sink.
 * <p>
 * Members are delivered to in the order they were added.
 */
public class CompositeLogger extends BaseLogger {

    private final List<Logger> members = new CopyOnWriteArrayList<>();

    public CompositeLogger(String name, Level minLevel) {
        super(name, minLevel);
    }

    /**
     * Adds a member and sets its level to {@link Level#TRACE}. Adding a member
     * twice has no effect.
     *
     * @param logger the member; {@code null} and the composite itself are ignored
     */
    public void addLogger(Logger logger) {
        if (logger == null || logger == this) {
            return;
        }
        synchronized (members) {
            if (!members.contains(logger)) {
                logger.setLevel(Level.TRACE);
                members.add(logger);
            }
        }
    }

    public boolean removeLogger(Logger logger) {
        return logger != null && members.remove(logger);
    }

    public void clearLoggers() {
        members.clear();
    }

    public int getLoggerCount() {
        return members.size();
    }

    @Override
    protected void doLog(Level level, String msg) {
        for (Logger member : members) {
            member.log(level, msg);
        }
    }
}
