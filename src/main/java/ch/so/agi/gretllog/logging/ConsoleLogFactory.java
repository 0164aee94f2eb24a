package ch.so.agi.gretllog.logging;

/**
 * {@link LogFactory} creating {@link ConsoleLogger}s writing to
 * {@code System.out}. This is the default when nothing else is configured.
 */
public class ConsoleLogFactory implements LogFactory {

    @Override
    public Logger createLogger(String name, Level level) {
        return new ConsoleLogger(name, level);
    }
}
