package ch.so.agi.gretllog.logging;

/**
 * {@link LogFactory} that creates loggers backed by {@link java.util.logging},
 * for environments where log output is already routed through its handlers.
 */
public class CoreJavaLogFactory implements LogFactory {

    @Override
    public Logger createLogger(String name, Level level) {
        return new CoreJavaLogger(name, level);
    }
}
