package ch.so.agi.gretllog.logging;

/**
 * Creates the sink behind a named logger. Implementations decide the
 * destination (console, {@code java.util.logging}, SLF4J, ...); the
 * {@link LoggerFactory} decides the name and the initial level.
 */
public interface LogFactory {
    /**
     * Creates a logger.
     *
     * @param name  hierarchical logger name as requested by the application;
     *              empty for the root logger
     * @param level initial minimum level resolved from the configuration
     * @return a new, unchained logger
     */
    public Logger createLogger(String name, Level level);
}
