package ch.so.agi.gretllog.logging;

/**
 * {@link LogFactory} implementation that delegates to SLF4J. Each created
 * logger is backed by the {@link org.slf4j.Logger} of the same name and
 * therefore also honours the bound backend's level configuration.
 */
public class Slf4jLogFactory implements LogFactory {

    @Override
    public Logger createLogger(String name, Level level) {
        return new Slf4jLogger(name, level);
    }
}
