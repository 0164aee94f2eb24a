package ch.so.agi.gretllog.logging;

/**
 * {@link LogFactory} that silences all logging.
 */
public class NullLogFactory implements LogFactory {

    @Override
    public Logger createLogger(String name, Level level) {
        return new NullLogger(name);
    }
}
