package ch.so.agi.gretllog.logging;

/**
 * Sink that renders into {@link java.util.logging}. The underlying
 * {@code java.util.logging.Logger} carries the same name (or
 * {@value #ROOT_LOGGER_NAME} for the root logger) and is kept at the
 * level matching this logger's level (see {@link Level}), so that handlers
 * attached to it see exactly the messages this logger lets through.
 */
public class CoreJavaLogger extends BaseLogger {

    /**
     * JUL name used for the unnamed root logger, so that its level never
     * touches the JVM-wide JUL root logger.
     */
    public static final String ROOT_LOGGER_NAME = "gretllog.root";

    private final java.util.logging.Logger logger;

    public CoreJavaLogger(String name, Level minLevel) {
        super(name, minLevel);
        this.logger = java.util.logging.Logger.getLogger(getName().isEmpty() ? ROOT_LOGGER_NAME : getName());
        this.logger.setLevel(minLevel.getInnerLevel());
    }

    @Override
    protected void doLog(Level level, String msg) {
        logger.log(level.getInnerLevel(), msg);
    }

    @Override
    public void setLevel(Level level) {
        super.setLevel(level);
        logger.setLevel(level.getInnerLevel());
    }

    java.util.logging.Logger getInnerLogger() {
        return logger;
    }
}
