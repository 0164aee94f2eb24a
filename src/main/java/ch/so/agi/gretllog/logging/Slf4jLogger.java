package ch.so.agi.gretllog.logging;

import java.util.Objects;

import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Sink that bridges to SLF4J, so messages end up in whatever backend the
 * application binds (Logback, Log4j, ...). SLF4J has no fatal level; fatal
 * messages are logged as errors carrying the {@link #FATAL} marker.
 * <p>
 * The SLF4J backend applies its own level configuration after this logger's
 * level.
 */
public class Slf4jLogger extends BaseLogger {

    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    private final org.slf4j.Logger logger;

    public Slf4jLogger(String name, Level minLevel) {
        this(name, minLevel, LoggerFactory.getLogger(
                name == null || name.isEmpty() ? org.slf4j.Logger.ROOT_LOGGER_NAME : name));
    }

    public Slf4jLogger(String name, Level minLevel, org.slf4j.Logger logger) {
        super(name, minLevel);
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    protected void doLog(Level level, String msg) {
        switch (level) {
            case TRACE:
                logger.trace(msg);
                break;
            case DEBUG:
                logger.debug(msg);
                break;
            case INFO:
                logger.info(msg);
                break;
            case WARN:
                logger.warn(msg);
                break;
            case ERROR:
                logger.error(msg);
                break;
            case FATAL:
                logger.error(FATAL, msg);
                break;
            default:
                throw new IllegalStateException("Unexpected level " + level);
        }
    }
}
