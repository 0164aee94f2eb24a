package ch.so.agi.gretllog.logging;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.Objects;

import ch.so.agi.gretllog.utils.LoggerNameFormatter;
import ch.so.agi.gretllog.utils.ThrowableFormatter;

/**
 * Base class for all sinks. A sink renders messages that pass its own minimum
 * level through {@link #doLog(Level, String)} and then forwards every message,
 * rendered or not, to the next logger of its chain:
 *
 * <pre>
 * Logger console = new ConsoleLogger("app", Level.DEBUG);
 * console.addToChain(new Slf4jLogger("app", Level.WARN));
 * console.info("started");   // rendered by the console only
 * console.error("failed");   // rendered by both
 * </pre>
 *
 * Level filtering is therefore per node; there is no chain-wide threshold.
 * <p>
 * Each node guards its own level and successor with its own lock. Chain walks
 * hold at most one node's lock at a time, so a walk that races with a
 * structural change may see a slightly stale chain. At worst a message reaches
 * a logger that was just removed or misses one that was just added.
 */
public abstract class BaseLogger implements Logger {

    static final java.util.logging.Logger STATUS =
            java.util.logging.Logger.getLogger(BaseLogger.class.getName());

    private final String name;
    private final Object chainLock = new Object();

    private volatile Level minLevel;
    private volatile ConfigurationCheck configurationCheck;
    private volatile boolean stackTraceEnabled = true;

    // guarded by chainLock
    private Logger next;

    protected BaseLogger(String name, Level minLevel) {
        this.name = name == null ? "" : name;
        this.minLevel = Objects.requireNonNull(minLevel, "minLevel");
    }

    /**
     * Renders a message that passed this logger's level. Only called for
     * enabled levels.
     *
     * @param level severity of the message
     * @param msg   fully formatted message
     */
    protected abstract void doLog(Level level, String msg);

    /**
     * Runs the configuration check, renders the message if its level is
     * enabled and forwards it to the next logger of the chain.
     */
    protected void logMessage(Level level, String msg) {
        ConfigurationCheck check = configurationCheck;
        if (check != null) {
            check.checkForChanges();
        }

        if (isLevelEnabled(level)) {
            try {
                doLog(level, msg);
            } catch (RuntimeException e) {
                STATUS.log(java.util.logging.Level.WARNING, "Logger '" + name + "' failed to render a message", e);
            }
        }

        Logger successor = getNext();
        if (successor != null) {
            forward(successor, level, msg);
        }
    }

    private static void forward(Logger successor, Level level, String msg) {
        switch (level) {
            case TRACE:
                successor.trace(msg);
                break;
            case DEBUG:
                successor.debug(msg);
                break;
            case INFO:
                successor.info(msg);
                break;
            case WARN:
                successor.warn(msg);
                break;
            case ERROR:
                successor.error(msg);
                break;
            case FATAL:
                successor.fatal(msg);
                break;
            default:
                throw new IllegalStateException("Unexpected level " + level);
        }
    }

    /**
     * Substitutes {@code args} into {@code pattern}. A pattern that does not
     * fit its arguments is rendered verbatim followed by the arguments.
     */
    protected String formatArguments(String pattern, Object... args) {
        String text = String.valueOf(pattern);
        if (args == null || args.length == 0) {
            return text;
        }
        try {
            return String.format(Locale.ROOT, text, args);
        } catch (IllegalFormatException e) {
            return text + " " + Arrays.toString(args);
        }
    }

    protected String appendThrowable(String msg, Throwable thrown) {
        return ThrowableFormatter.format(String.valueOf(msg), thrown, stackTraceEnabled);
    }

    private boolean isLevelEnabled(Level level) {
        return level.isAtLeast(minLevel);
    }

    @Override
    public void log(Level level, String msg) {
        logMessage(Objects.requireNonNull(level, "level"), msg);
    }

    @Override
    public void trace(String msg) {
        logMessage(Level.TRACE, msg);
    }

    @Override
    public void trace(String pattern, Object... args) {
        logMessage(Level.TRACE, formatArguments(pattern, args));
    }

    @Override
    public void trace(String msg, Throwable thrown) {
        logMessage(Level.TRACE, appendThrowable(msg, thrown));
    }

    @Override
    public void trace(String pattern, Throwable thrown, Object... args) {
        logMessage(Level.TRACE, appendThrowable(formatArguments(pattern, args), thrown));
    }

    @Override
    public void debug(String msg) {
        logMessage(Level.DEBUG, msg);
    }

    @Override
    public void debug(String pattern, Object... args) {
        logMessage(Level.DEBUG, formatArguments(pattern, args));
    }

    @Override
    public void debug(String msg, Throwable thrown) {
        logMessage(Level.DEBUG, appendThrowable(msg, thrown));
    }

    @Override
    public void debug(String pattern, Throwable thrown, Object... args) {
        logMessage(Level.DEBUG, appendThrowable(formatArguments(pattern, args), thrown));
    }

    @Override
    public void info(String msg) {
        logMessage(Level.INFO, msg);
    }

    @Override
    public void info(String pattern, Object... args) {
        logMessage(Level.INFO, formatArguments(pattern, args));
    }

    @Override
    public void info(String msg, Throwable thrown) {
        logMessage(Level.INFO, appendThrowable(msg, thrown));
    }

    @Override
    public void info(String pattern, Throwable thrown, Object... args) {
        logMessage(Level.INFO, appendThrowable(formatArguments(pattern, args), thrown));
    }

    @Override
    public void warn(String msg) {
        logMessage(Level.WARN, msg);
    }

    @Override
    public void warn(String pattern, Object... args) {
        logMessage(Level.WARN, formatArguments(pattern, args));
    }

    @Override
    public void warn(String msg, Throwable thrown) {
        logMessage(Level.WARN, appendThrowable(msg, thrown));
    }

    @Override
    public void warn(String pattern, Throwable thrown, Object... args) {
        logMessage(Level.WARN, appendThrowable(formatArguments(pattern, args), thrown));
    }

    @Override
    public void error(String msg) {
        logMessage(Level.ERROR, msg);
    }

    @Override
    public void error(String pattern, Object... args) {
        logMessage(Level.ERROR, formatArguments(pattern, args));
    }

    @Override
    public void error(String msg, Throwable thrown) {
        logMessage(Level.ERROR, appendThrowable(msg, thrown));
    }

    @Override
    public void error(String pattern, Throwable thrown, Object... args) {
        logMessage(Level.ERROR, appendThrowable(formatArguments(pattern, args), thrown));
    }

    @Override
    public void fatal(String msg) {
        logMessage(Level.FATAL, msg);
    }

    @Override
    public void fatal(String pattern, Object... args) {
        logMessage(Level.FATAL, formatArguments(pattern, args));
    }

    @Override
    public void fatal(String msg, Throwable thrown) {
        logMessage(Level.FATAL, appendThrowable(msg, thrown));
    }

    @Override
    public void fatal(String pattern, Throwable thrown, Object... args) {
        logMessage(Level.FATAL, appendThrowable(formatArguments(pattern, args), thrown));
    }

    @Override
    public boolean isTraceEnabled() {
        return isLevelEnabled(Level.TRACE);
    }

    @Override
    public boolean isDebugEnabled() {
        return isLevelEnabled(Level.DEBUG);
    }

    @Override
    public boolean isInfoEnabled() {
        return isLevelEnabled(Level.INFO);
    }

    @Override
    public boolean isWarnEnabled() {
        return isLevelEnabled(Level.WARN);
    }

    @Override
    public boolean isErrorEnabled() {
        return isLevelEnabled(Level.ERROR);
    }

    @Override
    public boolean isFatalEnabled() {
        return isLevelEnabled(Level.FATAL);
    }

    @Override
    public void setLevel(Level level) {
        Objects.requireNonNull(level, "level");
        synchronized (chainLock) {
            minLevel = level;
        }
    }

    @Override
    public Level getLevel() {
        return minLevel;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getAbbreviatedName(int width) {
        return LoggerNameFormatter.abbreviate(name, width);
    }

    /**
     * @param check hook run before every dispatch, {@code null} to disable
     */
    public void setConfigurationCheck(ConfigurationCheck check) {
        this.configurationCheck = check;
    }

    /**
     * @param enabled whether messages with an exception include its stack trace
     */
    public void setStackTraceEnabled(boolean enabled) {
        this.stackTraceEnabled = enabled;
    }

    public boolean isStackTraceEnabled() {
        return stackTraceEnabled;
    }

    @Override
    public Logger getNext() {
        synchronized (chainLock) {
            return next;
        }
    }

    /**
     * Links the successor directly, replacing the current one. Unlike
     * {@link #addToChain(Logger)} this does not check the rest of the chain.
     *
     * @throws IllegalArgumentException if {@code logger} is this logger
     */
    @Override
    public void setNext(Logger logger) {
        if (logger == this) {
            throw new IllegalArgumentException("A logger cannot be its own successor");
        }
        synchronized (chainLock) {
            next = logger;
        }
    }

    @Override
    public Logger addToChain(Logger logger) {
        if (logger == null) {
            return null;
        }
        Logger tail = this;
        while (true) {
            if (tail == logger) {
                return logger;
            }
            Logger following = tail.getNext();
            if (following == null) {
                break;
            }
            tail = following;
        }
        // linking a chain that already leads back into this one would close a cycle
        if (reaches(logger, tail)) {
            return logger;
        }
        tail.setNext(logger);
        return logger;
    }

    private static boolean reaches(Logger from, Logger target) {
        Logger current = from;
        while (current != null) {
            if (current == target) {
                return true;
            }
            current = current.getNext();
        }
        return false;
    }

    @Override
    public boolean removeFromChain(Logger logger) {
        if (logger == null || logger == this) {
            return false;
        }
        Logger predecessor = this;
        Logger current = predecessor.getNext();
        while (current != null) {
            if (current == logger) {
                predecessor.setNext(logger.getNext());
                logger.setNext(null);
                return true;
            }
            predecessor = current;
            current = current.getNext();
        }
        return false;
    }

    @Override
    public int getChainCount() {
        int count = 1;
        Logger current = getNext();
        while (current != null) {
            count++;
            current = current.getNext();
        }
        return count;
    }

    @Override
    public void clearChain() {
        setNext(null);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + minLevel + "]";
    }
}
