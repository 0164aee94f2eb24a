package ch.so.agi.gretllog.logging;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import ch.so.agi.gretllog.config.LoggerConfig;

/**
 * Hands out named loggers whose levels come from a {@link LoggerConfig}.
 * <p>
 * Loggers are cached by name, ignoring case; the first requested spelling is
 * kept as display name. A newly created logger starts at the level the
 * configuration resolves for its name, falling back to the factory's default
 * level. Whenever the configuration changes through this factory, or the
 * configuration file is reloaded automatically, the resolved levels are
 * pushed into all cached loggers.
 * <p>
 * The root logger ({@link #getLogger()}) doubles as the entry point for
 * additional destinations: {@link #addLogger(Logger)} appends a sink to its
 * chain.
 */
public class LoggerFactory {

    public static final String ROOT_LOGGER_NAME = "";

    private final LoggerConfig config;
    private final LogFactory logFactory;
    private final Level defaultLevel;
    private final ConcurrentMap<String, Logger> loggers = new ConcurrentHashMap<>();
    private final ConfigurationCheck reloadCheck = this::checkConfigReload;

    public LoggerFactory(LoggerConfig config, LogFactory logFactory) {
        this(config, logFactory, Level.INFO);
    }

    /**
     * @param config       rules resolving the level of each logger
     * @param logFactory   creates the sink behind each logger
     * @param defaultLevel level for loggers no rule applies to
     */
    public LoggerFactory(LoggerConfig config, LogFactory logFactory, Level defaultLevel) {
        if (config == null)
            throw new IllegalArgumentException("config must not be null");
        if (logFactory == null)
            throw new IllegalArgumentException("logFactory must not be null");

        this.config = config;
        this.logFactory = logFactory;
        this.defaultLevel = Objects.requireNonNull(defaultLevel, "defaultLevel");
    }

    /**
     * @return the unnamed root logger
     */
    public Logger getLogger() {
        return getLogger(ROOT_LOGGER_NAME);
    }

    /**
     * @param logSource class emitting the messages; its fully qualified name
     *                  is the logger name
     * @return the cached or newly created logger
     * @throws IllegalArgumentException if {@code logSource} is {@code null}
     */
    public Logger getLogger(Class<?> logSource) {
        if (logSource == null)
            throw new IllegalArgumentException("The logSource must not be null");

        return getLogger(logSource.getName());
    }

    /**
     * @param name hierarchical logger name, e.g. {@code mqtt.transport.tcp}
     * @return the cached or newly created logger
     */
    public Logger getLogger(String name) {
        String displayName = name == null ? ROOT_LOGGER_NAME : name.trim();
        return loggers.computeIfAbsent(displayName.toLowerCase(Locale.ROOT), key -> createLogger(displayName));
    }

    private Logger createLogger(String name) {
        Logger logger = logFactory.createLogger(name, config.getLevelForLogger(name, defaultLevel));
        if (logger instanceof BaseLogger) {
            ((BaseLogger) logger).setConfigurationCheck(reloadCheck);
        }
        return logger;
    }

    /**
     * Loads a configuration file and applies it to all cached loggers.
     *
     * @param file properties file
     * @throws IOException if the file does not exist or cannot be read
     */
    public void loadConfig(Path file) throws IOException {
        config.loadFromFile(file);
        applyConfiguration();
    }

    public void loadConfigFromString(String content) {
        config.loadFromString(content);
        applyConfiguration();
    }

    /**
     * Re-reads the last loaded configuration file and applies it.
     *
     * @throws IOException if the file is gone or cannot be read
     */
    public void reloadConfig() throws IOException {
        config.reload();
        applyConfiguration();
    }

    /**
     * Sets a rule at runtime and applies it to all cached loggers.
     *
     * @param name  logger name, wildcard pattern or {@code root}
     * @param level level to apply
     */
    public void setLoggerLevel(String name, Level level) {
        config.setLoggerLevel(name, level);
        applyConfiguration();
    }

    /**
     * Runs the opportunistic reload check of the configuration and, if the
     * file was reloaded, applies the new levels. Called by every logger this
     * factory created before it handles a message.
     */
    public void checkConfigReload() {
        config.checkAndReloadIfNeeded();
        if (config.wasConfigReloaded()) {
            applyConfiguration();
        }
    }

    private void applyConfiguration() {
        for (Logger logger : loggers.values()) {
            logger.setLevel(config.getLevelForLogger(logger.getName(), defaultLevel));
        }
    }

    /**
     * Appends a destination to the root logger's chain.
     *
     * @param logger the destination; {@code null} is ignored
     * @return {@code logger}
     */
    public Logger addLogger(Logger logger) {
        return getLogger().addToChain(logger);
    }

    public boolean removeLogger(Logger logger) {
        return getLogger().removeFromChain(logger);
    }

    /**
     * @return number of loggers in the root logger's chain, including the root
     *         logger itself
     */
    public int getLoggerCount() {
        return getLogger().getChainCount();
    }

    public void clearLoggers() {
        getLogger().clearChain();
    }

    /**
     * Forgets all cached loggers. Loggers handed out before keep working but
     * no longer receive level updates.
     */
    public void reset() {
        loggers.clear();
    }

    public LoggerConfig getConfig() {
        return config;
    }

    public Level getDefaultLevel() {
        return defaultLevel;
    }
}
