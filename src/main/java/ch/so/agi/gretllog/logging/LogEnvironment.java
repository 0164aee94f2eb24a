package ch.so.agi.gretllog.logging;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.helpers.NOPLoggerFactory;

import ch.so.agi.gretllog.config.ConfigLocator;
import ch.so.agi.gretllog.config.LoggerConfig;
import ch.so.agi.gretllog.utils.GretlLogException;

/**
 * Process-wide access point for applications that do not want to pass a
 * {@link LoggerFactory} around. The environment lazily initialises a factory
 * whose configuration is read from the file found by
 * {@link ConfigLocator#standard()} and whose loggers go to SLF4J when a
 * backend is bound, or to the console otherwise.
 * <p>
 * Library code should prefer an injected {@link LoggerFactory}.
 */
public class LogEnvironment {

    private static final java.util.logging.Logger STATUS =
            java.util.logging.Logger.getLogger(LogEnvironment.class.getName());

    private static LoggerFactory currentLoggerFactory = null;

    /**
     * Replaces the global factory. Mostly intended for tests; {@code null}
     * makes the next access initialise a fresh default factory.
     *
     * @param factory the {@link LoggerFactory} to use from now on
     */
    public static synchronized void setLoggerFactory(LoggerFactory factory) {
        currentLoggerFactory = factory;
    }

    /**
     * Initialises the environment with loggers created by {@code logFactory}
     * if no factory was set previously. The configuration file is located
     * automatically; a file that cannot be read leaves the defaults in place.
     *
     * @param logFactory creates the sink behind each logger
     */
    public static synchronized void initStandalone(LogFactory logFactory) {
        if (currentLoggerFactory == null) {
            setLoggerFactory(new LoggerFactory(locateConfig(), logFactory));
        }
    }

    /**
     * Initialises the environment from an explicit configuration file if no
     * factory was set previously.
     *
     * @param configFile properties file to load
     * @param logFactory creates the sink behind each logger
     * @throws GretlLogException if the file does not exist or cannot be read
     */
    public static synchronized void initStandalone(Path configFile, LogFactory logFactory) {
        if (currentLoggerFactory != null) {
            return;
        }
        LoggerConfig config = new LoggerConfig();
        try {
            config.loadFromFile(configFile);
        } catch (IOException e) {
            throw new GretlLogException(GretlLogException.TYPE_CONFIG,
                    "Cannot load logger configuration " + configFile, e);
        }
        setLoggerFactory(new LoggerFactory(config, logFactory));
    }

    /**
     * @return the current factory, initialising the default one if needed
     */
    public static synchronized LoggerFactory getLoggerFactory() {
        if (currentLoggerFactory == null) {
            initStandalone(defaultLogFactory());
        }
        return currentLoggerFactory;
    }

    /**
     * Returns a logger for the given class.
     *
     * @param logSource the class requesting logging
     * @return a configured {@link Logger}
     * @throws IllegalArgumentException if {@code logSource} is {@code null}
     */
    public static Logger getLogger(Class<?> logSource) {
        return getLoggerFactory().getLogger(logSource);
    }

    public static Logger getLogger(String name) {
        return getLoggerFactory().getLogger(name);
    }

    /**
     * @return the root logger of the current factory
     */
    public static Logger getLogger() {
        return getLoggerFactory().getLogger();
    }

    static LogFactory defaultLogFactory() {
        if (org.slf4j.LoggerFactory.getILoggerFactory() instanceof NOPLoggerFactory) {
            // no SLF4J backend bound
            return new ConsoleLogFactory();
        }
        return new Slf4jLogFactory();
    }

    private static LoggerConfig locateConfig() {
        LoggerConfig config = new LoggerConfig();
        Optional<Path> configFile = ConfigLocator.standard().locate();
        if (configFile.isEmpty()) {
            STATUS.fine(() -> "No " + ConfigLocator.configFileName() + " found, using default levels");
            return config;
        }
        try {
            config.loadFromFile(configFile.get());
        } catch (IOException e) {
            STATUS.log(java.util.logging.Level.WARNING,
                    "Cannot load logger configuration " + configFile.get() + ", using default levels", e);
        }
        return config;
    }
}
