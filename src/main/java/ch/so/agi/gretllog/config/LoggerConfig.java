package ch.so.agi.gretllog.config;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import ch.so.agi.gretllog.logging.Level;

/**
 * Resolves the effective level of a hierarchical logger name, in the spirit of
 * Logback's configuration.
 * <p>
 * Rules come from a properties style text:
 * <pre>
 * # comment
 * root=WARN
 * mqtt.transport=DEBUG
 * mqtt.*=INFO
 * scan=true
 * scan.period=30 seconds
 * </pre>
 * Names are matched case-insensitively. For a given name an exact rule wins
 * over wildcard rules, and among wildcard rules the one with the most segments
 * before the {@code *} wins; ties go to the rule declared first. Without a
 * matching rule the root level applies, but only when it differs from
 * {@link Level#INFO}; otherwise the caller's default is returned.
 * <p>
 * When {@code scan=true} is set, {@link #checkAndReloadIfNeeded()} re-reads the
 * loaded file once the scan period has elapsed and the file's modification
 * time changed. The check is cheap until the period has elapsed, so it may be
 * called on every log call. A failing reload keeps the previous rules.
 * <p>
 * All operations are thread-safe.
 */
public class LoggerConfig {

    private static final java.util.logging.Logger STATUS =
            java.util.logging.Logger.getLogger(LoggerConfig.class.getName());

    private final Object lock = new Object();
    private final Clock clock;
    private final ConfigFileAccess fileAccess;

    // guarded by lock
    private final Map<String, Level> exactRules = new HashMap<>();
    private final List<WildcardRule> wildcardRules = new ArrayList<>();
    private Level rootLevel = Level.INFO;
    private FileTime configFileModTime;

    private final AtomicBoolean configReloaded = new AtomicBoolean();

    // read without lock on the reload fast path, written under lock
    private volatile Path configFile;
    private volatile boolean scanEnabled;
    private volatile long scanPeriodMillis = ScanPeriod.DEFAULT_MILLIS;
    private volatile long lastCheckMillis;

    public LoggerConfig() {
        this(Clock.systemUTC(), new LocalConfigFileAccess());
    }

    /**
     * @param clock      time source for the scan period
     * @param fileAccess file system operations used to load and watch the file
     */
    public LoggerConfig(Clock clock, ConfigFileAccess fileAccess) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fileAccess = Objects.requireNonNull(fileAccess, "fileAccess");
    }

    /**
     * Replaces all rules and scan settings with the ones parsed from
     * {@code content}. Malformed lines are skipped.
     *
     * @param content properties style configuration text
     */
    public void loadFromString(String content) {
        RuleSet parsed = RuleSet.parse(content);
        synchronized (lock) {
            apply(parsed);
        }
    }

    /**
     * Loads the configuration file and remembers it for {@link #reload()} and
     * for the automatic reload check.
     *
     * @param file path of a properties file
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException         if the file cannot be read
     */
    public void loadFromFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!fileAccess.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Logger configuration file not found");
        }
        String content = fileAccess.readString(file);
        FileTime modTime = fileAccess.getLastModifiedTime(file);
        RuleSet parsed = RuleSet.parse(content);

        synchronized (lock) {
            apply(parsed);
            configFile = file;
            configFileModTime = modTime;
            lastCheckMillis = clock.millis();
        }
    }

    /**
     * Loads the last loaded file again.
     *
     * @throws IllegalStateException if no file was loaded before
     * @throws IOException           if the file is gone or cannot be read
     */
    public void reload() throws IOException {
        Path file = configFile;
        if (file == null) {
            throw new IllegalStateException("No configuration file loaded. Cannot reload.");
        }
        loadFromFile(file);
    }

    /**
     * Removes all exact and wildcard rules and resets the root level to
     * {@link Level#INFO}. Scan settings and the loaded file are kept.
     */
    public void clear() {
        synchronized (lock) {
            exactRules.clear();
            wildcardRules.clear();
            rootLevel = Level.INFO;
        }
    }

    /**
     * Resolves the level for a logger name: exact rule, then wildcard rules by
     * specificity, then the root level if it is not {@link Level#INFO}, and
     * finally {@code defaultLevel}.
     *
     * @param loggerName   hierarchical logger name, e.g. {@code mqtt.transport.tcp}
     * @param defaultLevel level returned when no rule applies
     * @return the effective level
     */
    public Level getLevelForLogger(String loggerName, Level defaultLevel) {
        String name = RuleSet.normalize(loggerName);
        synchronized (lock) {
            Level exact = exactRules.get(name);
            if (exact != null) {
                return exact;
            }
            for (WildcardRule rule : wildcardRules) {
                if (rule.matches(name)) {
                    return rule.getLevel();
                }
            }
            // an explicit root=INFO cannot be told apart from an unset root
            if (rootLevel != Level.INFO) {
                return rootLevel;
            }
            return defaultLevel;
        }
    }

    public Level getLevelForLogger(String loggerName) {
        return getLevelForLogger(loggerName, Level.INFO);
    }

    /**
     * Sets a rule at runtime. {@code root} and {@code *} set the root level,
     * names containing {@code *} replace the wildcard rule with the same
     * pattern, all other names set an exact rule.
     *
     * @param loggerName name or pattern
     * @param level      level to apply
     */
    public void setLoggerLevel(String loggerName, Level level) {
        Objects.requireNonNull(level, "level");
        String name = RuleSet.normalize(loggerName);
        synchronized (lock) {
            if (RuleSet.isRoot(name)) {
                rootLevel = level;
            } else if (name.indexOf('*') >= 0) {
                RuleSet.putWildcard(wildcardRules, new WildcardRule(name, level));
                wildcardRules.sort(RuleSet.BY_SPECIFICITY);
            } else {
                exactRules.put(name, level);
            }
        }
    }

    public Level getRootLevel() {
        synchronized (lock) {
            return rootLevel;
        }
    }

    public void setRootLevel(Level level) {
        Objects.requireNonNull(level, "level");
        synchronized (lock) {
            rootLevel = level;
        }
    }

    /**
     * @return the last loaded configuration file, or {@code null}
     */
    public Path getConfigFile() {
        return configFile;
    }

    public boolean isScanEnabled() {
        return scanEnabled;
    }

    /**
     * @return the scan period in milliseconds
     */
    public long getScanPeriod() {
        return scanPeriodMillis;
    }

    /**
     * Reloads the configuration file if scanning is enabled, the scan period
     * has elapsed since the last check and the file's modification time
     * changed. Errors while reloading keep the current rules and are never
     * thrown.
     */
    public void checkAndReloadIfNeeded() {
        Path file = configFile;
        if (!scanEnabled || file == null) {
            return;
        }
        long now = clock.millis();
        if (now - lastCheckMillis < scanPeriodMillis) {
            return;
        }

        FileTime knownModTime;
        synchronized (lock) {
            if (now - lastCheckMillis < scanPeriodMillis) {
                return;
            }
            // set before touching the file so a failing reload is not retried on every call
            lastCheckMillis = now;
            knownModTime = configFileModTime;
        }

        try {
            FileTime currentModTime = fileAccess.getLastModifiedTime(file);
            if (currentModTime.equals(knownModTime)) {
                return;
            }
            RuleSet parsed = RuleSet.parse(fileAccess.readString(file));
            synchronized (lock) {
                apply(parsed);
                configFileModTime = currentModTime;
                configReloaded.set(true);
            }
            STATUS.fine(() -> "Reloaded logger configuration from " + file);
        } catch (IOException | RuntimeException e) {
            STATUS.log(java.util.logging.Level.FINE,
                    "Could not reload logger configuration from " + file + ", keeping previous rules", e);
        }
    }

    /**
     * Returns whether the configuration was reloaded by
     * {@link #checkAndReloadIfNeeded()} since the last call, and clears the
     * flag.
     *
     * @return {@code true} exactly once per automatic reload
     */
    public boolean wasConfigReloaded() {
        return configReloaded.get() && configReloaded.getAndSet(false);
    }

    private void apply(RuleSet parsed) {
        exactRules.clear();
        exactRules.putAll(parsed.getExactRules());
        wildcardRules.clear();
        wildcardRules.addAll(parsed.getWildcardRules());
        rootLevel = parsed.getRootLevel();
        scanEnabled = parsed.isScanEnabled();
        scanPeriodMillis = parsed.getScanPeriodMillis();
    }
}
