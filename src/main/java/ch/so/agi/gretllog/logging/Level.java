package ch.so.agi.gretllog.logging;

import java.util.Locale;

/**
 * Severity levels, ordered from most verbose to most severe. The declaration
 * order is the comparison order used by every threshold check: a message of
 * level {@code L} passes a node whose minimum level is {@code M} iff
 * {@code L.isAtLeast(M)}.
 * <p>
 * Each level also carries the {@link java.util.logging.Level} used by the
 * standalone backend ({@link CoreJavaLogger}).
 */
public enum Level {

    TRACE(java.util.logging.Level.FINEST),
    DEBUG(java.util.logging.Level.FINE),
    INFO(java.util.logging.Level.INFO),
    WARN(java.util.logging.Level.WARNING),
    ERROR(java.util.logging.Level.SEVERE),
    FATAL(java.util.logging.Level.SEVERE);

    private final java.util.logging.Level innerLevel;

    Level(java.util.logging.Level innerLevel) {
        this.innerLevel = innerLevel;
    }

    /**
     * Converts a level name into a {@link Level}. Matching ignores case and
     * surrounding whitespace. Unknown or {@code null} names resolve to
     * {@link #INFO}; this method never throws.
     *
     * @param value level name, e.g. {@code "debug"}
     * @return the matching level, or {@link #INFO}
     */
    public static Level fromString(String value) {
        if (value == null) {
            return INFO;
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (Level level : values()) {
            if (level.name().equals(upper)) {
                return level;
            }
        }
        return INFO;
    }

    /**
     * @param threshold minimum level of a node
     * @return {@code true} if a message of this level passes {@code threshold}
     */
    public boolean isAtLeast(Level threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Exposes the mapped {@link java.util.logging.Level} so the standalone
     * backend can pass it to the underlying logger.
     *
     * @return the mapped {@code java.util.logging.Level}
     */
    java.util.logging.Level getInnerLevel() {
        return innerLevel;
    }
}
