package ch.so.agi.gretllog.config;

import ch.so.agi.gretllog.logging.Level;

/**
 * A wildcard pattern such as {@code mqtt.transport.*} together with its level.
 * Patterns are stored normalized (trimmed, lower case).
 */
final class WildcardRule {

    private final String pattern;
    private final Level level;
    private final int specificity;

    WildcardRule(String pattern, Level level) {
        this.pattern = pattern;
        this.level = level;
        this.specificity = specificityOf(pattern);
    }

    /**
     * Number of dot separated segments before the wildcard:
     * {@code *} is 0, {@code mqtt.*} is 1, {@code mqtt.transport.*} is 2.
     */
    static int specificityOf(String pattern) {
        int segments = pattern.split("\\.", -1).length;
        return pattern.indexOf('*') >= 0 ? segments - 1 : segments;
    }

    /**
     * A pattern ending in {@code *} matches every name starting with the text
     * before the {@code *}; any other pattern only matches itself.
     */
    boolean matches(String normalizedName) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return prefix.isEmpty() || normalizedName.startsWith(prefix);
        }
        return normalizedName.equals(pattern);
    }

    String getPattern() {
        return pattern;
    }

    Level getLevel() {
        return level;
    }

    int getSpecificity() {
        return specificity;
    }
}
