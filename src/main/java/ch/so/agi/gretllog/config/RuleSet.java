package ch.so.agi.gretllog.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import ch.so.agi.gretllog.logging.Level;

/**
 * Immutable result of parsing one configuration text. Built without holding
 * the {@link LoggerConfig} lock and swapped in afterwards.
 */
final class RuleSet {

    static final String ROOT = "root";
    static final String MATCH_ALL = "*";
    static final String KEY_SCAN = "scan";
    static final String KEY_SCAN_PERIOD = "scan.period";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    static final Comparator<WildcardRule> BY_SPECIFICITY =
            Comparator.comparingInt(WildcardRule::getSpecificity).reversed();

    private final Map<String, Level> exactRules;
    private final List<WildcardRule> wildcardRules;
    private final Level rootLevel;
    private final boolean scanEnabled;
    private final long scanPeriodMillis;

    private RuleSet(Map<String, Level> exactRules, List<WildcardRule> wildcardRules, Level rootLevel,
            boolean scanEnabled, long scanPeriodMillis) {
        this.exactRules = Collections.unmodifiableMap(exactRules);
        this.wildcardRules = Collections.unmodifiableList(wildcardRules);
        this.rootLevel = rootLevel;
        this.scanEnabled = scanEnabled;
        this.scanPeriodMillis = scanPeriodMillis;
    }

    /**
     * Parses properties style text. A leading byte order mark is ignored. Blank lines, comments ({@code #} or
     * {@code !}) and lines without a key or value are skipped; unknown levels
     * become {@link Level#INFO}.
     */
    static RuleSet parse(String content) {
        Map<String, Level> exact = new HashMap<>();
        List<WildcardRule> wildcards = new ArrayList<>();
        Level root = Level.INFO;
        boolean scan = false;
        long scanPeriod = ScanPeriod.DEFAULT_MILLIS;

        String text = content == null ? "" : content;
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            // UTF-8 BOM, trim() keeps it
            text = text.substring(1);
        }
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("!")) {
                continue;
            }
            int separator = line.indexOf('=');
            if (separator < 0) {
                continue;
            }
            String key = normalize(line.substring(0, separator));
            String value = line.substring(separator + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                continue;
            }

            if (KEY_SCAN.equals(key)) {
                scan = "true".equalsIgnoreCase(value);
            } else if (KEY_SCAN_PERIOD.equals(key)) {
                scanPeriod = ScanPeriod.parseMillis(value);
            } else if (isRoot(key)) {
                root = Level.fromString(value);
            } else if (key.indexOf('*') >= 0) {
                putWildcard(wildcards, new WildcardRule(key, Level.fromString(value)));
            } else {
                exact.put(key, Level.fromString(value));
            }
        }
        wildcards.sort(BY_SPECIFICITY);
        return new RuleSet(exact, wildcards, root, scan, scanPeriod);
    }

    /**
     * Replaces an existing rule with the same pattern, otherwise appends. The
     * caller re-sorts.
     */
    static void putWildcard(List<WildcardRule> rules, WildcardRule rule) {
        rules.removeIf(existing -> existing.getPattern().equals(rule.getPattern()));
        rules.add(rule);
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isRoot(String normalizedKey) {
        return ROOT.equals(normalizedKey) || MATCH_ALL.equals(normalizedKey);
    }

    Map<String, Level> getExactRules() {
        return exactRules;
    }

    List<WildcardRule> getWildcardRules() {
        return wildcardRules;
    }

    Level getRootLevel() {
        return rootLevel;
    }

    boolean isScanEnabled() {
        return scanEnabled;
    }

    long getScanPeriodMillis() {
        return scanPeriodMillis;
    }
}
