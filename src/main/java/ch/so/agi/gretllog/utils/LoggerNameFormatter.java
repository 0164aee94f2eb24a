package ch.so.agi.gretllog.utils;

/**
 * Shortens hierarchical logger names for fixed-width output, similar to the
 * way Spring Boot abbreviates logger names: leading segments are reduced to
 * their first character and the last segment is kept as long as possible.
 * <p>
 * Examples for a width of 20:
 * <pre>
 * com.example.service.OrderService  -&gt;  c.e.s.OrderService
 * com.example.VeryLongClassNameHere -&gt;  c.e.VeryLongClass...
 * </pre>
 */
public final class LoggerNameFormatter {

    private static final String ELLIPSIS = "...";

    private LoggerNameFormatter() {}

    /**
     * @param name  dot separated logger name, may be {@code null}
     * @param width maximum length of the result
     * @return the abbreviated name, never {@code null}
     */
    public static String abbreviate(String name, int width) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        if (name.length() <= width) {
            return name;
        }

        String[] segments = name.split("\\.");
        if (segments.length == 1) {
            return truncate(name, width);
        }

        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            if (!segments[i].isEmpty()) {
                prefix.append(segments[i].charAt(0));
            }
            prefix.append('.');
        }
        String className = segments[segments.length - 1];

        if (prefix.length() + className.length() <= width) {
            return prefix + className;
        }
        int classNameMaxLength = width - prefix.length();
        if (classNameMaxLength > ELLIPSIS.length()) {
            return prefix + className.substring(0, classNameMaxLength - ELLIPSIS.length()) + ELLIPSIS;
        }
        return prefix + ELLIPSIS;
    }

    private static String truncate(String name, int width) {
        if (width <= ELLIPSIS.length()) {
            return ELLIPSIS;
        }
        return name.substring(0, width - ELLIPSIS.length()) + ELLIPSIS;
    }
}
