package ch.so.agi.gretllog.utils;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Appends exception details to a log message.
 */
public final class ThrowableFormatter {

    private ThrowableFormatter() {}

    /**
     * Builds {@code "<message> - Exception: <class>: <exception message>"} and,
     * when {@code withStackTrace} is set, appends the stack trace on the
     * following lines.
     *
     * @param message        the log message
     * @param thrown         exception to describe; {@code null} returns {@code message}
     * @param withStackTrace whether to append the stack trace
     * @return the combined message
     */
    public static String format(String message, Throwable thrown, boolean withStackTrace) {
        if (thrown == null) {
            return message;
        }
        StringBuilder result = new StringBuilder();
        result.append(message)
                .append(" - Exception: ")
                .append(thrown.getClass().getSimpleName())
                .append(": ")
                .append(thrown.getMessage());
        if (withStackTrace) {
            StringWriter trace = new StringWriter();
            thrown.printStackTrace(new PrintWriter(trace));
            result.append(System.lineSeparator())
                    .append("Stack Trace:")
                    .append(System.lineSeparator())
                    .append(trace.toString().stripTrailing());
        }
        return result.toString();
    }
}
