package ch.so.agi.gretllog.utils;

/**
 * Unchecked exception for failures that surface through APIs which cannot
 * declare checked exceptions, e.g. the lazy initialisation of the process-wide
 * {@code LogEnvironment}.
 *
 * The optional type tags the failure category so callers can react without
 * inspecting the message.
 */
public class GretlLogException extends RuntimeException {

    public static final String TYPE_CONFIG = "config";

    private String type;

    public GretlLogException(String message) {
        super(message);
    }

    public GretlLogException(String message, Throwable cause) {
        super(message, cause);
    }

    public GretlLogException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public String getType() {
        return this.type;
    }
}
