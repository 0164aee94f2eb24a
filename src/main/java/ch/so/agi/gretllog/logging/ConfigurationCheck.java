package ch.so.agi.gretllog.logging;

/**
 * Hook a {@link BaseLogger} calls before dispatching each message. The
 * {@link LoggerFactory} uses it to run the opportunistic configuration reload
 * check, which keeps loggers independent of the configuration itself.
 * <p>
 * Implementations are called on the logging hot path and must return quickly
 * and must not throw.
 */
@FunctionalInterface
public interface ConfigurationCheck {

    public void checkForChanges();
}
