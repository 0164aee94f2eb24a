package ch.so.agi.gretllog.logging;

/**
 * Discards every message. All {@code isXEnabled()} checks return
 * {@code false} so callers skip building messages, but messages sent to it
 * are still forwarded along the chain.
 */
public class NullLogger extends BaseLogger {

    public NullLogger() {
        this("");
    }

    public NullLogger(String name) {
        super(name, Level.FATAL);
    }

    @Override
    protected void doLog(Level level, String msg) {
        // discarded
    }

    @Override
    public boolean isTraceEnabled() {
        return false;
    }

    @Override
    public boolean isDebugEnabled() {
        return false;
    }

    @Override
    public boolean isInfoEnabled() {
        return false;
    }

    @Override
    public boolean isWarnEnabled() {
        return false;
    }

    @Override
    public boolean isErrorEnabled() {
        return false;
    }

    @Override
    public boolean isFatalEnabled() {
        return false;
    }
}
