package ch.so.agi.gretllog.logging;

@FunctionalInterface
public interface LogEventListener {

    public void onEvent(LogEvent event);
}
