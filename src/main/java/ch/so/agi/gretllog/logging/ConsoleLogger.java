package ch.so.agi.gretllog.logging;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes one line per message to a {@link PrintStream}, by default
 * {@code System.out}:
 * <pre>
 * 2025-01-31 14:03:07.412 INFO  [           c.s.a.g.OrderService] : started
 * </pre>
 * Names longer than the name width are abbreviated, see
 * {@link Logger#getAbbreviatedName(int)}. Lines written by one instance never
 * interleave.
 */
public class ConsoleLogger extends BaseLogger {

    public static final int DEFAULT_NAME_WIDTH = 40;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final PrintStream out;
    private final Object outputLock = new Object();
    private volatile int nameWidth = DEFAULT_NAME_WIDTH;

    public ConsoleLogger(String name, Level minLevel) {
        this(name, minLevel, System.out);
    }

    public ConsoleLogger(String name, Level minLevel, PrintStream out) {
        super(name, minLevel);
        this.out = Objects.requireNonNull(out, "out");
    }

    public void setNameWidth(int nameWidth) {
        if (nameWidth < 1) {
            throw new IllegalArgumentException("nameWidth must be positive");
        }
        this.nameWidth = nameWidth;
    }

    @Override
    protected void doLog(Level level, String msg) {
        String line = formatLine(level, msg);
        synchronized (outputLock) {
            out.println(line);
        }
    }

    String formatLine(Level level, String msg) {
        String timestamp = LocalDateTime.now().format(TIMESTAMP);
        if (getName().isEmpty()) {
            return String.format(Locale.ROOT, "%s %-5s : %s", timestamp, level, msg);
        }
        int width = nameWidth;
        return String.format(Locale.ROOT, "%s %-5s [%" + width + "s] : %s",
                timestamp, level, getAbbreviatedName(width), msg);
    }
}
