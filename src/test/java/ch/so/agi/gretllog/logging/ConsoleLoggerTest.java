package ch.so.agi.gretllog.logging;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsoleLoggerTest {

    private static final String TIMESTAMP = "\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3}";

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String[] lines() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        return text.isEmpty() ? new String[0] : text.split("\\R");
    }

    @Test
    void writesTimestampLevelNameAndMessage() {
        ConsoleLogger logger = new ConsoleLogger("orders", Level.INFO, out);
        logger.setNameWidth(10);

        logger.warn("stock low");

        String[] lines = lines();
        assertEquals(1, lines.length);
        assertTrue(lines[0].matches(TIMESTAMP + " WARN  \\[    orders\\] : stock low"), lines[0]);
    }

    @Test
    void rootLoggerOmitsName() {
        ConsoleLogger logger = new ConsoleLogger("", Level.TRACE, out);

        logger.trace("details");

        assertTrue(lines()[0].matches(TIMESTAMP + " TRACE : details"), lines()[0]);
    }

    @Test
    void longNamesAreAbbreviated() {
        ConsoleLogger logger = new ConsoleLogger("com.example.service.OrderService", Level.INFO, out);
        logger.setNameWidth(20);

        logger.info("ready");

        assertTrue(lines()[0].contains("[  c.e.s.OrderService] : ready"), lines()[0]);
    }

    @Test
    void suppressesMessagesBelowLevel() {
        ConsoleLogger logger = new ConsoleLogger("orders", Level.ERROR, out);

        logger.info("hidden");
        logger.debug("hidden too");

        assertEquals(0, lines().length);
    }

    @Test
    void rejectsNonPositiveNameWidth() {
        ConsoleLogger logger = new ConsoleLogger("orders", Level.INFO, out);

        assertThrows(IllegalArgumentException.class, () -> logger.setNameWidth(0));
    }
}
