package ch.so.agi.gretllog.logging;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CoreJavaLoggerTest {

    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    private CoreJavaLogger logger;

    @BeforeEach
    void setUp() {
        logger = new CoreJavaLogger("gretllog.test.corejava", Level.DEBUG);
        logger.getInnerLogger().setUseParentHandlers(false);
        logger.getInnerLogger().addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        logger.getInnerLogger().removeHandler(handler);
        logger.getInnerLogger().setUseParentHandlers(true);
    }

    @Test
    void logsWithMappedLevel() {
        logger.debug("fine grained");
        logger.warn("warning");
        logger.fatal("severe");

        assertEquals(3, records.size());
        assertEquals(java.util.logging.Level.FINE, records.get(0).getLevel());
        assertEquals(java.util.logging.Level.WARNING, records.get(1).getLevel());
        assertEquals(java.util.logging.Level.SEVERE, records.get(2).getLevel());
        assertEquals("severe", records.get(2).getMessage());
    }

    @Test
    void levelChangeIsMirroredToInnerLogger() {
        logger.setLevel(Level.ERROR);

        assertEquals(java.util.logging.Level.SEVERE, logger.getInnerLogger().getLevel());
        logger.warn("dropped");
        assertTrue(records.isEmpty());
    }

    @Test
    void rootLoggerDoesNotTouchGlobalRoot() {
        java.util.logging.Logger globalRoot = java.util.logging.Logger.getLogger("");
        java.util.logging.Level before = globalRoot.getLevel();

        CoreJavaLogger root = new CoreJavaLogger("", Level.INFO);
        root.setLevel(Level.ERROR);

        assertEquals(CoreJavaLogger.ROOT_LOGGER_NAME, root.getInnerLogger().getName());
        assertNotSame(globalRoot, root.getInnerLogger());
        assertEquals(before, globalRoot.getLevel());
        assertEquals("", root.getName());
    }
}
