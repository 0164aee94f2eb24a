package ch.so.agi.gretllog.logging;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.so.agi.gretllog.config.LocalConfigFileAccess;
import ch.so.agi.gretllog.config.LoggerConfig;

class LoggerFactoryTest {

    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Clock clock;
    private LoggerConfig config;
    private LoggerFactory factory;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.millis()).thenReturn(START.toEpochMilli());
        config = new LoggerConfig(clock, new LocalConfigFileAccess());
        factory = new LoggerFactory(config, RecordingLogger::new);
    }

    private Path writeConfig(String content, Instant modified) throws IOException {
        Path file = tempDir.resolve("gretllog.properties");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(modified));
        return file;
    }

    @Test
    void loggersAreCachedIgnoringCase() {
        Logger first = factory.getLogger("Orders.Service");
        Logger second = factory.getLogger("orders.service ");

        assertSame(first, second);
        assertEquals("Orders.Service", first.getName());
    }

    @Test
    void classLoggerUsesQualifiedName() {
        Logger logger = factory.getLogger(LoggerFactoryTest.class);

        assertEquals(LoggerFactoryTest.class.getName(), logger.getName());
    }

    @Test
    void nullClassIsRejected() {
        Exception e = assertThrows(IllegalArgumentException.class, () -> factory.getLogger((Class<?>) null));
        assertEquals("The logSource must not be null", e.getMessage());
    }

    @Test
    void constructorRejectsMissingCollaborators() {
        assertThrows(IllegalArgumentException.class, () -> new LoggerFactory(null, RecordingLogger::new));
        assertThrows(IllegalArgumentException.class, () -> new LoggerFactory(config, null));
    }

    @Test
    void newLoggersStartAtConfiguredLevel() {
        factory.loadConfigFromString("orders.*=WARN\norders.audit=TRACE\n");

        assertEquals(Level.WARN, factory.getLogger("orders.billing").getLevel());
        assertEquals(Level.TRACE, factory.getLogger("orders.audit").getLevel());
        assertEquals(Level.INFO, factory.getLogger("shipping").getLevel());
    }

    @Test
    void defaultLevelAppliesWithoutRule() {
        LoggerFactory verbose = new LoggerFactory(config, RecordingLogger::new, Level.DEBUG);

        assertEquals(Level.DEBUG, verbose.getLogger("anything").getLevel());
        assertEquals(Level.DEBUG, verbose.getDefaultLevel());
    }

    @Test
    void levelChangesReachExistingLoggers() {
        Logger billing = factory.getLogger("orders.billing");
        Logger shipping = factory.getLogger("shipping");

        factory.setLoggerLevel("orders.*", Level.ERROR);

        assertEquals(Level.ERROR, billing.getLevel());
        assertEquals(Level.INFO, shipping.getLevel());

        factory.setLoggerLevel("root", Level.WARN);
        assertEquals(Level.WARN, shipping.getLevel());
    }

    @Test
    void automaticReloadUpdatesLevelsBeforeMessageIsHandled() throws IOException {
        Path file = writeConfig("scan=true\nscan.period=1 second\napp=DEBUG\n", START);
        factory.loadConfig(file);
        RecordingLogger logger = (RecordingLogger) factory.getLogger("app");
        assertEquals(Level.DEBUG, logger.getLevel());

        writeConfig("scan=true\nscan.period=1 second\napp=ERROR\n", START.plusSeconds(30));
        when(clock.millis()).thenReturn(START.toEpochMilli() + 2_000);

        logger.info("after edit");

        assertEquals(Level.ERROR, logger.getLevel());
        assertTrue(logger.rendered.isEmpty());
    }

    @Test
    void explicitReloadAppliesFileChanges() throws IOException {
        Path file = writeConfig("app=DEBUG\n", START);
        factory.loadConfig(file);
        Logger logger = factory.getLogger("app");

        writeConfig("app=FATAL\n", START.plusSeconds(10));
        factory.reloadConfig();

        assertEquals(Level.FATAL, logger.getLevel());
    }

    @Test
    void rootChainOperations() {
        RecordingLogger root = (RecordingLogger) factory.getLogger();
        RecordingLogger audit = new RecordingLogger("audit", Level.TRACE);
        RecordingLogger errors = new RecordingLogger("errors", Level.ERROR);

        factory.addLogger(audit);
        factory.addLogger(errors);
        assertEquals(3, factory.getLoggerCount());

        root.error("failure");
        assertEquals(List.of("ERROR failure"), audit.rendered);
        assertEquals(List.of("ERROR failure"), errors.rendered);

        assertTrue(factory.removeLogger(audit));
        assertEquals(2, factory.getLoggerCount());

        factory.clearLoggers();
        assertEquals(1, factory.getLoggerCount());
    }

    @Test
    void resetForgetsCachedLoggers() {
        Logger before = factory.getLogger("app");

        factory.reset();

        assertNotSame(before, factory.getLogger("app"));
    }
}
