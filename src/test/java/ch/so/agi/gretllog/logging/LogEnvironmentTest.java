package ch.so.agi.gretllog.logging;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.so.agi.gretllog.config.LoggerConfig;
import ch.so.agi.gretllog.utils.GretlLogException;

class LogEnvironmentTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        LogEnvironment.setLoggerFactory(null);
    }

    @AfterEach
    void tearDown() {
        LogEnvironment.setLoggerFactory(null);
    }

    @Test
    void usesFactorySetExplicitly() {
        LoggerFactory factory = new LoggerFactory(new LoggerConfig(), RecordingLogger::new);
        LogEnvironment.setLoggerFactory(factory);

        assertSame(factory, LogEnvironment.getLoggerFactory());
        assertSame(factory.getLogger("app"), LogEnvironment.getLogger("app"));
        assertSame(factory.getLogger(LogEnvironmentTest.class), LogEnvironment.getLogger(LogEnvironmentTest.class));
        assertSame(factory.getLogger(), LogEnvironment.getLogger());
    }

    @Test
    void initStandaloneLoadsExplicitFile() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "app=ERROR\n", StandardCharsets.UTF_8);

        LogEnvironment.initStandalone(file, RecordingLogger::new);

        assertEquals(Level.ERROR, LogEnvironment.getLogger("app").getLevel());
        assertTrue(LogEnvironment.getLogger("app") instanceof RecordingLogger);
    }

    @Test
    void initStandaloneDoesNotReplaceExistingFactory() {
        LoggerFactory factory = new LoggerFactory(new LoggerConfig(), RecordingLogger::new);
        LogEnvironment.setLoggerFactory(factory);

        LogEnvironment.initStandalone(new NullLogFactory());

        assertSame(factory, LogEnvironment.getLoggerFactory());
    }

    @Test
    void missingExplicitFileIsReported() {
        GretlLogException e = assertThrows(GretlLogException.class,
                () -> LogEnvironment.initStandalone(tempDir.resolve("missing.properties"), new NullLogFactory()));

        assertEquals(GretlLogException.TYPE_CONFIG, e.getType());
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    void defaultFactoryIsCreatedLazily() {
        LoggerFactory factory = LogEnvironment.getLoggerFactory();

        assertNotNull(factory);
        assertSame(factory, LogEnvironment.getLoggerFactory());
        assertNotNull(LogEnvironment.getLogger("lazy"));
    }
}
