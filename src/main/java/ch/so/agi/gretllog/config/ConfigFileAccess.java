package ch.so.agi.gretllog.config;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * File system operations the {@link LoggerConfig} needs to load and watch its
 * configuration file. Separated so the number of status calls made by the
 * reload check can be observed and so tests can simulate failing reads.
 */
public interface ConfigFileAccess {

    public boolean exists(Path file);

    public FileTime getLastModifiedTime(Path file) throws IOException;

    /**
     * Reads the whole file as UTF-8 text.
     *
     * @param file the configuration file
     * @return file content
     * @throws IOException if the file cannot be read
     */
    public String readString(Path file) throws IOException;
}
