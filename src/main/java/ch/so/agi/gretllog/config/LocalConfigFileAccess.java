package ch.so.agi.gretllog.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * {@link ConfigFileAccess} backed by {@link Files} on the default file system.
 */
public class LocalConfigFileAccess implements ConfigFileAccess {

    @Override
    public boolean exists(Path file) {
        return Files.isRegularFile(file);
    }

    @Override
    public FileTime getLastModifiedTime(Path file) throws IOException {
        return Files.getLastModifiedTime(file);
    }

    @Override
    public String readString(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
