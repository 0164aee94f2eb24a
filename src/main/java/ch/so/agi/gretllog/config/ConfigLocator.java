package ch.so.agi.gretllog.config;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Finds the configuration file at start-up.
 * <p>
 * The file name is {@value #DEBUG_CONFIG_FILE} when the system property
 * {@value #DEBUG_PROPERTY} is {@code true} and {@value #CONFIG_FILE}
 * otherwise. The standard search order is the working directory, the
 * application directory (the directory containing the jar or class folder of
 * this library) and the application directory's parent. The first existing
 * file wins.
 */
public class ConfigLocator {

    public static final String CONFIG_FILE = "gretllog.properties";
    public static final String DEBUG_CONFIG_FILE = "gretllog-debug.properties";
    public static final String DEBUG_PROPERTY = "gretllog.debug";

    private final List<Path> searchDirectories;

    public ConfigLocator(List<Path> searchDirectories) {
        this.searchDirectories = Collections.unmodifiableList(new ArrayList<>(searchDirectories));
    }

    /**
     * @return a locator using the working directory, the application directory
     *         and its parent
     */
    public static ConfigLocator standard() {
        List<Path> directories = new ArrayList<>();
        directories.add(Paths.get(System.getProperty("user.dir", ".")));
        Path applicationDir = applicationDirectory();
        if (applicationDir != null) {
            directories.add(applicationDir);
            if (applicationDir.getParent() != null) {
                directories.add(applicationDir.getParent());
            }
        }
        return new ConfigLocator(directories);
    }

    /**
     * @return the file name to look for, depending on {@value #DEBUG_PROPERTY}
     */
    public static String configFileName() {
        return Boolean.getBoolean(DEBUG_PROPERTY) ? DEBUG_CONFIG_FILE : CONFIG_FILE;
    }

    public Optional<Path> locate() {
        return locate(configFileName());
    }

    /**
     * @param fileName name of the file to find
     * @return the first existing file in search order
     */
    public Optional<Path> locate(String fileName) {
        for (Path directory : searchDirectories) {
            Path candidate = directory.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public List<Path> getSearchDirectories() {
        return searchDirectories;
    }

    private static Path applicationDirectory() {
        try {
            CodeSource codeSource = ConfigLocator.class.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                return null;
            }
            Path location = Paths.get(codeSource.getLocation().toURI()).toAbsolutePath();
            return Files.isDirectory(location) ? location : location.getParent();
        } catch (URISyntaxException | SecurityException | IllegalArgumentException e) {
            // not loaded from a file system location, e.g. nested jar
            return null;
        }
    }
}
