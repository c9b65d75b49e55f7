package com.largomodo.gamemeta.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Metadata file detection inside platform directories.
 * <p>
 * Recognizes {@code metadata.pegasus.txt} and the shorter {@code metadata.txt}; when a
 * directory holds both, the Pegasus-specific name wins.
 * <p>
 * Stateless utility performing filesystem checks.
 */
public class MetadataFileMatcher {

    public static final String PRIMARY_NAME = "metadata.pegasus.txt";

    private static final List<String> NAMES = List.of(PRIMARY_NAME, "metadata.txt");

    private MetadataFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a metadata file.
     *
     * @param path file path to check (can be null)
     * @return true if path is a regular file with a recognized name
     */
    public static boolean isMetadataFile(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        if (!Files.isRegularFile(path)) {
            return false;
        }
        return NAMES.contains(path.getFileName().toString().toLowerCase(Locale.ROOT));
    }

    /**
     * Find the metadata file of a platform directory.
     *
     * @param directory platform directory
     * @return metadata file, or empty when the directory has none
     */
    public static Optional<Path> findIn(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return Optional.empty();
        }
        for (String name : NAMES) {
            Path candidate = directory.resolve(name);
            if (isMetadataFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
