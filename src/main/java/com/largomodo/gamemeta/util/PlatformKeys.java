package com.largomodo.gamemeta.util;

import java.util.Locale;

/**
 * Platform key derivation from directory names.
 * <p>
 * {@code "FBNEO ACT"} becomes {@code fbneo_act}, {@code "Resource\DC"} becomes {@code dc}.
 * Keys name output files and select per-platform policy, so they must be stable across
 * operating systems.
 * <p>
 * Pure function with no state or dependencies. Safe for concurrent use.
 */
public class PlatformKeys {

    private PlatformKeys() {
        // Static utility class - prevent instantiation
    }

    /**
     * Convert a directory name (or path) to a platform key.
     * <p>
     * Strategy: keep the last path segment, trim, lowercase, spaces to underscores.
     *
     * @param name directory name, may contain path separators
     * @return platform key
     * @throws IllegalArgumentException if name is null or yields an empty key
     */
    public static String slugify(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Platform name cannot be null or blank");
        }

        String normalized = name.replace('\\', '/');
        // Trailing separators would leave an empty last segment
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        String lastSegment = normalized.substring(normalized.lastIndexOf('/') + 1).strip();

        if (lastSegment.isEmpty()) {
            throw new IllegalArgumentException("Platform name has no usable segment: " + name);
        }

        return lastSegment.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
