package com.largomodo.gamemeta.core.domain;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Asset kinds with a fixed emission order and conventional file names.
 * <p>
 * Metadata files may name further kinds ({@code assets.screenshot}); those are kept under
 * their normalized name and sort after the known kinds.
 */
public enum AssetKind {
    BOX_FRONT("box_front", "boxFront.jpg"),
    LOGO("logo", "logo.png"),
    VIDEO("video", "video.mp4");

    /**
     * Known kinds first (declaration order), unknown kinds alphabetically.
     */
    public static final Comparator<String> EMISSION_ORDER = Comparator
            .comparingInt((String key) -> fromKey(key).map(Enum::ordinal).orElse(values().length))
            .thenComparing(Comparator.naturalOrder());

    private final String key;
    private final String defaultFileName;

    AssetKind(String key, String defaultFileName) {
        this.key = key;
        this.defaultFileName = defaultFileName;
    }

    public String getKey() {
        return key;
    }

    public String getDefaultFileName() {
        return defaultFileName;
    }

    /**
     * Conventional location of this asset for a game without explicit asset lines.
     */
    public String defaultPath(String title) {
        return "media/" + title + "/" + defaultFileName;
    }

    public static Optional<AssetKind> fromKey(String key) {
        String normalized = normalizeKey(key);
        for (AssetKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Fold {@code boxFront}, {@code box-front} and {@code BOX_FRONT} to {@code box_front}.
     *
     * @param key raw kind as written after {@code assets.}
     * @return normalized kind name
     * @throws IllegalArgumentException if key is null or blank
     */
    public static String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Asset kind cannot be null or blank");
        }
        String snake = key.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replace('-', '_');
        return snake.toLowerCase(Locale.ROOT);
    }
}
