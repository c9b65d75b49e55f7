package com.largomodo.gamemeta.parse;

import java.util.Locale;
import java.util.Optional;

/**
 * Keys the parser understands, with their text spellings.
 * <p>
 * Keys are matched case-insensitively and {@code _} is accepted in place of {@code -}, so
 * {@code sort_by}, {@code Sort-By} and {@code sort-by} are the same key.
 */
public enum MetadataKey {
    COLLECTION(false, "collection"),
    GAME(false, "game"),
    FILE(false, "file"),
    FILES(true, "files"),
    SORT_BY(false, "sort-by"),
    DEVELOPER(false, "developer"),
    DESCRIPTION(true, "description"),
    LAUNCH(true, "launch"),
    IGNORE_FILES(true, "ignore-files"),
    EXTENSION(true, "extension", "extensions"),
    ASSET(false, "assets.");

    static final String ASSET_PREFIX = "assets.";

    private final boolean multiLine;
    private final String[] spellings;

    MetadataKey(boolean multiLine, String... spellings) {
        this.multiLine = multiLine;
        this.spellings = spellings;
    }

    /**
     * Whether indented lines following this key belong to its value.
     */
    public boolean isMultiLine() {
        return multiLine;
    }

    /**
     * Canonical spelling used by the writer.
     */
    public String canonicalName() {
        return spellings[0];
    }

    /**
     * Canonical form of a key as written: trimmed, lowercase, {@code _} folded to {@code -}.
     * The part after {@code assets.} is left to {@code AssetKind} normalization.
     */
    static String normalize(String rawKey) {
        String key = rawKey.trim();
        if (key.toLowerCase(Locale.ROOT).startsWith(ASSET_PREFIX)) {
            return ASSET_PREFIX + key.substring(ASSET_PREFIX.length()).trim();
        }
        return key.toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Resolve a raw key.
     *
     * @param rawKey text before the first colon of a key line
     * @return matching key, or empty for keys this parser ignores
     */
    public static Optional<MetadataKey> fromText(String rawKey) {
        if (rawKey == null) {
            return Optional.empty();
        }
        String key = normalize(rawKey);
        if (key.startsWith(ASSET_PREFIX)) {
            return key.length() > ASSET_PREFIX.length() ? Optional.of(ASSET) : Optional.empty();
        }
        for (MetadataKey candidate : values()) {
            for (String spelling : candidate.spellings) {
                if (spelling.equals(key)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }
}
