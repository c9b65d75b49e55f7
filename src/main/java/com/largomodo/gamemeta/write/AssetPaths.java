package com.largomodo.gamemeta.write;

import com.largomodo.gamemeta.core.domain.AssetKind;
import com.largomodo.gamemeta.core.domain.Game;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Path-segment helpers for asset locations of multi-disc games.
 * <p>
 * Paths are handled as segment lists so {@code 009/disc1.chd} and {@code 009\disc1.chd}
 * behave the same. Output always uses {@code /}.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class AssetPaths {

    private static final String MEDIA_ROOT = "media";

    private AssetPaths() {
        // Static utility class - prevent instantiation
    }

    /**
     * Split a relative path on {@code /} and {@code \}, dropping empty and {@code .} segments.
     */
    public static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        for (String segment : path.split("[/\\\\]")) {
            String trimmed = segment.strip();
            if (!trimmed.isEmpty() && !trimmed.equals(".")) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    /**
     * Leading directory of a ROM path: {@code 009} for {@code 009/Disc 1.chd}.
     *
     * @return empty when the path has no directory component
     */
    public static Optional<String> leadingDirectory(String romPath) {
        List<String> segments = segments(romPath);
        return segments.size() > 1 ? Optional.of(segments.get(0)) : Optional.empty();
    }

    /**
     * Last segment of a path.
     */
    public static String fileName(String path) {
        List<String> segments = segments(path);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * Asset paths to persist for a multi-disc game, keyed by kind in emission order.
     * <p>
     * Each asset keeps only its file name and moves under {@code media/<dir>/}, where
     * {@code <dir>} is the leading directory of the first ROM. Assets stay untouched when
     * the first ROM sits at the collection root.
     *
     * @param game multi-disc game
     * @return ordered kind to path map
     */
    public static Map<String, String> forMultiDisc(Game game) {
        Optional<String> directory = game.roms().isEmpty()
                ? Optional.empty()
                : leadingDirectory(game.roms().get(0));

        Map<String, String> result = new LinkedHashMap<>();
        game.assets().keySet().stream()
                .sorted(AssetKind.EMISSION_ORDER)
                .forEach(kind -> {
                    String path = game.assets().get(kind);
                    String fileName = fileName(path);
                    if (fileName.isEmpty()) {
                        return;
                    }
                    result.put(kind, directory
                            .map(dir -> String.join("/", MEDIA_ROOT, dir, fileName))
                            .orElse(path));
                });
        return result;
    }
}
