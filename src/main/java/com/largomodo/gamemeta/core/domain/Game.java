package com.largomodo.gamemeta.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable library entry parsed from one {@code game:} block.
 * <p>
 * The title is the key of the block and must not be blank. ROM paths keep their declared
 * order and duplicates; exporters decide whether to deduplicate. Assets keep insertion order.
 * </p>
 *
 * @param title          display title (block key)
 * @param primaryFile    first ROM path, if any
 * @param roms           relative ROM paths in declaration order
 * @param sortKey        per-game sort key overriding the header default
 * @param developer      developer credit
 * @param description    free text, possibly multi-line
 * @param launchOverride verbatim launch block of this game
 * @param coreOverride   core file name derived from {@code launchOverride}
 * @param assets         asset kind name to relative path
 */
public record Game(String title,
                   Optional<String> primaryFile,
                   List<String> roms,
                   Optional<String> sortKey,
                   Optional<String> developer,
                   Optional<String> description,
                   Optional<String> launchOverride,
                   Optional<String> coreOverride,
                   Map<String, String> assets) {

    /**
     * Compact constructor that validates the title and freezes collections.
     *
     * @throws IllegalArgumentException if title is null or blank
     */
    public Game {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be null or blank");
        }
        primaryFile = primaryFile == null ? Optional.empty() : primaryFile;
        roms = roms == null ? List.of() : List.copyOf(roms);
        sortKey = sortKey == null ? Optional.empty() : sortKey;
        developer = developer == null ? Optional.empty() : developer;
        description = description == null ? Optional.empty() : description;
        launchOverride = launchOverride == null ? Optional.empty() : launchOverride;
        coreOverride = coreOverride == null ? Optional.empty() : coreOverride;
        assets = assets == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
    }

    /**
     * A game spanning more than one ROM file (e.g. several disc images).
     */
    public boolean isMultiDisc() {
        return roms.size() > 1;
    }

    /**
     * Copy of this game with a different core override.
     */
    public Game withCoreOverride(Optional<String> core) {
        return new Game(title, primaryFile, roms, sortKey, developer, description,
                launchOverride, core, assets);
    }
}
