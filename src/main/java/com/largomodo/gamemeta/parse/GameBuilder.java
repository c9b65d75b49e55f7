package com.largomodo.gamemeta.parse;

import com.largomodo.gamemeta.core.domain.AssetKind;
import com.largomodo.gamemeta.core.domain.Game;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable accumulator for the game block being parsed.
 */
class GameBuilder {

    private final String title;
    private final List<String> roms = new ArrayList<>();
    private final Map<String, String> assets = new LinkedHashMap<>();
    private String sortKey;
    private String developer;
    private String description;
    private String launchOverride;

    GameBuilder(String title) {
        this.title = title;
    }

    String title() {
        return title;
    }

    void addRom(String path) {
        roms.add(path);
    }

    void sortKey(String sortKey) {
        this.sortKey = sortKey;
    }

    void developer(String developer) {
        this.developer = developer;
    }

    void description(String description) {
        this.description = description;
    }

    void launchOverride(String launchOverride) {
        this.launchOverride = launchOverride;
    }

    void asset(String kind, String path) {
        assets.put(kind, path);
    }

    /**
     * Reconcile file fields and default the assets.
     * Core extraction happens later, once every game is known.
     */
    Game build() {
        // file: lines go straight into roms, so the primary file is always the first rom
        String primaryFile = roms.isEmpty() ? null : roms.get(0);

        if (assets.isEmpty()) {
            for (AssetKind kind : AssetKind.values()) {
                assets.put(kind.getKey(), kind.defaultPath(title));
            }
        }

        return new Game(title,
                Optional.ofNullable(primaryFile),
                roms,
                Optional.ofNullable(sortKey),
                Optional.ofNullable(developer),
                Optional.ofNullable(description),
                Optional.ofNullable(launchOverride),
                Optional.empty(),
                assets);
    }
}
