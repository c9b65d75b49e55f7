package com.largomodo.gamemeta.verify;

import java.util.List;
import java.util.Optional;

/**
 * Game reduced to its comparable form. ROMs are sorted and unique.
 */
public record NormalizedGame(String title,
                             Optional<String> sortKey,
                             Optional<String> developer,
                             Optional<String> description,
                             Optional<String> launchOverride,
                             Optional<String> coreOverride,
                             List<String> roms) {

    public NormalizedGame {
        roms = List.copyOf(roms);
    }

    /**
     * Second half of the pairing key; empty string for games without files.
     */
    public String firstRom() {
        return roms.isEmpty() ? "" : roms.get(0);
    }
}
