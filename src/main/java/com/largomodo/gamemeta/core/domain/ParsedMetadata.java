package com.largomodo.gamemeta.core.domain;

import java.util.List;

/**
 * Result of parsing one metadata file: the header and the games in block order.
 *
 * @param header collection defaults
 * @param games  finalized games (unmodifiable)
 */
public record ParsedMetadata(Header header, List<Game> games) {

    public ParsedMetadata {
        if (header == null) {
            throw new IllegalArgumentException("header must not be null");
        }
        games = List.copyOf(games);
    }
}
