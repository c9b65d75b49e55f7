package com.largomodo.gamemeta.verify;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a parse, write, parse cycle.
 *
 * @param headerDifferences  differing header fields, empty when headers match
 * @param firstMismatch      first pair of games (in pairing order) that differ
 * @param originalGameCount  games parsed from the source
 * @param reparsedGameCount  games parsed from the canonical rewrite
 */
public record ClosureReport(List<String> headerDifferences,
                            Optional<GameMismatch> firstMismatch,
                            int originalGameCount,
                            int reparsedGameCount) {

    public ClosureReport {
        headerDifferences = List.copyOf(headerDifferences);
        firstMismatch = firstMismatch == null ? Optional.empty() : firstMismatch;
    }

    public boolean headerSame() {
        return headerDifferences.isEmpty();
    }

    public boolean gamesSame() {
        return firstMismatch.isEmpty() && originalGameCount == reparsedGameCount;
    }

    /**
     * True when the rewrite is semantically identical to the source.
     */
    public boolean ok() {
        return headerSame() && gamesSame();
    }

    /**
     * A game present on one side only has an empty counterpart.
     */
    public record GameMismatch(Optional<NormalizedGame> original, Optional<NormalizedGame> reparsed) {
    }
}
