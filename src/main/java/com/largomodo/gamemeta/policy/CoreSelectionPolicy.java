package com.largomodo.gamemeta.policy;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;

import java.util.Optional;

/**
 * Chooses the emulator core a game should run with.
 * <p>
 * Product policy, deliberately kept out of the parser and writer: different frontends and
 * platform families resolve cores differently, so callers plug in the policy they need.
 */
public interface CoreSelectionPolicy {

    /**
     * @param platformKey slug of the platform directory (e.g. {@code dc}, {@code ss_hack})
     * @param header      collection defaults
     * @param game        game to resolve
     * @return core name, or empty when the policy has no answer
     */
    Optional<String> chooseCore(String platformKey, Header header, Game game);
}
