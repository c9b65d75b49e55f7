package com.largomodo.gamemeta.policy;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core resolution precedence: game override, collection launch, platform, extension.
 */
class FallbackCoreSelectionPolicyTest {

    private final FallbackCoreSelectionPolicy policy = new FallbackCoreSelectionPolicy(
            Map.of("dc", "flycast_libretro.so"),
            Map.of("cue", "mednafen_psx_hw_libretro.so", "chd", "mednafen_saturn_libretro.so"));

    private static Game game(String rom, Optional<String> core) {
        return new Game("Game", Optional.ofNullable(rom), rom == null ? List.of() : List.of(rom),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), core, Map.of());
    }

    private static Header header(String launch) {
        return new Header("X", Optional.empty(), Optional.ofNullable(launch), List.of(), List.of());
    }

    @Test
    void testGameOverrideWins() {
        Optional<String> core = policy.chooseCore("dc", header("retroarch -L a_libretro.so"),
                game("x.cue", Optional.of("own_libretro.so")));

        assertEquals(Optional.of("own_libretro.so"), core);
    }

    @Test
    void testCollectionLaunchBeforeTables() {
        Optional<String> core = policy.chooseCore("dc", header("retroarch -L cores/a_libretro.so {file.path}"),
                game("x.cue", Optional.empty()));

        assertEquals(Optional.of("a_libretro.so"), core);
    }

    @Test
    void testPlatformTable() {
        Optional<String> core = policy.chooseCore("dc", header("flycast {file.path}"), game("x.cue", Optional.empty()));

        assertEquals(Optional.of("flycast_libretro.so"), core);
    }

    @Test
    void testExtensionTable() {
        assertEquals(Optional.of("mednafen_psx_hw_libretro.so"),
                policy.chooseCore("psx", header(null), game("Final Fantasy VII/Disc 1.CUE", Optional.empty())));
    }

    @Test
    void testNothingResolves() {
        assertEquals(Optional.empty(), policy.chooseCore("gb", header(null), game("tetris.gb", Optional.empty())));
        assertEquals(Optional.empty(), policy.chooseCore(null, header(null), game(null, Optional.empty())));
        assertEquals(Optional.empty(), policy.chooseCore("gb", header(null), game("README", Optional.empty())));
    }

    @Test
    void testBundledDefaults() throws IOException {
        FallbackCoreSelectionPolicy defaults =
                FallbackCoreSelectionPolicy.fromResource(FallbackCoreSelectionPolicy.DEFAULT_RESOURCE);

        assertEquals(Optional.of("flycast"), defaults.chooseCore("dc", header(null), game("a.cdi", Optional.empty())));
        assertEquals(Optional.of("mednafen_psx_hw"),
                defaults.chooseCore("unknown", header(null), game("a.cue", Optional.empty())));
    }

    @Test
    void testMissingResource() {
        IOException e = assertThrows(IOException.class,
                () -> FallbackCoreSelectionPolicy.fromResource("/gamemeta/does-not-exist.properties"));
        assertTrue(e.getMessage().contains("does-not-exist"));
    }
}
