package com.largomodo.gamemeta.verify;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SemanticNormalizerTest {

    private static final String DEFAULT_LAUNCH = "retroarch -L cores/flycast_libretro.so {file.path}";

    private final SemanticNormalizer normalizer = new SemanticNormalizer();

    private static Game game(String title, List<String> roms, Optional<String> description,
                             Optional<String> launch, Optional<String> core) {
        return new Game(title, roms.stream().findFirst(), roms, Optional.empty(), Optional.empty(),
                description, launch, core, Map.of());
    }

    @Test
    void testCommaJoinedExtensionsEqualSplitForm() {
        Header joined = new Header("DC", Optional.empty(), Optional.empty(), List.of(), List.of("chd, cdi"));
        Header split = new Header("DC", Optional.empty(), Optional.empty(), List.of(), List.of("chd", "cdi"));

        assertEquals(normalizer.normalize(split), normalizer.normalize(joined));
    }

    @Test
    void testLaunchIndentationIgnored() {
        Header indented = new Header("", Optional.empty(), Optional.of("am start\n    -n x/.A\n    -e ROM y"),
                List.of(), List.of());
        Header flat = new Header("", Optional.empty(), Optional.of("am start\n-n x/.A\n-e ROM y"),
                List.of(), List.of());

        assertTrue(normalizer.normalize(indented).differences(normalizer.normalize(flat)).isEmpty());
    }

    @Test
    void testHeaderDifferencesListed() {
        Header left = new Header("DC", Optional.of("name"), Optional.empty(), List.of(), List.of("chd"));
        Header right = new Header("Dreamcast", Optional.of("name"), Optional.empty(), List.of(), List.of());

        List<String> diff = normalizer.normalize(left).differences(normalizer.normalize(right));

        assertEquals(2, diff.size());
        assertTrue(diff.get(0).startsWith("collection: DC != Dreamcast"));
        assertTrue(diff.get(1).startsWith("extension:"));
    }

    @Test
    void testRomsSortedAndDeduplicated() {
        assertEquals(List.of("a.chd", "b.chd"), SemanticNormalizer.normalizeRoms(List.of("b.chd", " a.chd", "b.chd", "")));
    }

    @Test
    void testDescriptionCleaned() {
        Game messy = game("X", List.of(), Optional.of("\uFF26\uFF55\uFF4C\uFF4C\u200Bwidth  \r\nline two \r\n"),
                Optional.empty(), Optional.empty());
        Game clean = game("X", List.of(), Optional.of("Fullwidth\nline two"), Optional.empty(), Optional.empty());

        assertEquals(normalizer.normalize(clean, Header.empty()), normalizer.normalize(messy, Header.empty()));
    }

    @Test
    void testCleanText() {
        assertEquals("a\nb", SemanticNormalizer.cleanText("\n a  \r\nb\u2028\n\n"));
        assertEquals("fi", SemanticNormalizer.cleanText("\uFB01"));
    }

    @Test
    void testLaunchEqualToHeaderDefaultDropped() {
        Header header = new Header("", Optional.empty(), Optional.of(DEFAULT_LAUNCH), List.of(), List.of());
        Game explicit = game("Crazy Taxi", List.of("ct.cdi"), Optional.empty(),
                Optional.of("  " + DEFAULT_LAUNCH), Optional.of("flycast_libretro.so"));
        Game inherited = game("Crazy Taxi", List.of("ct.cdi"), Optional.empty(), Optional.empty(), Optional.empty());

        NormalizedGame normalized = normalizer.normalize(explicit, header);

        assertEquals(Optional.empty(), normalized.launchOverride());
        assertEquals(Optional.empty(), normalized.coreOverride());
        assertEquals(normalizer.normalize(inherited, header), normalized);
    }

    @Test
    void testOwnLaunchKeepsCore() {
        Header header = new Header("", Optional.empty(), Optional.of(DEFAULT_LAUNCH), List.of(), List.of());
        Game own = game("Jet Set Radio", List.of("jsr.gdi"), Optional.empty(),
                Optional.of("retroarch -L cores/other_libretro.so {file.path}"), Optional.of("other_libretro.so"));

        NormalizedGame normalized = normalizer.normalize(own, header);

        assertEquals(Optional.of("other_libretro.so"), normalized.coreOverride());
    }

    @Test
    void testGamesSortedByTitleThenFirstRom() {
        List<Game> games = List.of(
                game("B", List.of("b.bin"), Optional.empty(), Optional.empty(), Optional.empty()),
                game("A", List.of("z.bin"), Optional.empty(), Optional.empty(), Optional.empty()),
                game("A", List.of("a.bin"), Optional.empty(), Optional.empty(), Optional.empty()));

        List<NormalizedGame> normalized = normalizer.normalize(games, Header.empty());

        assertEquals(List.of("A:a.bin", "A:z.bin", "B:b.bin"),
                normalized.stream().map(g -> g.title() + ":" + g.firstRom()).toList());
    }

    @Test
    void testAssetsAndPrimaryFileIgnored() {
        Game withAssets = new Game("X", Optional.of("a.bin"), List.of("a.bin", "b.bin"), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Map.of("logo", "l.png"));
        Game without = new Game("X", Optional.of("b.bin"), List.of("b.bin", "a.bin"), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Map.of());

        assertEquals(normalizer.normalize(without, Header.empty()), normalizer.normalize(withAssets, Header.empty()));
    }
}
