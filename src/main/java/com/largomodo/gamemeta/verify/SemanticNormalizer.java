package com.largomodo.gamemeta.verify;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Reduces parsed structures to the fields and forms that carry meaning, so that a
 * hand-written file and its canonical rewrite compare equal.
 * <p>
 * What is ignored:
 * <ul>
 *   <li>indentation of launch lines and the writer's single-line/block choice</li>
 *   <li>ROM order and duplicate ROM entries</li>
 *   <li>Unicode compatibility forms, zero-width characters and trailing blanks in
 *       descriptions</li>
 *   <li>a game launch block repeating the header default (the writer omits it)</li>
 *   <li>primary file and assets, which are re-derived by convention</li>
 * </ul>
 * Stateless. Safe for concurrent use.
 */
public class SemanticNormalizer {

    /**
     * Pairing order for games: title, then first (normalized) ROM.
     */
    public static final Comparator<NormalizedGame> GAME_ORDER = Comparator
            .comparing(NormalizedGame::title)
            .thenComparing(NormalizedGame::firstRom);

    public NormalizedHeader normalize(Header header) {
        return new NormalizedHeader(
                header.collection().strip(),
                header.defaultSortKey().map(String::strip).filter(s -> !s.isEmpty()),
                header.launchBlock().map(SemanticNormalizer::stripIndentation).filter(s -> !s.isEmpty()),
                splitEntries(header.ignoreFiles()),
                splitEntries(header.extensions()));
    }

    /**
     * Normalize one game against the header it inherits from.
     */
    public NormalizedGame normalize(Game game, Header header) {
        Optional<String> defaultLaunch = header.launchBlock().map(SemanticNormalizer::stripIndentation);
        Optional<String> launch = game.launchOverride()
                .map(SemanticNormalizer::stripIndentation)
                .filter(s -> !s.isEmpty())
                .filter(s -> !defaultLaunch.map(s::equals).orElse(false));

        // The core override travels with its launch block
        Optional<String> core = launch.isPresent() ? game.coreOverride() : Optional.empty();

        return new NormalizedGame(
                game.title().strip(),
                game.sortKey().map(String::strip).filter(s -> !s.isEmpty()),
                game.developer().map(String::strip).filter(s -> !s.isEmpty()),
                game.description().map(SemanticNormalizer::cleanText).filter(s -> !s.isEmpty()),
                launch,
                core,
                normalizeRoms(game.roms()));
    }

    /**
     * Normalize and sort all games of a collection.
     */
    public List<NormalizedGame> normalize(List<Game> games, Header header) {
        List<NormalizedGame> normalized = new ArrayList<>(games.size());
        for (Game game : games) {
            normalized.add(normalize(game, header));
        }
        normalized.sort(GAME_ORDER);
        return normalized;
    }

    static List<String> normalizeRoms(List<String> roms) {
        TreeSet<String> unique = new TreeSet<>();
        for (String rom : roms) {
            if (rom == null) {
                continue;
            }
            String cleaned = cleanText(rom.strip());
            if (!cleaned.isEmpty()) {
                unique.add(cleaned);
            }
        }
        return List.copyOf(unique);
    }

    /**
     * Entries written as {@code "7z, zip"} count as two entries.
     */
    static List<String> splitEntries(List<String> entries) {
        List<String> result = new ArrayList<>();
        for (String entry : entries) {
            for (String part : entry.split(",")) {
                String trimmed = part.strip();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return List.copyOf(result);
    }

    static String stripIndentation(String block) {
        List<String> lines = new ArrayList<>();
        block.lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .forEach(lines::add);
        return String.join("\n", lines);
    }

    /**
     * NFKC, no zero-width or Unicode line separators, {@code \n} line breaks, no trailing
     * blanks, no surrounding blank lines.
     */
    static String cleanText(String text) {
        String s = Normalizer.normalize(text, Normalizer.Form.NFKC);
        s = s.replaceAll("[\\u200B\\u200C\\u200D\\uFEFF\\u2028\\u2029]", "");
        s = s.replace("\r\n", "\n").replace('\r', '\n');

        List<String> lines = new ArrayList<>();
        for (String line : s.split("\n", -1)) {
            lines.add(line.stripTrailing());
        }
        return String.join("\n", lines).strip();
    }
}
