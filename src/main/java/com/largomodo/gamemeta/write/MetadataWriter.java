package com.largomodo.gamemeta.write;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;
import com.largomodo.gamemeta.core.domain.ParsedMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes a header and games back to metadata text in one canonical layout.
 * <p>
 * Field order, indentation (two spaces) and line endings ({@code \n}) are fixed here, not
 * taken from the data, so the same logical input always produces byte-identical output.
 * <p>
 * Conventions that keep the output terse:
 * <ul>
 *   <li>one ROM is written as {@code file:}, several as a {@code files:} block</li>
 *   <li>assets are only written for multi-disc games; single-file games get them back by
 *       convention when parsed</li>
 *   <li>a game launch block equal to the header default is inherited, not repeated</li>
 * </ul>
 * Stateless design enables concurrent use without synchronization.
 */
public class MetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(MetadataWriter.class);

    private static final String INDENT = "  ";

    /**
     * Write canonical text to a UTF-8 file, replacing any existing content.
     *
     * @param metadata header and games
     * @param target   destination file (parent directory must exist)
     * @throws IOException if the file cannot be written
     */
    public void write(ParsedMetadata metadata, Path target) throws IOException {
        Files.writeString(target, render(metadata.header(), metadata.games()), StandardCharsets.UTF_8);
        log.debug("Wrote {} game(s) to {}", metadata.games().size(), target);
    }

    /**
     * Render canonical text in memory.
     */
    public String render(ParsedMetadata metadata) {
        return render(metadata.header(), metadata.games());
    }

    /**
     * Render canonical text in memory.
     *
     * @param header collection defaults
     * @param games  games in output order
     * @return metadata text
     */
    public String render(Header header, List<Game> games) {
        StringBuilder out = new StringBuilder();
        writeHeader(out, header);
        for (Game game : games) {
            writeGame(out, game, header);
        }
        return out.toString();
    }

    private void writeHeader(StringBuilder out, Header header) {
        if (!header.collection().isBlank()) {
            line(out, "collection", header.collection());
        }
        header.defaultSortKey().ifPresent(sortKey -> line(out, "sort-by", sortKey));
        header.launchBlock().ifPresent(launch -> value(out, "launch", launch));

        if (!header.ignoreFiles().isEmpty()) {
            block(out, "ignore-files", header.ignoreFiles());
        }
        if (!header.extensions().isEmpty()) {
            block(out, "extension", header.extensions());
        }
        out.append('\n');
    }

    private void writeGame(StringBuilder out, Game game, Header header) {
        if (game.title().isBlank()) {
            return;
        }
        line(out, "game", game.title());

        List<String> roms = game.roms();
        if (roms.size() == 1) {
            line(out, "file", roms.get(0));
        } else if (roms.size() > 1) {
            block(out, "files", roms);
        }

        game.sortKey().ifPresent(sortKey -> line(out, "sort-by", sortKey));
        game.developer().ifPresent(developer -> line(out, "developer", developer));

        if (game.isMultiDisc()) {
            for (Map.Entry<String, String> asset : AssetPaths.forMultiDisc(game).entrySet()) {
                line(out, "assets." + asset.getKey(), asset.getValue());
            }
        }

        game.description().ifPresent(description -> value(out, "description", description));

        game.launchOverride()
                .filter(launch -> !isInherited(launch, header.launchBlock()))
                .ifPresent(launch -> value(out, "launch", launch));

        out.append('\n');
    }

    private static boolean isInherited(String launch, Optional<String> defaultLaunch) {
        return defaultLaunch.map(String::strip).filter(launch.strip()::equals).isPresent();
    }

    /**
     * Single line when the value has one non-blank line, indented block otherwise.
     */
    private static void value(StringBuilder out, String key, String text) {
        List<String> lines = text.lines()
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .toList();
        if (lines.isEmpty()) {
            return;
        }
        if (lines.size() == 1) {
            line(out, key, lines.get(0));
        } else {
            block(out, key, lines);
        }
    }

    private static void block(StringBuilder out, String key, List<String> entries) {
        out.append(key).append(":\n");
        for (String entry : entries) {
            out.append(INDENT).append(entry).append('\n');
        }
    }

    private static void line(StringBuilder out, String key, String value) {
        out.append(key).append(": ").append(value).append('\n');
    }
}
