package com.largomodo.gamemeta.parse;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.ParsedMetadata;
import com.largomodo.gamemeta.launch.CoreExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses collection metadata text into a header and an ordered list of games.
 * <p>
 * The format is hand-edited, so the parser favors recovery: unknown keys, stray indented
 * lines and malformed block starts are dropped and parsing continues. The only failure is
 * an unreadable source ({@link MetadataFormatException}).
 * <p>
 * After all blocks are read, each game's launch override is scanned for a libretro core
 * reference, which becomes the game's core override.
 * <p>
 * Stateless between calls (every parse gets a fresh {@link ParserContext}). Safe for
 * concurrent use.
 */
public class MetadataParser {

    private static final Logger log = LoggerFactory.getLogger(MetadataParser.class);

    private static final char BOM = '\uFEFF';

    /**
     * Parse a UTF-8 metadata file.
     *
     * @param path metadata file
     * @return parsed header and games
     * @throws MetadataFormatException if the file cannot be read
     */
    public ParsedMetadata parse(Path path) throws MetadataFormatException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ParsedMetadata result = parse(reader);
            log.debug("Parsed {} game(s) from {}", result.games().size(), path);
            return result;
        } catch (MetadataFormatException e) {
            throw e;
        } catch (IOException e) {
            throw new MetadataFormatException("Cannot read metadata file: " + path, e);
        }
    }

    /**
     * Parse metadata from a character stream. The reader is not closed.
     *
     * @throws MetadataFormatException if reading fails
     */
    public ParsedMetadata parse(Reader reader) throws MetadataFormatException {
        BufferedReader buffered = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        ParserContext context = new ParserContext();
        try {
            String line = buffered.readLine();
            if (line != null && !line.isEmpty() && line.charAt(0) == BOM) {
                line = line.substring(1);
            }
            while (line != null) {
                context.accept(line);
                line = buffered.readLine();
            }
        } catch (IOException e) {
            throw new MetadataFormatException("Cannot read metadata: " + e.getMessage(), e);
        }
        return withCoreOverrides(context.finish());
    }

    /**
     * Parse metadata already held in memory.
     */
    public ParsedMetadata parse(String text) {
        ParserContext context = new ParserContext();
        String content = !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        content.lines().forEach(context::accept);
        return withCoreOverrides(context.finish());
    }

    private static ParsedMetadata withCoreOverrides(ParsedMetadata parsed) {
        List<Game> games = new ArrayList<>(parsed.games().size());
        for (Game game : parsed.games()) {
            games.add(game.withCoreOverride(game.launchOverride().flatMap(CoreExtractor::extract)));
        }
        return new ParsedMetadata(parsed.header(), games);
    }
}
