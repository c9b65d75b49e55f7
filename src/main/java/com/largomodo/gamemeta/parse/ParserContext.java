package com.largomodo.gamemeta.parse;

import com.largomodo.gamemeta.core.domain.AssetKind;
import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.ParsedMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Line-by-line state machine behind {@link MetadataParser}.
 * <p>
 * Holds everything that changes while a file is read: the current {@link ParserState},
 * the multi-line key being accumulated and its buffer, the header under construction, the
 * open game block and the games already finalized. Feeding lines one at a time through
 * {@link #accept(String)} makes every transition observable in tests.
 * <p>
 * Recovery over strictness: lines that cannot be interpreted are dropped (logged at DEBUG),
 * never reported as errors.
 * <p>
 * Not thread-safe. One context per parse call.
 */
public class ParserContext {

    private static final Logger log = LoggerFactory.getLogger(ParserContext.class);

    private final HeaderBuilder header = new HeaderBuilder();
    private final List<Game> games = new ArrayList<>();
    private final List<String> buffer = new ArrayList<>();

    private ParserState state = ParserState.HEADER;
    private MetadataKey activeKey;
    // null inside a game: block without a title; its lines are dropped
    private GameBuilder currentGame;

    public ParserState getState() {
        return state;
    }

    /**
     * Multi-line key whose block is currently being accumulated.
     */
    public Optional<MetadataKey> getActiveKey() {
        return Optional.ofNullable(activeKey);
    }

    /**
     * Lines buffered for the active multi-line key (read-only view).
     */
    public List<String> getBuffer() {
        return List.copyOf(buffer);
    }

    /**
     * Games finalized so far.
     */
    public List<Game> getGames() {
        return List.copyOf(games);
    }

    /**
     * Feed one line of input (without line terminator).
     *
     * @param line raw line
     * @throws IllegalStateException if called after {@link #finish()}
     */
    public void accept(String line) {
        if (state == ParserState.DONE) {
            throw new IllegalStateException("Parser context already finished");
        }
        if (line == null || line.isBlank()) {
            // Blank lines never end a block
            return;
        }

        char first = line.charAt(0);
        if (first == ' ' || first == '\t') {
            acceptContinuation(line);
            return;
        }

        if (line.startsWith("#") || line.startsWith("//")) {
            return;
        }

        int colon = line.indexOf(':');
        if (colon <= 0) {
            log.debug("Ignoring line without key: {}", line);
            return;
        }

        String rawKey = line.substring(0, colon);
        String value = line.substring(colon + 1).trim();

        flush();

        Optional<MetadataKey> key = MetadataKey.fromText(rawKey);
        if (key.isEmpty()) {
            log.debug("Ignoring unknown key '{}'", rawKey.trim());
            return;
        }
        acceptKey(key.get(), MetadataKey.normalize(rawKey), value);
    }

    /**
     * Flush pending accumulation, finalize the open game and stop accepting lines.
     *
     * @return header and games in block order; core overrides are not yet derived
     */
    public ParsedMetadata finish() {
        if (state != ParserState.DONE) {
            flush();
            finalizeCurrentGame();
            state = ParserState.DONE;
        }
        return new ParsedMetadata(header.build(), games);
    }

    private void acceptContinuation(String line) {
        if (activeKey == null) {
            log.debug("Ignoring indented line outside of a block: {}", line);
            return;
        }
        buffer.add(line.strip());
    }

    private void acceptKey(MetadataKey key, String normalizedKey, String value) {
        if (key == MetadataKey.GAME) {
            finalizeCurrentGame();
            state = ParserState.GAME;
            if (value.isEmpty()) {
                log.debug("Ignoring game block without title");
                currentGame = null;
            } else {
                currentGame = new GameBuilder(value);
            }
            return;
        }

        if (key.isMultiLine()) {
            activeKey = key;
            buffer.clear();
            // ignore-files entries only come from the indented lines below the key
            if (!value.isEmpty() && key != MetadataKey.IGNORE_FILES) {
                buffer.add(value);
            }
            return;
        }

        boolean inHeader = state == ParserState.HEADER;
        if (!inHeader && currentGame == null) {
            return;
        }

        switch (key) {
            case COLLECTION -> {
                if (inHeader) {
                    header.collection(value);
                }
            }
            case SORT_BY -> {
                if (value.isEmpty()) {
                    return;
                }
                if (inHeader) {
                    header.defaultSortKey(value);
                } else {
                    currentGame.sortKey(value);
                }
            }
            case FILE -> {
                if (!inHeader && !value.isEmpty()) {
                    currentGame.addRom(value);
                }
            }
            case DEVELOPER -> {
                if (!inHeader && !value.isEmpty()) {
                    currentGame.developer(value);
                }
            }
            case ASSET -> {
                String kind = normalizedKey.substring(MetadataKey.ASSET_PREFIX.length());
                if (!inHeader && !value.isEmpty()) {
                    currentGame.asset(AssetKind.normalizeKey(kind), value);
                }
            }
            default -> log.debug("Key '{}' not applicable here", normalizedKey);
        }
    }

    /**
     * Commit the buffered block to the header or the open game.
     */
    private void flush() {
        if (activeKey == null) {
            return;
        }
        MetadataKey key = activeKey;
        List<String> lines = new ArrayList<>(buffer);
        activeKey = null;
        buffer.clear();

        boolean inHeader = state == ParserState.HEADER;
        if (!inHeader && currentGame == null) {
            return;
        }

        switch (key) {
            case LAUNCH -> joinBlock(lines, key).ifPresent(text -> {
                if (inHeader) {
                    header.launchBlock(text);
                } else {
                    currentGame.launchOverride(text);
                }
            });
            case DESCRIPTION -> {
                if (!inHeader) {
                    joinBlock(lines, key).ifPresent(currentGame::description);
                }
            }
            case IGNORE_FILES -> {
                if (inHeader) {
                    lines.stream().filter(l -> !l.isEmpty()).forEach(header::addIgnoreFile);
                }
            }
            case EXTENSION -> {
                if (inHeader) {
                    lines.forEach(l -> splitExtensions(l).forEach(header::addExtension));
                }
            }
            case FILES -> {
                if (!inHeader) {
                    lines.stream()
                            .filter(l -> !l.isEmpty())
                            .filter(l -> !l.equalsIgnoreCase("files:"))
                            .forEach(currentGame::addRom);
                }
            }
            default -> throw new IllegalStateException("Not a multi-line key: " + key);
        }
    }

    private void finalizeCurrentGame() {
        if (currentGame != null) {
            games.add(currentGame.build());
            currentGame = null;
        }
    }

    /**
     * Join block lines, dropping bare repeated {@code key:} marker lines. Text that merely
     * starts with the key word is content and kept as written.
     */
    private static Optional<String> joinBlock(List<String> lines, MetadataKey key) {
        String marker = key.canonicalName() + ":";
        List<String> content = lines.stream()
                .filter(l -> !l.isEmpty())
                .filter(l -> !l.equalsIgnoreCase(marker))
                .toList();
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join("\n", content));
    }

    /**
     * {@code "7z, .ZIP"} to {@code [7z, zip]}.
     */
    static List<String> splitExtensions(String line) {
        List<String> extensions = new ArrayList<>();
        for (String part : line.split(",")) {
            String ext = part.strip().toLowerCase(Locale.ROOT);
            while (ext.startsWith(".")) {
                ext = ext.substring(1);
            }
            if (!ext.isEmpty()) {
                extensions.add(ext);
            }
        }
        return extensions;
    }
}
