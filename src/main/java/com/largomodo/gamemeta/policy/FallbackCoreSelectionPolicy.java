package com.largomodo.gamemeta.policy;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;
import com.largomodo.gamemeta.launch.CoreExtractor;
import com.largomodo.gamemeta.write.AssetPaths;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Resolves cores by falling through increasingly generic sources:
 * 1. the game's own core override
 * 2. the core loaded by the collection's default launch block
 * 3. a per-platform table
 * 4. a per-extension table keyed by the primary file's extension
 * <p>
 * Tables are injected or loaded from a classpath properties resource with
 * {@code platform.<key>=<core>} and {@code extension.<ext>=<core>} entries.
 * <p>
 * Immutable after construction. Safe for concurrent use.
 */
public class FallbackCoreSelectionPolicy implements CoreSelectionPolicy {

    public static final String DEFAULT_RESOURCE = "/gamemeta/core-defaults.properties";

    private static final String PLATFORM_PREFIX = "platform.";
    private static final String EXTENSION_PREFIX = "extension.";

    private final Map<String, String> platformCores;
    private final Map<String, String> extensionCores;

    /**
     * @param platformCores  platform key to core
     * @param extensionCores lowercase extension (without dot) to core
     */
    public FallbackCoreSelectionPolicy(Map<String, String> platformCores, Map<String, String> extensionCores) {
        this.platformCores = Map.copyOf(platformCores);
        this.extensionCores = Map.copyOf(extensionCores);
    }

    /**
     * Load both tables from a classpath properties resource.
     *
     * @param resourcePath absolute classpath path (leading slash required)
     * @throws IOException if the resource is missing or unreadable
     */
    public static FallbackCoreSelectionPolicy fromResource(String resourcePath) throws IOException {
        try (InputStream stream = FallbackCoreSelectionPolicy.class.getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IOException("Internal resource " + resourcePath +
                        " not found. Ensure application is built correctly.");
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }

            Map<String, String> platforms = new HashMap<>();
            Map<String, String> extensions = new HashMap<>();
            for (String name : properties.stringPropertyNames()) {
                String core = properties.getProperty(name).strip();
                if (name.startsWith(PLATFORM_PREFIX)) {
                    platforms.put(name.substring(PLATFORM_PREFIX.length()), core);
                } else if (name.startsWith(EXTENSION_PREFIX)) {
                    extensions.put(name.substring(EXTENSION_PREFIX.length()).toLowerCase(Locale.ROOT), core);
                }
            }
            return new FallbackCoreSelectionPolicy(platforms, extensions);
        }
    }

    @Override
    public Optional<String> chooseCore(String platformKey, Header header, Game game) {
        if (game.coreOverride().isPresent()) {
            return game.coreOverride();
        }

        Optional<String> collectionCore = header.launchBlock().flatMap(CoreExtractor::extract);
        if (collectionCore.isPresent()) {
            return collectionCore;
        }

        String platformCore = platformKey == null ? null : platformCores.get(platformKey);
        if (platformCore != null) {
            return Optional.of(platformCore);
        }

        return game.primaryFile()
                .map(AssetPaths::fileName)
                .flatMap(FallbackCoreSelectionPolicy::extensionOf)
                .map(extensionCores::get);
    }

    private static Optional<String> extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
