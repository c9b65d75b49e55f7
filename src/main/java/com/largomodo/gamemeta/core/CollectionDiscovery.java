package com.largomodo.gamemeta.core;

import com.largomodo.gamemeta.core.domain.DiscoveredCollection;
import com.largomodo.gamemeta.util.MetadataFileMatcher;
import com.largomodo.gamemeta.util.PlatformKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Finds platform collections under a resource root.
 * <p>
 * Layout: {@code <root>/<platform dir>/metadata.pegasus.txt}. Only direct sub-directories
 * are inspected. Keys are sorted so batch runs process collections in a stable order.
 */
public class CollectionDiscovery {

    private static final Logger log = LoggerFactory.getLogger(CollectionDiscovery.class);

    /**
     * Discover collections below a root directory.
     *
     * @param root resource root
     * @return platform key to collection, sorted by key; empty when root is not a directory
     * @throws IOException if the root cannot be listed
     */
    public Map<String, DiscoveredCollection> discover(Path root) throws IOException {
        Map<String, DiscoveredCollection> collections = new TreeMap<>();
        if (!Files.isDirectory(root)) {
            log.warn("Resource root is not a directory: {}", root);
            return collections;
        }

        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(Files::isDirectory)
                    .sorted()
                    .forEach(dir -> MetadataFileMatcher.findIn(dir).ifPresent(meta -> {
                        String name = dir.getFileName().toString();
                        String key = PlatformKeys.slugify(name);
                        DiscoveredCollection previous = collections.putIfAbsent(key,
                                new DiscoveredCollection(key, name, meta));
                        if (previous != null) {
                            log.warn("Platform key '{}' of {} already taken by {} - skipping",
                                    key, dir, previous.metadataFile());
                        }
                    }));
        }
        return collections;
    }

    /**
     * Wrap a single metadata file; its key is derived from the containing directory.
     *
     * @param metadataFile metadata file given directly on the command line
     */
    public DiscoveredCollection single(Path metadataFile) {
        Path absolute = metadataFile.toAbsolutePath();
        String name = Optional.ofNullable(absolute.getParent())
                .map(Path::getFileName)
                .map(Path::toString)
                .orElse(absolute.getFileName().toString());
        return new DiscoveredCollection(PlatformKeys.slugify(name), name, metadataFile);
    }
}
