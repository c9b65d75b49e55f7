package com.largomodo.gamemeta.core;

import com.largomodo.gamemeta.core.domain.DiscoveredCollection;
import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.ParsedMetadata;
import com.largomodo.gamemeta.parse.MetadataParser;
import com.largomodo.gamemeta.policy.CoreSelectionPolicy;
import com.largomodo.gamemeta.util.MetadataFileMatcher;
import com.largomodo.gamemeta.verify.ClosureMismatchException;
import com.largomodo.gamemeta.verify.ClosureReport;
import com.largomodo.gamemeta.verify.ClosureVerifier;
import com.largomodo.gamemeta.write.MetadataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Runs one collection through the selected {@link ProcessingMode}.
 * <p>
 * Modes:
 * - SUMMARY: parse, resolve cores through the policy, log counts
 * - VERIFY: closure check; a mismatch raises {@link ClosureMismatchException}
 * - CANONICALIZE: write {@code <outputRoot>/<key>/metadata.pegasus.txt}
 * <p>
 * Holds no per-collection state, so one instance serves a whole batch.
 */
public class CollectionProcessor {

    private static final Logger log = LoggerFactory.getLogger(CollectionProcessor.class);

    private final MetadataParser parser;
    private final MetadataWriter writer;
    private final ClosureVerifier verifier;
    private final CoreSelectionPolicy corePolicy;
    private final Path outputRoot;
    private final boolean keepScratch;

    /**
     * @param outputRoot  canonical output root; required for CANONICALIZE only (may be null)
     * @param keepScratch leave closure scratch files on disk
     */
    public CollectionProcessor(MetadataParser parser,
                               MetadataWriter writer,
                               ClosureVerifier verifier,
                               CoreSelectionPolicy corePolicy,
                               Path outputRoot,
                               boolean keepScratch) {
        this.parser = parser;
        this.writer = writer;
        this.verifier = verifier;
        this.corePolicy = corePolicy;
        this.outputRoot = outputRoot;
        this.keepScratch = keepScratch;
    }

    /**
     * Process one collection.
     *
     * @param collection collection to process
     * @param mode       what to do with it
     * @return number of games parsed from the source
     * @throws IOException              if reading or writing fails
     * @throws ClosureMismatchException if VERIFY finds a semantic difference
     */
    public int process(DiscoveredCollection collection, ProcessingMode mode) throws IOException {
        return switch (mode) {
            case SUMMARY -> summarize(collection);
            case VERIFY -> verify(collection);
            case CANONICALIZE -> canonicalize(collection);
        };
    }

    private int summarize(DiscoveredCollection collection) throws IOException {
        ParsedMetadata metadata = parser.parse(collection.metadataFile());

        int withoutCore = 0;
        for (Game game : metadata.games()) {
            Optional<String> core = corePolicy.chooseCore(collection.key(), metadata.header(), game);
            if (core.isEmpty()) {
                withoutCore++;
            }
            log.debug("{} -> core {}", game.title(), core.orElse("<none>"));
        }

        log.info("{} ({}): {} games, {} extension(s), {} without a resolvable core",
                collection.key(), metadata.header().collection(), metadata.games().size(),
                metadata.header().extensions().size(), withoutCore);
        return metadata.games().size();
    }

    private int verify(DiscoveredCollection collection) throws IOException {
        ClosureReport report = verifier.verify(collection.metadataFile(), keepScratch);
        if (!report.ok()) {
            throw new ClosureMismatchException("Closure check failed for " + collection.metadataFile()
                    + " (header same: " + report.headerSame() + ", games same: " + report.gamesSame() + ")",
                    report);
        }
        return report.originalGameCount();
    }

    private int canonicalize(DiscoveredCollection collection) throws IOException {
        if (outputRoot == null) {
            throw new IllegalStateException("Output root is required to canonicalize collections");
        }
        ParsedMetadata metadata = parser.parse(collection.metadataFile());

        Path targetDir = outputRoot.resolve(collection.key());
        Files.createDirectories(targetDir);
        Path target = targetDir.resolve(MetadataFileMatcher.PRIMARY_NAME);
        if (Files.exists(target)) {
            log.warn("Overwriting existing file: {}", target);
        }
        writer.write(metadata, target);

        log.info("{} -> {}", collection.metadataFile(), target);
        return metadata.games().size();
    }
}
