package com.largomodo.gamemeta.verify;

import com.largomodo.gamemeta.core.domain.ParsedMetadata;
import com.largomodo.gamemeta.core.workspace.CleanupException;
import com.largomodo.gamemeta.core.workspace.ScratchWorkspace;
import com.largomodo.gamemeta.parse.MetadataParser;
import com.largomodo.gamemeta.write.MetadataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Proves that a metadata file survives parse, canonical write and re-parse.
 * <p>
 * Workflow:
 * 1. Parse the source file
 * 2. Write the canonical form to {@code _norm_test/<name>.norm} beside it
 * 3. Parse the scratch file
 * 4. Compare both results after {@link SemanticNormalizer}
 * 5. Remove the scratch file (failures logged, never propagated)
 * <p>
 * A mismatch is not an error: it is reported through {@link ClosureReport} for triage.
 * I/O failures (unreadable source, unwritable scratch location) propagate.
 */
public class ClosureVerifier {

    private static final Logger log = LoggerFactory.getLogger(ClosureVerifier.class);

    private final MetadataParser parser;
    private final MetadataWriter writer;
    private final SemanticNormalizer normalizer;

    public ClosureVerifier() {
        this(new MetadataParser(), new MetadataWriter(), new SemanticNormalizer());
    }

    public ClosureVerifier(MetadataParser parser, MetadataWriter writer, SemanticNormalizer normalizer) {
        this.parser = parser;
        this.writer = writer;
        this.normalizer = normalizer;
    }

    /**
     * Verify closure of a metadata file, removing the scratch copy afterwards.
     *
     * @see #verify(Path, boolean)
     */
    public ClosureReport verify(Path source) throws IOException {
        return verify(source, false);
    }

    /**
     * Verify closure of a metadata file.
     *
     * @param source      metadata file
     * @param keepScratch leave the canonical scratch copy on disk for debugging
     * @return comparison report
     * @throws IOException if the source cannot be read or the scratch copy cannot be written
     */
    public ClosureReport verify(Path source, boolean keepScratch) throws IOException {
        ParsedMetadata original = parser.parse(source);

        ScratchWorkspace workspace = new ScratchWorkspace(source, keepScratch);
        ParsedMetadata reparsed;
        try {
            Path scratch = workspace.prepare();
            writer.write(original, scratch);
            reparsed = parser.parse(scratch);
        } finally {
            cleanup(workspace);
        }

        ClosureReport report = compare(original, reparsed);
        logReport(source, report);
        return report;
    }

    /**
     * Compare two parse results under semantic normalization.
     *
     * @param original result of parsing the source
     * @param reparsed result of parsing the canonical rewrite
     * @return comparison report
     */
    public ClosureReport compare(ParsedMetadata original, ParsedMetadata reparsed) {
        List<String> headerDifferences = normalizer.normalize(original.header())
                .differences(normalizer.normalize(reparsed.header()));

        List<NormalizedGame> left = normalizer.normalize(original.games(), original.header());
        List<NormalizedGame> right = normalizer.normalize(reparsed.games(), reparsed.header());

        Optional<ClosureReport.GameMismatch> mismatch = Optional.empty();
        int pairs = Math.max(left.size(), right.size());
        for (int i = 0; i < pairs; i++) {
            Optional<NormalizedGame> a = i < left.size() ? Optional.of(left.get(i)) : Optional.empty();
            Optional<NormalizedGame> b = i < right.size() ? Optional.of(right.get(i)) : Optional.empty();
            if (!a.equals(b)) {
                mismatch = Optional.of(new ClosureReport.GameMismatch(a, b));
                break;
            }
        }

        return new ClosureReport(headerDifferences, mismatch, original.games().size(), reparsed.games().size());
    }

    private void cleanup(ScratchWorkspace workspace) {
        try {
            workspace.close();
        } catch (CleanupException e) {
            // Scratch leftovers do not invalidate the comparison
            log.warn("{} ({} suppressed)", e.getMessage(), e.getSuppressed().length);
        }
    }

    private void logReport(Path source, ClosureReport report) {
        if (report.ok()) {
            log.info("Closure holds for {} ({} games)", source, report.originalGameCount());
            return;
        }
        log.warn("Closure failed for {}: header same={}, games same={} ({} vs {} games)",
                source, report.headerSame(), report.gamesSame(),
                report.originalGameCount(), report.reparsedGameCount());
        report.headerDifferences().forEach(diff -> log.warn("  header {}", diff));
        report.firstMismatch().ifPresent(m -> {
            log.warn("  first differing game (source):   {}", m.original().map(Object::toString).orElse("<none>"));
            log.warn("  first differing game (rewrite):  {}", m.reparsed().map(Object::toString).orElse("<none>"));
        });
    }
}
