package com.largomodo.gamemeta;

import com.largomodo.gamemeta.core.BatchRunner;
import com.largomodo.gamemeta.core.BatchRunner.BatchResult;
import com.largomodo.gamemeta.core.CollectionDiscovery;
import com.largomodo.gamemeta.core.CollectionObserver;
import com.largomodo.gamemeta.core.CollectionProcessor;
import com.largomodo.gamemeta.core.ProcessingMode;
import com.largomodo.gamemeta.core.domain.DiscoveredCollection;
import com.largomodo.gamemeta.parse.MetadataParser;
import com.largomodo.gamemeta.policy.FallbackCoreSelectionPolicy;
import com.largomodo.gamemeta.verify.ClosureVerifier;
import com.largomodo.gamemeta.verify.SemanticNormalizer;
import com.largomodo.gamemeta.write.MetadataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point for collection metadata tooling.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation.
 * Accepts a single positional input path (resource root or one metadata file) and
 * determines batch or single-file processing via runtime inspection.
 * <p>
 * Smart defaults:
 * - No INPUT: the {@code Resource} directory of the working directory
 * - No mode flag: summary (parse and report counts)
 */
@Command(
        name = "gamemeta",
        mixinStandardHelpOptions = true,
        resourceBundle = "gamemeta.gamemeta",
        version = "${bundle:application.version}",
        header = "Parses, verifies and canonicalizes game collection metadata.",
        description = {
                "Reads Pegasus-style metadata files (metadata.pegasus.txt), one per platform directory.",
                "",
                "--verify proves that parse -> write -> parse keeps every collection semantically intact.",
                "--canonicalize rewrites each collection in the canonical layout under the output directory."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:At least one collection failed (I/O error or closure mismatch)",
                "2:Invalid command line arguments"
        }
)
public class GameMeta implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GameMeta.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", defaultValue = "Resource",
            description = {
                    "Resource root containing one directory per platform, or a single metadata file.",
                    "Default: ${DEFAULT-VALUE}"
            })
    File inputPath;

    @Option(names = "--list", description = "List discovered collections and exit")
    boolean list;

    @Option(names = "--verify", description = "Run the closure check (parse -> write -> parse)")
    boolean verify;

    @Option(names = "--canonicalize",
            description = "Write canonical metadata to <output-dir>/<platform>/metadata.pegasus.txt")
    boolean canonicalize;

    @Option(names = {"-o", "--output-dir"}, defaultValue = "CanonicalMetadata",
            description = "Output directory for --canonicalize (default: ${DEFAULT-VALUE})")
    File outputDir;

    @Option(names = {"-p", "--platform"}, paramLabel = "KEY",
            description = "Process only this platform key (e.g. dc, fbneo_act)")
    String platform;

    @Option(names = "--keep-scratch", description = "Keep the _norm_test scratch files written by --verify")
    boolean keepScratch;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new GameMeta());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    /**
     * Wires parser, writer, verifier and core policy into a processor.
     */
    static CollectionProcessor createProcessor(Path outputRoot, boolean keepScratch) throws java.io.IOException {
        MetadataParser parser = new MetadataParser();
        MetadataWriter writer = new MetadataWriter();
        ClosureVerifier verifier = new ClosureVerifier(parser, writer, new SemanticNormalizer());
        FallbackCoreSelectionPolicy policy =
                FallbackCoreSelectionPolicy.fromResource(FallbackCoreSelectionPolicy.DEFAULT_RESOURCE);
        return new CollectionProcessor(parser, writer, verifier, policy, outputRoot, keepScratch);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (verify && canonicalize) {
            throw new ParameterException(spec.commandLine(),
                    "--verify and --canonicalize cannot be combined");
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }

        Collection<DiscoveredCollection> collections = selectCollections();

        if (list) {
            for (DiscoveredCollection c : collections) {
                log.info("  {} -> {} ({})", c.key(), c.displayName(), c.metadataFile());
            }
            return 0;
        }

        if (canonicalize && outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }

        ProcessingMode mode = verify ? ProcessingMode.VERIFY
                : canonicalize ? ProcessingMode.CANONICALIZE
                : ProcessingMode.SUMMARY;

        BatchRunner runner = new BatchRunner(createProcessor(outputDir.toPath(), keepScratch));
        BatchResult result = runner.run(collections, mode, new CollectionObserver() {
            @Override
            public void onSuccess(DiscoveredCollection collection, int gameCount) {
                if (mode == ProcessingMode.VERIFY) {
                    log.info("[OK] {}: closure holds, safe to round-trip", collection.key());
                }
            }

            @Override
            public void onFailure(DiscoveredCollection collection, Exception e) {
                log.error("FAILED: {} - {}", collection.key(), e.getMessage());
            }
        });

        return result.failed() == 0 ? 0 : 1;
    }

    private Collection<DiscoveredCollection> selectCollections() throws java.io.IOException {
        CollectionDiscovery discovery = new CollectionDiscovery();
        if (inputPath.isFile()) {
            return List.of(discovery.single(inputPath.toPath()));
        }

        Map<String, DiscoveredCollection> found = discovery.discover(inputPath.toPath());
        if (found.isEmpty()) {
            log.warn("No metadata.pegasus.txt found under {}", inputPath);
        }
        if (platform == null) {
            return new ArrayList<>(found.values());
        }

        DiscoveredCollection selected = found.get(platform);
        if (selected == null) {
            throw new ParameterException(spec.commandLine(),
                    "Unknown platform key: " + platform + ". Available: " + String.join(", ", found.keySet()));
        }
        return List.of(selected);
    }
}
