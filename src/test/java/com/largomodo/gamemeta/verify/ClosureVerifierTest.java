package com.largomodo.gamemeta.verify;

import com.largomodo.gamemeta.core.domain.Game;
import com.largomodo.gamemeta.core.domain.Header;
import com.largomodo.gamemeta.core.workspace.ScratchWorkspace;
import com.largomodo.gamemeta.parse.MetadataFormatException;
import com.largomodo.gamemeta.parse.MetadataParser;
import com.largomodo.gamemeta.write.MetadataWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parse, write, parse cycle on real files.
 * <p>
 * Verifies:
 * - Hand-written fixture survives the canonical rewrite
 * - Scratch files are removed unless kept
 * - A lossy writer is reported as a mismatch, not an exception
 */
class ClosureVerifierTest {

    @TempDir
    Path tempDir;

    private Path metadataFile;

    @BeforeEach
    void setUp() throws IOException {
        Path platformDir = tempDir.resolve("DC");
        Files.createDirectories(platformDir);
        metadataFile = platformDir.resolve("metadata.pegasus.txt");
        Files.copy(Paths.get("src/test/resources/collections/DC/metadata.pegasus.txt"), metadataFile);
    }

    @Test
    void testFixtureClosureHolds() throws IOException {
        ClosureReport report = new ClosureVerifier().verify(metadataFile);

        assertTrue(report.ok(), () -> "Unexpected mismatch: " + report);
        assertEquals(3, report.originalGameCount());
        assertEquals(3, report.reparsedGameCount());
    }

    @Test
    void testScratchRemovedAfterVerify() throws IOException {
        new ClosureVerifier().verify(metadataFile);

        assertFalse(Files.exists(metadataFile.getParent().resolve(ScratchWorkspace.SCRATCH_DIR_NAME)),
                "Scratch directory should be removed");
    }

    @Test
    void testScratchKeptOnRequest() throws IOException {
        new ClosureVerifier().verify(metadataFile, true);

        Path scratch = metadataFile.getParent()
                .resolve(ScratchWorkspace.SCRATCH_DIR_NAME)
                .resolve("metadata.pegasus.txt" + ScratchWorkspace.SCRATCH_SUFFIX);
        assertTrue(Files.exists(scratch), "Scratch file should be kept");
        assertTrue(Files.readString(scratch).startsWith("collection: Dreamcast\n"));
    }

    @Test
    void testSourceFileUntouched() throws IOException {
        String before = Files.readString(metadataFile);

        new ClosureVerifier().verify(metadataFile);

        assertEquals(before, Files.readString(metadataFile));
    }

    @Test
    void testLossyWriterReportedAsMismatch() throws IOException {
        MetadataWriter dropsDevelopers = new MetadataWriter() {
            @Override
            public String render(Header header, List<Game> games) {
                List<Game> stripped = new ArrayList<>();
                for (Game g : games) {
                    stripped.add(new Game(g.title(), g.primaryFile(), g.roms(), g.sortKey(), Optional.empty(),
                            g.description(), g.launchOverride(), g.coreOverride(), g.assets()));
                }
                return super.render(header, stripped);
            }
        };
        ClosureVerifier verifier = new ClosureVerifier(new MetadataParser(), dropsDevelopers, new SemanticNormalizer());

        ClosureReport report = verifier.verify(metadataFile);

        assertFalse(report.ok());
        assertTrue(report.headerSame());
        assertFalse(report.gamesSame());
        ClosureReport.GameMismatch mismatch = report.firstMismatch().orElseThrow();
        // Crazy Taxi sorts first and carries a developer
        assertEquals("Crazy Taxi", mismatch.original().orElseThrow().title());
        assertEquals(Optional.of("Hitmaker"), mismatch.original().orElseThrow().developer());
        assertEquals(Optional.empty(), mismatch.reparsed().orElseThrow().developer());
    }

    @Test
    void testMissingGameReportedWithEmptySide() {
        MetadataParser parser = new MetadataParser();
        ClosureVerifier verifier = new ClosureVerifier();

        ClosureReport report = verifier.compare(
                parser.parse("game: A\nfile: a.bin\n\ngame: B\nfile: b.bin\n"),
                parser.parse("game: A\nfile: a.bin\n"));

        assertEquals(2, report.originalGameCount());
        assertEquals(1, report.reparsedGameCount());
        ClosureReport.GameMismatch mismatch = report.firstMismatch().orElseThrow();
        assertEquals("B", mismatch.original().orElseThrow().title());
        assertTrue(mismatch.reparsed().isEmpty());
    }

    @Test
    void testHandWrittenVariantsCompareEqual() {
        MetadataParser parser = new MetadataParser();
        ClosureVerifier verifier = new ClosureVerifier();

        ClosureReport report = verifier.compare(
                parser.parse("collection: X\nextensions: .ZIP, 7z\n\ngame: G\nfiles:\n  b.bin\n  a.bin\n"),
                parser.parse("collection: X\nextension:\n    zip\n    7z\n\ngame: G\nfiles:\n  a.bin\n  b.bin\n"));

        assertTrue(report.ok(), () -> report.toString());
    }

    @Test
    void testTextStartingWithKeyWordSurvivesRewrite() throws IOException {
        Path source = Files.createDirectories(tempDir.resolve("PONG")).resolve("metadata.pegasus.txt");
        Files.writeString(source, """
                collection: Pong

                game: Pong
                file: pong.bin
                description:
                  Description: Description: x
                launch:
                  launch: emu {file.path}

                game: Pong II
                file: pong2.bin
                description: Description: A classic.
                """);
        MetadataParser parser = new MetadataParser();
        MetadataWriter writer = new MetadataWriter();
        String canonical = writer.render(parser.parse(source));
        String again = writer.render(parser.parse(canonical));

        ClosureReport report = new ClosureVerifier().verify(source);

        assertTrue(report.ok(), () -> report.toString());
        assertEquals(Optional.of("Description: A classic."), parser.parse(canonical).games().get(1).description());
        assertEquals(Optional.of("Description: Description: x"), parser.parse(canonical).games().get(0).description());
        assertEquals(again, writer.render(parser.parse(again)), "Key words in text must not shrink on each rewrite");
    }

    @Test
    void testMissingSourcePropagates() {
        ClosureVerifier verifier = new ClosureVerifier();

        assertThrows(MetadataFormatException.class, () -> verifier.verify(tempDir.resolve("missing.txt")));
        assertFalse(Files.exists(tempDir.resolve(ScratchWorkspace.SCRATCH_DIR_NAME)));
    }
}
