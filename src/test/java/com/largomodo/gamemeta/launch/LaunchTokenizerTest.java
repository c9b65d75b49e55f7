package com.largomodo.gamemeta.launch;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaunchTokenizerTest {

    @Test
    void testSplitsOnWhitespace() {
        assertEquals(List.of("retroarch", "-L", "core.so", "rom.chd"),
                LaunchTokenizer.tokenize("retroarch  -L\tcore.so rom.chd"));
    }

    @Test
    void testQuotesGroupAndAreRemoved() {
        assertEquals(List.of("retroarch", "-L", "/my cores/flycast_libretro.so", "{file.path}"),
                LaunchTokenizer.tokenize("retroarch -L \"/my cores/flycast_libretro.so\" '{file.path}'"));
    }

    @Test
    void testWindowsPathsKeepBackslashes() {
        assertEquals(List.of("C:\\RetroArch\\retroarch.exe", "-L", "C:\\RetroArch\\cores\\snes9x_libretro.dll"),
                LaunchTokenizer.tokenize("C:\\RetroArch\\retroarch.exe -L C:\\RetroArch\\cores\\snes9x_libretro.dll"));
    }

    @Test
    void testBackslashNewlineJoinsLines() {
        assertEquals(List.of("am", "start", "-n", "com.retroarch/.Activity"),
                LaunchTokenizer.tokenize("am start \\\n-n com.retroarch/.Activity"));
    }

    @Test
    void testMultiLineCommandTokenizedAcrossLines() {
        assertEquals(List.of("am", "start", "-e", "ROM", "{file.path}"),
                LaunchTokenizer.tokenize("am start\n  -e ROM {file.path}"));
    }

    @Test
    void testQuotedEmptyArgumentKept() {
        assertEquals(List.of("emu", ""), LaunchTokenizer.tokenize("emu \"\""));
    }

    @Test
    void testUnbalancedQuotesYieldNothing() {
        assertTrue(LaunchTokenizer.tokenize("retroarch \"unterminated").isEmpty());
    }

    @Test
    void testBlankAndNull() {
        assertTrue(LaunchTokenizer.tokenize(null).isEmpty());
        assertTrue(LaunchTokenizer.tokenize("   ").isEmpty());
    }
}
