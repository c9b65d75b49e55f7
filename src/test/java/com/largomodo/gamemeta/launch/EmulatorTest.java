package com.largomodo.gamemeta.launch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EmulatorTest {

    @ParameterizedTest
    @CsvSource({
            "retroarch, RETROARCH",
            "/usr/bin/retroarch, RETROARCH",
            "C:\\RetroArch\\RetroArch.exe, RETROARCH",
            "dolphin-emu-nogui, DOLPHIN",
            "PPSSPPWindows64.exe, PPSSPP",
            "/opt/duckstation-qt, DUCKSTATION"
    })
    void testFromBinary(String path, Emulator expected) {
        assertEquals(Optional.of(expected), Emulator.fromBinary(path));
    }

    @Test
    void testUnknownBinary() {
        assertEquals(Optional.empty(), Emulator.fromBinary("/usr/bin/am"));
        assertEquals(Optional.empty(), Emulator.fromBinary(""));
        assertEquals(Optional.empty(), Emulator.fromBinary(null));
    }

    @ParameterizedTest
    @CsvSource({
            "com.retroarch/.browser.retroactivity.RetroActivityFuture, RETROARCH",
            "com.retroarch.aarch64, RETROARCH",
            "org.ppsspp.ppsspp/.PpssppActivity, PPSSPP",
            "com.flycast.emulator/com.flycast.emulator.MainActivity, FLYCAST"
    })
    void testFromAndroidComponent(String component, Emulator expected) {
        assertEquals(Optional.of(expected), Emulator.fromAndroidComponent(component));
    }

    @Test
    void testUnknownAndroidPackage() {
        assertEquals(Optional.empty(), Emulator.fromAndroidComponent("com.example.app/.Main"));
    }
}
