package com.largomodo.gamemeta.launch;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Emulator front ends recognized in launch commands.
 * Each entry lists desktop binary names (without {@code .exe}) and Android package names.
 */
public enum Emulator {
    RETROARCH("retroarch", Set.of("retroarch"),
            Set.of("com.retroarch", "com.retroarch.aarch64", "com.retroarch.ra32")),
    PPSSPP("ppsspp", Set.of("ppsspp", "ppssppsdl", "ppssppwindows64", "ppssppqt"),
            Set.of("org.ppsspp.ppsspp", "org.ppsspp.ppssppgold")),
    DOLPHIN("dolphin", Set.of("dolphin", "dolphin-emu", "dolphin-emu-nogui"),
            Set.of("org.dolphinemu.dolphinemu", "org.dolphinemu.mmjr")),
    FLYCAST("flycast", Set.of("flycast"), Set.of("com.flycast.emulator")),
    REDREAM("redream", Set.of("redream"), Set.of("io.recompiled.redream")),
    DUCKSTATION("duckstation", Set.of("duckstation", "duckstation-qt", "duckstation-nogui"),
            Set.of("com.github.stenzek.duckstation")),
    PCSX2("pcsx2", Set.of("pcsx2", "pcsx2-qt"), Set.of("xyz.aethersx2.android", "net.nethersx2.android")),
    MEDNAFEN("mednafen", Set.of("mednafen"), Set.of()),
    MAME("mame", Set.of("mame", "mame64"), Set.of("com.seleuco.mame4droid")),
    CITRA("citra", Set.of("citra", "citra-qt"), Set.of("org.citra.emu", "org.citra.citra_emu")),
    MELONDS("melonds", Set.of("melonds"), Set.of("me.magnum.melonds")),
    MGBA("mgba", Set.of("mgba", "mgba-qt"), Set.of("io.mgba.android"));

    private final String id;
    private final Set<String> binaryNames;
    private final Set<String> androidPackages;

    Emulator(String id, Set<String> binaryNames, Set<String> androidPackages) {
        this.id = id;
        this.binaryNames = binaryNames;
        this.androidPackages = androidPackages;
    }

    public String getId() {
        return id;
    }

    /**
     * Identify a front end from a binary path such as {@code /usr/bin/retroarch} or
     * {@code C:\RetroArch\retroarch.exe}.
     */
    public static Optional<Emulator> fromBinary(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String name = CoreExtractor.baseName(path).toLowerCase(Locale.ROOT);
        if (name.endsWith(".exe")) {
            name = name.substring(0, name.length() - 4);
        }
        for (Emulator emulator : values()) {
            if (emulator.binaryNames.contains(name)) {
                return Optional.of(emulator);
            }
        }
        return Optional.empty();
    }

    /**
     * Identify a front end from an Android component ({@code com.retroarch/.Activity}) or
     * bare package name.
     */
    public static Optional<Emulator> fromAndroidComponent(String component) {
        if (component == null || component.isBlank()) {
            return Optional.empty();
        }
        int slash = component.indexOf('/');
        String pkg = (slash >= 0 ? component.substring(0, slash) : component).toLowerCase(Locale.ROOT);
        for (Emulator emulator : values()) {
            if (emulator.androidPackages.contains(pkg)) {
                return Optional.of(emulator);
            }
        }
        return Optional.empty();
    }
}
