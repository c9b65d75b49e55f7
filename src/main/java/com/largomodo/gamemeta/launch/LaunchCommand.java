package com.largomodo.gamemeta.launch;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Structured view of a launch command.
 * <p>
 * Only {@code raw} is guaranteed; every other field is filled when the normalizer
 * recognizes it.
 * </p>
 *
 * @param raw         command exactly as written
 * @param emulator    recognized front end
 * @param binary      token naming the front end (path or Android component)
 * @param core        libretro core file base name
 * @param romArgIndex zero-based index of the first token carrying a ROM placeholder
 */
public record LaunchCommand(String raw,
                            Optional<Emulator> emulator,
                            Optional<String> binary,
                            Optional<String> core,
                            OptionalInt romArgIndex) {

    public LaunchCommand {
        raw = raw == null ? "" : raw;
        emulator = emulator == null ? Optional.empty() : emulator;
        binary = binary == null ? Optional.empty() : binary;
        core = core == null ? Optional.empty() : core;
        romArgIndex = romArgIndex == null ? OptionalInt.empty() : romArgIndex;
    }

    static LaunchCommand unrecognized(String raw) {
        return new LaunchCommand(raw, Optional.empty(), Optional.empty(), Optional.empty(), OptionalInt.empty());
    }
}
