package com.largomodo.gamemeta.launch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Extracts emulator, core and ROM argument position from free-form launch commands.
 * <p>
 * Never fails: a command that cannot be tokenized or recognized yields a
 * {@link LaunchCommand} carrying only the raw text.
 * <p>
 * Stateless design enables concurrent use without synchronization.
 */
public class LaunchNormalizer {

    private static final Logger log = LoggerFactory.getLogger(LaunchNormalizer.class);

    // Pegasus, ES-DE and Daijisho spellings of "the selected file"
    private static final List<String> ROM_PLACEHOLDERS = List.of(
            "{file.path}", "{file.uri}", "{file.name}", "{file.basename}", "{file.dir}", "{file}",
            "%ROM%", "%ROMRAW%", "%ROMPATH%"
    );

    /**
     * Normalize one launch command.
     *
     * @param raw launch command as written in the metadata (null tolerated)
     * @return structured command, never null
     */
    public LaunchCommand normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return LaunchCommand.unrecognized(raw);
        }

        List<String> tokens = LaunchTokenizer.tokenize(raw);
        if (tokens.isEmpty()) {
            log.debug("Launch command could not be tokenized: {}", raw);
        }

        Optional<Emulator> emulator = Optional.empty();
        Optional<String> binary = Optional.empty();
        for (int i = 0; i < tokens.size() && emulator.isEmpty(); i++) {
            String token = tokens.get(i);
            emulator = Emulator.fromBinary(token);
            if (emulator.isEmpty() && "-n".equals(token) && i + 1 < tokens.size()) {
                // am start -n <package>/<activity>
                token = tokens.get(i + 1);
                emulator = Emulator.fromAndroidComponent(token);
            }
            if (emulator.isPresent()) {
                binary = Optional.of(token);
            }
        }

        return new LaunchCommand(raw, emulator, binary, CoreExtractor.extract(raw), findRomArgument(tokens));
    }

    private OptionalInt findRomArgument(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            for (String placeholder : ROM_PLACEHOLDERS) {
                if (token.contains(placeholder)) {
                    return OptionalInt.of(i);
                }
            }
        }
        return OptionalInt.empty();
    }
}
