package com.largomodo.gamemeta.launch;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the libretro core a launch command loads.
 * <p>
 * Recognizes core files such as {@code mednafen_psx_hw_libretro_android.so} or
 * {@code flycast_libretro.dll} anywhere in the command, whatever the surrounding path and
 * quoting. A shared library passed with {@code -L} or {@code --libretro} counts as the core
 * even when its name does not follow the libretro scheme, and so does an Android intent
 * extra {@code -e LIBRETRO <path>}.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public class CoreExtractor {

    private static final Pattern CORE_FILE = Pattern.compile(
            "([^\\s\"'/\\\\]+_libretro(?:_android)?\\.(?:so|dll|dylib))",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CORE_LIBRARY = Pattern.compile("\\.(?:so|dll|dylib)$", Pattern.CASE_INSENSITIVE);

    private static final String LIBRETRO_EXTRA = "-e LIBRETRO";
    private static final String LIBRETRO_LONG_OPTION = "--libretro";

    private CoreExtractor() {
        // Static utility class - prevent instantiation
    }

    /**
     * Extract the core file base name from a launch command.
     *
     * @param launch raw launch command, possibly multi-line (null tolerated)
     * @return base name of the first core file referenced, or empty
     */
    public static Optional<String> extract(String launch) {
        if (launch == null || launch.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = CORE_FILE.matcher(launch);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }

        Optional<String> loaded = coreOption(LaunchTokenizer.tokenize(launch));
        if (loaded.isPresent()) {
            return loaded;
        }

        // Intent extra with a core path that does not end in _libretro.so
        for (String line : launch.split("\\R")) {
            if (!line.contains(LIBRETRO_EXTRA)) {
                continue;
            }
            String afterExtra = line.substring(line.indexOf(LIBRETRO_EXTRA) + LIBRETRO_EXTRA.length()).trim();
            if (afterExtra.isEmpty()) {
                continue;
            }
            String[] tokens = afterExtra.split("\\s+");
            String core = baseName(stripQuotes(tokens[0]));
            if (!core.isEmpty()) {
                return Optional.of(core);
            }
        }
        return Optional.empty();
    }

    /**
     * Library passed to {@code -L}, {@code --libretro} or {@code --libretro=}, whatever its name.
     */
    private static Optional<String> coreOption(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            String path = null;
            if (("-L".equals(token) || LIBRETRO_LONG_OPTION.equals(token)) && i + 1 < tokens.size()) {
                path = tokens.get(i + 1);
            } else if (token.startsWith(LIBRETRO_LONG_OPTION + "=")) {
                path = token.substring(LIBRETRO_LONG_OPTION.length() + 1);
            }
            if (path != null && CORE_LIBRARY.matcher(path).find()) {
                String core = baseName(path);
                if (!core.isEmpty()) {
                    return Optional.of(core);
                }
            }
        }
        return Optional.empty();
    }

    static String baseName(String path) {
        int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut >= 0 ? path.substring(cut + 1) : path;
    }

    private static String stripQuotes(String token) {
        return token.replace("\"", "").replace("'", "");
    }
}
