package com.largomodo.gamemeta.launch;

import java.util.ArrayList;
import java.util.List;

/**
 * Shell-like splitting of launch commands.
 * <p>
 * Whitespace separates tokens; single and double quotes group characters and are removed.
 * Backslashes are literal so Windows paths ({@code C:\Emu\retroarch.exe}) survive intact,
 * except a backslash directly before a line break, which joins the two lines.
 * <p>
 * Pure function with no state. Safe for concurrent use.
 */
public class LaunchTokenizer {

    private LaunchTokenizer() {
        // Static utility class - prevent instantiation
    }

    /**
     * Split a launch command into arguments.
     *
     * @param command raw command (null tolerated)
     * @return tokens in order; empty when the command is blank or has unbalanced quotes
     */
    public static List<String> tokenize(String command) {
        if (command == null || command.isBlank()) {
            return List.of();
        }

        String joined = command.replaceAll("\\\\\\r?\\n", " ");
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < joined.length(); i++) {
            char c = joined.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }

        if (quote != 0) {
            return List.of();
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return List.copyOf(tokens);
    }
}
