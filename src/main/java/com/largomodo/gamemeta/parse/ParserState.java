package com.largomodo.gamemeta.parse;

/**
 * Block the parser is currently filling.
 */
public enum ParserState {
    /** Before the first {@code game:} line; keys apply to the header. */
    HEADER,
    /** Inside a {@code game:} block. */
    GAME,
    /** Input exhausted; the context accepts no more lines. */
    DONE
}
