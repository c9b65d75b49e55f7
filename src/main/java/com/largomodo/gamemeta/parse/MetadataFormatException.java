package com.largomodo.gamemeta.parse;

import java.io.IOException;

/**
 * Thrown when a metadata source cannot be read.
 * <p>
 * Content irregularities never raise this exception: the parser drops lines it does not
 * understand. Only I/O failures (missing file, permission denied, undecodable bytes)
 * surface here, so callers can treat it like any other {@link IOException}.
 */
public class MetadataFormatException extends IOException {

    public MetadataFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
