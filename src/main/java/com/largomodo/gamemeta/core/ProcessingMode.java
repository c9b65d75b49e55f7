package com.largomodo.gamemeta.core;

/**
 * What {@link CollectionProcessor} does with each collection.
 */
public enum ProcessingMode {
    /** Parse and report counts. */
    SUMMARY,
    /** Parse, rewrite, re-parse and compare. */
    VERIFY,
    /** Write the canonical form into the output tree. */
    CANONICALIZE
}
