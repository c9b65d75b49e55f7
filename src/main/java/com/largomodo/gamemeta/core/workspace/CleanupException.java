package com.largomodo.gamemeta.core.workspace;

import java.io.IOException;
import java.util.List;

/**
 * Exception thrown when scratch workspace cleanup encounters failures.
 * <p>
 * Accumulates all cleanup failures as suppressed exceptions so the caller can log the
 * full diagnostic context in one place.
 */
public class CleanupException extends RuntimeException {

    /**
     * Create exception with accumulated cleanup failures.
     *
     * @param message  Description of cleanup failure context
     * @param failures IOExceptions from cleanup attempts
     */
    public CleanupException(String message, List<IOException> failures) {
        super(message);
        for (IOException failure : failures) {
            addSuppressed(failure);
        }
    }
}
