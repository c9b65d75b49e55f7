package com.largomodo.gamemeta.verify;

/**
 * Thrown by batch processing when a collection does not survive the round trip.
 * <p>
 * RuntimeException so batch workers handle it with the same catch as I/O failures.
 * Carries the full report for callers that want the diagnostics.
 */
public class ClosureMismatchException extends RuntimeException {

    private final transient ClosureReport report;

    public ClosureMismatchException(String message, ClosureReport report) {
        super(message);
        this.report = report;
    }

    public ClosureReport getReport() {
        return report;
    }
}
