package com.sourcemanager.core.store;

/**
 * Outcome of a mutating store operation.
 *
 * @param outcome  what happened
 * @param sourceId id of the affected record, null when none was touched
 * @param message  human-readable detail naming the file, field or I/O cause
 */
public record StoreResult(Outcome outcome, String sourceId, String message) {

    public enum Outcome { OK, NOT_FOUND, VALIDATION_FAILED, IO_FAILURE }

    public static StoreResult ok(String sourceId, String message) {
        return new StoreResult(Outcome.OK, sourceId, message);
    }

    public static StoreResult notFound(String message) {
        return new StoreResult(Outcome.NOT_FOUND, null, message);
    }

    public static StoreResult invalid(String message) {
        return new StoreResult(Outcome.VALIDATION_FAILED, null, message);
    }

    public static StoreResult ioFailure(String message) {
        return new StoreResult(Outcome.IO_FAILURE, null, message);
    }

    public boolean success() {
        return outcome == Outcome.OK;
    }
}
