package com.sourcemanager.core.migration;

/**
 * A single legacy file could not be migrated.
 */
public class MigrationException extends Exception {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
