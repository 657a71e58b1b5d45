package com.sourcemanager.core.migration;

import java.util.List;

/**
 * The migrated record is missing required content. Carries every problem found.
 */
public class MigrationValidationException extends MigrationException {

    private final List<String> errors;

    public MigrationValidationException(String filename, List<String> errors) {
        super("Validation failed for " + filename + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
