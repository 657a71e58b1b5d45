package com.sourcemanager.core.migration;

import java.nio.file.Path;

/**
 * One file that failed to migrate and why.
 */
public record MigrationFailure(Path file, String reason) {}
