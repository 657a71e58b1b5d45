package com.sourcemanager.core.migration;

import java.nio.file.Path;
import java.util.List;

/**
 * Tally of a batch migration run.
 * <p>
 * {@code attempted == succeeded + failed + skipped}. {@code error} is set only
 * when the run could not start, e.g. the source directory does not exist.
 */
public record MigrationReport(
    Path sourceDir,
    boolean dryRun,
    int attempted,
    int succeeded,
    int failed,
    int skipped,
    List<MigrationFailure> failures,
    List<Path> skippedFiles,
    long durationMs,
    String error
) {

    public MigrationReport {
        failures = List.copyOf(failures);
        skippedFiles = List.copyOf(skippedFiles);
    }

    static MigrationReport aborted(Path sourceDir, boolean dryRun, String error) {
        return new MigrationReport(sourceDir, dryRun, 0, 0, 0, 0, List.of(), List.of(), 0, error);
    }

    public boolean success() {
        return error == null && failed == 0;
    }
}
