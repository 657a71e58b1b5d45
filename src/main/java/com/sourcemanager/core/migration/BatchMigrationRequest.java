package com.sourcemanager.core.migration;

import com.sourcemanager.core.config.SourceManagerProperties;

import java.nio.file.Path;

/**
 * Options for one directory-wide migration run.
 *
 * @param sourceDir      directory holding legacy project files
 * @param outputDir      where canonical files go; {@code null} rewrites in place
 * @param extension      file name suffix to select, e.g. {@code .json}
 * @param recursive      descend into sub-directories
 * @param dryRun         migrate and validate without writing anything
 * @param backupExisting copy an existing target to {@code <name>.bak} before replacing it
 * @param parallelism    number of files migrated concurrently
 */
public record BatchMigrationRequest(
    Path sourceDir,
    Path outputDir,
    String extension,
    boolean recursive,
    boolean dryRun,
    boolean backupExisting,
    int parallelism
) {

    public BatchMigrationRequest {
        if (sourceDir == null) {
            throw new IllegalArgumentException("sourceDir is required");
        }
        extension = extension == null || extension.isBlank() ? ".json" : extension;
        parallelism = Math.max(1, parallelism);
    }

    /** A request for {@code sourceDir} using the configured migration defaults. */
    public static BatchMigrationRequest defaults(Path sourceDir, SourceManagerProperties.Migration migration) {
        return new BatchMigrationRequest(sourceDir, null, migration.getExtension(), migration.isRecursive(),
                false, migration.isBackupExisting(), migration.getParallelism());
    }

    /** Target for {@code file}, keeping its position relative to the source directory. */
    public Path targetFor(Path file) {
        if (outputDir == null) {
            return file;
        }
        return outputDir.resolve(sourceDir.relativize(file).toString());
    }
}
