package com.sourcemanager.core.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.io.DocumentIoException;
import com.sourcemanager.core.io.DocumentParseException;
import com.sourcemanager.core.io.JsonDocumentFiles;
import com.sourcemanager.core.logging.MdcContext;
import com.sourcemanager.core.metrics.SourceManagerMetrics;
import com.sourcemanager.core.project.CanonicalProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Migrates every matching file of a directory.
 * <p>
 * Files are independent: each is read, migrated, validated and written on its
 * own, and a failure is recorded against that file only. The run always
 * finishes with a {@link MigrationReport}.
 */
@Service
public class BatchMigrationService {

    private static final Logger log = LoggerFactory.getLogger(BatchMigrationService.class);

    static final String BACKUP_SUFFIX = ".bak";

    private enum Result { SUCCEEDED, FAILED, SKIPPED }

    private record FileOutcome(Path file, Result result, String reason) {}

    private final SchemaMigrator migrator;
    private final JsonDocumentFiles files;
    private final SourceManagerMetrics metrics;

    @Autowired
    public BatchMigrationService(SchemaMigrator migrator,
                                 ObjectMapper objectMapper,
                                 SourceManagerProperties properties,
                                 SourceManagerMetrics metrics) {
        this(migrator, new JsonDocumentFiles(objectMapper, properties.getIoTimeout()), metrics);
    }

    public BatchMigrationService(SchemaMigrator migrator, JsonDocumentFiles files, SourceManagerMetrics metrics) {
        this.migrator = migrator;
        this.files = files;
        this.metrics = metrics;
    }

    public MigrationReport migrate(BatchMigrationRequest request) {
        Path sourceDir = request.sourceDir();
        if (!Files.isDirectory(sourceDir)) {
            log.error("Source directory does not exist: {}", sourceDir);
            return MigrationReport.aborted(sourceDir, request.dryRun(), "Source directory does not exist: " + sourceDir);
        }

        List<Path> candidates;
        try {
            candidates = discover(request);
        } catch (IOException e) {
            log.error("Could not list {}: {}", sourceDir, e.getMessage());
            return MigrationReport.aborted(sourceDir, request.dryRun(), "Could not list " + sourceDir + ": " + e.getMessage());
        }
        if (candidates.isEmpty()) {
            log.warn("No {} files found in {}", request.extension(), sourceDir);
        }
        log.info("Migrating {} files from {} (dryRun={}, parallelism={})",
                candidates.size(), sourceDir, request.dryRun(), request.parallelism());

        long startMs = System.currentTimeMillis();
        List<FileOutcome> outcomes = runAll(request, candidates);
        long durationMs = System.currentTimeMillis() - startMs;
        metrics.recordBatchDuration(durationMs);

        var failures = new ArrayList<MigrationFailure>();
        var skipped = new ArrayList<Path>();
        int succeeded = 0;
        for (FileOutcome outcome : outcomes) {
            switch (outcome.result()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failures.add(new MigrationFailure(outcome.file(), outcome.reason()));
                case SKIPPED -> skipped.add(outcome.file());
            }
        }

        var report = new MigrationReport(sourceDir, request.dryRun(), outcomes.size(), succeeded,
                failures.size(), skipped.size(), failures, skipped, durationMs, null);
        log.info("Migration complete: {} attempted, {} succeeded, {} failed, {} skipped in {}ms",
                report.attempted(), report.succeeded(), report.failed(), report.skipped(), durationMs);
        for (MigrationFailure failure : failures) {
            log.error("  failed: {}: {}", failure.file().getFileName(), failure.reason());
        }
        return report;
    }

    private List<Path> discover(BatchMigrationRequest request) throws IOException {
        String suffix = request.extension().toLowerCase(Locale.ROOT);
        int depth = request.recursive() ? Integer.MAX_VALUE : 1;
        try (Stream<Path> walk = Files.walk(request.sourceDir(), depth)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                    .sorted()
                    .toList();
        }
    }

    private List<FileOutcome> runAll(BatchMigrationRequest request, List<Path> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        var threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(request.parallelism(), candidates.size()), r -> {
                    Thread t = new Thread(r, "migration-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        try {
            var futures = new ArrayList<CompletableFuture<FileOutcome>>();
            for (Path file : candidates) {
                futures.add(CompletableFuture.supplyAsync(() -> migrateOne(request, file), executor));
            }
            var outcomes = new ArrayList<FileOutcome>();
            for (var future : futures) {
                outcomes.add(future.join());
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    private FileOutcome migrateOne(BatchMigrationRequest request, Path file) {
        String filename = file.getFileName().toString();
        MdcContext.setMigrationFile(filename);
        try {
            JsonNode legacy = files.readTree(file);
            if (SchemaMigrator.isCanonical(legacy)) {
                log.info("Skipping {}: already in the canonical schema", filename);
                return record(new FileOutcome(file, Result.SKIPPED, "already canonical"));
            }

            CanonicalProject canonical = migrator.migrate(legacy, filename);
            Path target = request.targetFor(file);
            if (request.dryRun()) {
                log.info("Dry run: {} would be written to {}", filename, target);
            } else {
                if (request.backupExisting() && Files.exists(target)) {
                    Path backup = files.backup(target, BACKUP_SUFFIX);
                    log.debug("Backed up {} to {}", target, backup);
                }
                files.write(target, canonical);
                log.info("Migrated {} to {}", filename, target);
            }
            return record(new FileOutcome(file, Result.SUCCEEDED, null));
        } catch (DocumentParseException e) {
            log.error("Failed to migrate {}: malformed JSON: {}", filename, e.getMessage());
            return record(new FileOutcome(file, Result.FAILED, "Malformed JSON: " + e.getMessage()));
        } catch (DocumentIoException e) {
            log.error("Failed to migrate {}: {}", filename, e.getMessage());
            return record(new FileOutcome(file, Result.FAILED, e.getMessage()));
        } catch (MigrationException e) {
            log.error("Failed to migrate {}: {}", filename, e.getMessage());
            return record(new FileOutcome(file, Result.FAILED, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error migrating {}", filename, e);
            return record(new FileOutcome(file, Result.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            MdcContext.clear();
        }
    }

    private FileOutcome record(FileOutcome outcome) {
        metrics.recordMigrationResult(outcome.result().name().toLowerCase(Locale.ROOT));
        return outcome;
    }
}
