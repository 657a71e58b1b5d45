package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.migration.BatchMigrationRequest;
import com.sourcemanager.core.migration.BatchMigrationService;
import com.sourcemanager.core.migration.MigrationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: source-manager migrate &lt;dir&gt;
 * <p>
 * Converts every legacy project file in a directory to the canonical schema.
 * Exits non-zero when any file fails.
 */
@Command(name = "migrate", mixinStandardHelpOptions = true, description = "Migrate legacy project files")
@Component
public class MigrateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Directory with legacy project files")
    private Path sourceDir;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: rewrite in place)")
    private Path outputDir;

    @Option(names = "--extension", description = "File extension to migrate (default: from configuration)")
    private String extension;

    @Option(names = {"--recursive", "-R"}, description = "Include sub-directories")
    private boolean recursive;

    @Option(names = "--dry-run", description = "Migrate and validate without writing")
    private boolean dryRun;

    @Option(names = "--no-backup", description = "Do not keep a .bak copy of overwritten files")
    private boolean noBackup;

    @Option(names = "--parallel", description = "Files migrated concurrently (default: from configuration)")
    private Integer parallelism;

    private final BatchMigrationService migrationService;
    private final SourceManagerProperties properties;

    public MigrateCommand(BatchMigrationService migrationService, SourceManagerProperties properties) {
        this.migrationService = migrationService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        SourceManagerProperties.Migration defaults = properties.getMigration();
        var request = new BatchMigrationRequest(
                sourceDir,
                outputDir,
                extension != null ? extension : defaults.getExtension(),
                recursive || defaults.isRecursive(),
                dryRun,
                !noBackup && defaults.isBackupExisting(),
                parallelism != null ? parallelism : defaults.getParallelism());

        ConsoleOutput.info("Migrating " + sourceDir + (dryRun ? " (dry run)" : ""));
        MigrationReport report = migrationService.migrate(request);
        ConsoleOutput.migrationReport(report);
        if (report.success()) {
            ConsoleOutput.success("All files migrated");
            return 0;
        }
        ConsoleOutput.error("Migration finished with failures");
        return 1;
    }
}
