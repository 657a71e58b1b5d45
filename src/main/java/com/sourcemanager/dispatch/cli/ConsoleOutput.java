package com.sourcemanager.dispatch.cli;

import com.sourcemanager.core.migration.MigrationFailure;
import com.sourcemanager.core.migration.MigrationReport;
import com.sourcemanager.core.store.RegionSummary;
import com.sourcemanager.core.store.SourceRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Source Manager CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SOURCE MANAGER v2.0.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SOURCES]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void region(RegionSummary summary) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold %-10s|@ %-28s %-9s %4d  %s",
                summary.regionName(), summary.displayName(), summary.scope().value(),
                summary.sourceCount(), summary.sourceFile())));
    }

    public static void source(SourceRecord record) {
        String title = record.title() != null ? record.title() : "(untitled)";
        Object type = record.getField(SourceRecord.SOURCE_TYPE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(cyan) " + record.getId() + "|@ " + title
                        + (type != null ? " @|faint [" + type + "]|@" : "")));
    }

    public static void migrationReport(MigrationReport report) {
        rule();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Migration Summary|@" + (report.dryRun() ? " (dry run)" : "")));
        System.out.println("  Directory: " + report.sourceDir());
        if (report.error() != null) {
            error(report.error());
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Files: " + report.attempted() + " attempted, @|fg(green) " + report.succeeded()
                        + " succeeded|@, @|fg(red) " + report.failed() + " failed|@, "
                        + report.skipped() + " skipped"));
        System.out.println("  Duration: " + report.durationMs() + "ms");
        for (MigrationFailure failure : report.failures()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + failure.file().getFileName() + ": " + failure.reason()));
        }
    }
}
