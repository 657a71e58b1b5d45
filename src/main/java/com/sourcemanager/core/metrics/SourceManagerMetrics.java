package com.sourcemanager.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the source store and the migrator.
 */
@Service
public class SourceManagerMetrics {

    private final MeterRegistry registry;

    public SourceManagerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Regional store ---

    /**
     * Records a region document that could not be parsed and was treated as empty.
     *
     * @param region    region whose document was read
     * @param operation "list" or "count"
     */
    public void recordParseFailure(String region, String operation) {
        Counter.builder("sourcemanager.documents.parse_failures")
                .description("Region documents that failed to parse and were read as empty")
                .tag("region", region)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordStoreOperation(String operation, String outcome) {
        Counter.builder("sourcemanager.store.operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDocumentWrite(String region, long ms) {
        Timer.builder("sourcemanager.documents.write.duration")
                .tag("region", region)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /** Incremented when random id generation exhausted its retries. */
    public void recordIdFallback(String region) {
        Counter.builder("sourcemanager.store.id_fallbacks")
                .description("Source ids generated from the timestamp after random collisions")
                .tag("region", region)
                .register(registry)
                .increment();
    }

    // --- Migration ---

    /**
     * @param result "succeeded", "failed" or "skipped"
     */
    public void recordMigrationResult(String result) {
        Counter.builder("sourcemanager.migration.files")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordFilenameFallback() {
        Counter.builder("sourcemanager.migration.filename_fallbacks")
                .description("Legacy filenames that did not follow the four-segment convention")
                .register(registry)
                .increment();
    }

    public void recordBatchDuration(long ms) {
        Timer.builder("sourcemanager.migration.batch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
