package com.sourcemanager.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceManagerMetricsTest {

    private SimpleMeterRegistry registry;
    private SourceManagerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SourceManagerMetrics(registry);
    }

    @Test
    @DisplayName("recordParseFailure counts by region and operation")
    void recordParseFailure() {
        metrics.recordParseFailure("ROW", "list");
        metrics.recordParseFailure("ROW", "list");
        metrics.recordParseFailure("General", "count");

        var rowList = registry.find("sourcemanager.documents.parse_failures")
                .tag("region", "ROW").tag("operation", "list").counter();
        var generalCount = registry.find("sourcemanager.documents.parse_failures")
                .tag("region", "General").tag("operation", "count").counter();

        assertNotNull(rowList);
        assertNotNull(generalCount);
        assertEquals(2.0, rowList.count());
        assertEquals(1.0, generalCount.count());
    }

    @Test
    @DisplayName("recordStoreOperation tags operation and outcome")
    void recordStoreOperation() {
        metrics.recordStoreOperation("add", "ok");
        metrics.recordStoreOperation("update", "not_found");

        assertEquals(1.0, registry.find("sourcemanager.store.operations")
                .tag("operation", "add").tag("outcome", "ok").counter().count());
        assertEquals(1.0, registry.find("sourcemanager.store.operations")
                .tag("operation", "update").tag("outcome", "not_found").counter().count());
    }

    @Test
    @DisplayName("recordDocumentWrite creates a timer per region")
    void recordDocumentWrite() {
        metrics.recordDocumentWrite("Downtown", 12);
        var timer = registry.find("sourcemanager.documents.write.duration").tag("region", "Downtown").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordMigrationResult increments by result tag")
    void recordMigrationResult() {
        metrics.recordMigrationResult("succeeded");
        metrics.recordMigrationResult("succeeded");
        metrics.recordMigrationResult("failed");

        assertEquals(2.0, registry.find("sourcemanager.migration.files")
                .tag("result", "succeeded").counter().count());
        assertEquals(1.0, registry.find("sourcemanager.migration.files")
                .tag("result", "failed").counter().count());
    }

    @Test
    @DisplayName("id and filename fallbacks are counted")
    void fallbacks() {
        metrics.recordIdFallback("ROW");
        metrics.recordFilenameFallback();
        metrics.recordBatchDuration(40);

        assertEquals(1.0, registry.find("sourcemanager.store.id_fallbacks").counter().count());
        assertEquals(1.0, registry.find("sourcemanager.migration.filename_fallbacks").counter().count());
        assertEquals(1, registry.find("sourcemanager.migration.batch.duration").timer().count());
    }
}
