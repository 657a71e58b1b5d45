package com.sourcemanager.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.io.JsonDocumentFiles;
import com.sourcemanager.core.metrics.SourceManagerMetrics;
import com.sourcemanager.core.region.RegionRouter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RegionalSourceStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final RegionRouter router = new RegionRouter(new SourceManagerProperties());
    private SimpleMeterRegistry registry;
    private Path master;
    private RegionalSourceStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        master = tempDir.resolve("master_sources");
        store = storeAt(Clock.fixed(NOW, ZoneOffset.UTC), new SourceIdGenerator(Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    private RegionalSourceStore storeAt(Clock clock, SourceIdGenerator generator) {
        return new RegionalSourceStore(master, "1.0", router,
                new JsonDocumentFiles(mapper, Duration.ofSeconds(5)), generator, clock,
                new SourceManagerMetrics(registry));
    }

    private void writeRaw(String fileName, String json) throws Exception {
        Files.createDirectories(master);
        Files.writeString(master.resolve(fileName), json);
    }

    private JsonNode readDocument(String fileName) throws Exception {
        return mapper.readTree(master.resolve(fileName).toFile());
    }

    private static SourceRecord titled(String title) {
        return SourceRecord.withoutId(Map.of(SourceRecord.TITLE, title));
    }

    @Nested
    @DisplayName("listSources")
    class ListSources {

        @Test
        @DisplayName("absent document yields an empty list")
        void absent() throws Exception {
            RegionSources sources = store.listSources("ROW");
            assertEquals("ROW", sources.regionName());
            assertTrue(sources.sources().isEmpty());
            assertFalse(Files.exists(master), "reads never create the root");
        }

        @Test
        @DisplayName("unknown region reads the catch-all document")
        void unknownRegion() throws Exception {
            writeRaw("General_sources.json", "{\"sources\":[{\"id\":\"src_11111111\",\"title\":\"G\"}]}");
            RegionSources sources = store.listSources("Atlantis");
            assertEquals("General", sources.regionName());
            assertEquals(1, sources.sources().size());
            assertEquals(master.resolve("General_sources.json"), store.sourceFilePath("Atlantis"));
        }

        @Test
        @DisplayName("unparsable document yields empty list, a warning metric and no exception")
        void unparsable() throws Exception {
            writeRaw("ROW_sources.json", "{ not json");
            assertTrue(store.listSources("ROW").sources().isEmpty());

            var counter = registry.find("sourcemanager.documents.parse_failures")
                    .tag("region", "ROW").tag("operation", "list").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("sourcesForProject routes through the region router")
        void sourcesForProject() throws Exception {
            store.addSource("Downtown", titled("Street grid"));
            RegionSources sources = store.sourcesForProject("/projects/Urban/p7/x - y - STD - 2024.json");
            assertEquals("Downtown", sources.regionName());
            assertEquals("Street grid", sources.sources().get(0).title());
        }

        @Test
        @DisplayName("getSource finds a record by id")
        void getSource() throws Exception {
            String id = store.addSource("ROW", titled("Survey")).sourceId();
            assertEquals("Survey", store.getSource("ROW", id).orElseThrow().title());
            assertTrue(store.getSource("ROW", "src_missing0").isEmpty());
        }

        @Test
        @DisplayName("getSource with a null id finds nothing")
        void getSourceNullId() throws Exception {
            store.addSource("ROW", titled("Survey"));
            writeRaw("General_sources.json", "{\"sources\":[{\"title\":\"no id\"}]}");

            assertTrue(store.getSource("ROW", null).isEmpty());
            assertTrue(store.getSource("General", null).isEmpty());
        }
    }

    @Nested
    @DisplayName("addSource")
    class AddSource {

        @Test
        @DisplayName("creates the root and document with fresh metadata")
        void createsDocument() throws Exception {
            StoreResult result = store.addSource("ROW", titled("First"));

            assertTrue(result.success(), result.message());
            assertTrue(result.sourceId().matches("src_[0-9a-f]{8}"), result.sourceId());

            JsonNode doc = readDocument("ROW_sources.json");
            assertEquals(1, doc.get("sources").size());
            assertEquals(result.sourceId(), doc.get("sources").get(0).get("id").asText());
            assertEquals("1.0", doc.get("metadata").get("version").asText());
            assertEquals("ROW", doc.get("metadata").get("region").asText());
            assertEquals("2024-05-01T12:00:00", doc.get("metadata").get("last_updated").asText());
            assertEquals(1, doc.get("metadata").get("total_sources").asInt());
        }

        @Test
        @DisplayName("appends to an existing document and recomputes total_sources")
        void appendsToExisting() throws Exception {
            writeRaw("ROW_sources.json", """
                    {"sources": [{"id": "src_aaaaaaaa", "title": "T1"}],
                     "metadata": {"version": "1.0", "region": "ROW", "last_updated": "2020-01-01T00:00:00", "total_sources": 1}}
                    """);

            StoreResult result = store.addSource("ROW", titled("T2"));

            assertTrue(result.success());
            JsonNode doc = readDocument("ROW_sources.json");
            assertEquals(2, doc.get("sources").size());
            assertEquals("src_aaaaaaaa", doc.get("sources").get(0).get("id").asText());
            String newId = doc.get("sources").get(1).get("id").asText();
            assertTrue(newId.startsWith("src_"));
            assertNotEquals("src_aaaaaaaa", newId);
            assertEquals("T2", doc.get("sources").get(1).get("title").asText());
            assertEquals(2, doc.get("metadata").get("total_sources").asInt());
        }

        @Test
        @DisplayName("does not modify the caller's record")
        void callerRecordUntouched() {
            SourceRecord record = titled("Mine");
            store.addSource("ROW", record);
            assertFalse(record.hasId());
        }

        @Test
        @DisplayName("keeps a caller-supplied id")
        void suppliedId() throws Exception {
            var record = new SourceRecord("custom-7", Map.of(SourceRecord.TITLE, "Custom"));
            StoreResult result = store.addSource("ROW", record);
            assertEquals("custom-7", result.sourceId());
            assertTrue(store.getSource("ROW", "custom-7").isPresent());
        }

        @Test
        @DisplayName("rejects a caller-supplied id that already exists")
        void duplicateSuppliedId() throws Exception {
            store.addSource("ROW", new SourceRecord("dup", Map.of(SourceRecord.TITLE, "A")));
            String before = Files.readString(master.resolve("ROW_sources.json"));

            StoreResult result = store.addSource("ROW", new SourceRecord("dup", Map.of(SourceRecord.TITLE, "B")));

            assertEquals(StoreResult.Outcome.VALIDATION_FAILED, result.outcome());
            assertEquals(before, Files.readString(master.resolve("ROW_sources.json")));
        }

        @Test
        @DisplayName("unknown region is NOT_FOUND instead of being written to the catch-all document")
        void unknownRegion() {
            StoreResult result = store.addSource("Atlantis", titled("Lost"));
            assertEquals(StoreResult.Outcome.NOT_FOUND, result.outcome());
            assertTrue(result.message().contains("Atlantis"));
            assertFalse(Files.exists(master.resolve("General_sources.json")));
            assertFalse(Files.exists(master));
        }

        @Test
        @DisplayName("refuses to overwrite an unparsable document")
        void unparsableNotOverwritten() throws Exception {
            writeRaw("ROW_sources.json", "{ broken");

            StoreResult result = store.addSource("ROW", titled("New"));

            assertEquals(StoreResult.Outcome.IO_FAILURE, result.outcome());
            assertTrue(result.message().contains("ROW_sources.json"));
            assertEquals("{ broken", Files.readString(master.resolve("ROW_sources.json")));
        }

        @Test
        @DisplayName("colliding random ids fall back to timestamp ids, never duplicating")
        void collisionFallback() throws Exception {
            writeRaw("ROW_sources.json", "{\"sources\":[{\"id\":\"src_aaaaaaaa\"}],\"metadata\":{}}");
            var alwaysSame = new SourceIdGenerator(() -> "aaaaaaaa", Clock.fixed(NOW, ZoneOffset.UTC));
            var colliding = storeAt(Clock.fixed(NOW, ZoneOffset.UTC), alwaysSame);

            String first = colliding.addSource("ROW", titled("One")).sourceId();
            String second = colliding.addSource("ROW", titled("Two")).sourceId();

            assertEquals("src_" + NOW.getEpochSecond(), first);
            assertEquals("src_" + NOW.getEpochSecond() + "_1", second);

            var ids = new HashSet<String>();
            for (SourceRecord s : colliding.listSources("ROW").sources()) {
                assertTrue(ids.add(s.getId()), "duplicate id " + s.getId());
            }
            assertEquals(2.0, registry.find("sourcemanager.store.id_fallbacks").counter().count());
        }

        @Test
        @DisplayName("leaves no temporary files behind")
        void noTempFiles() throws Exception {
            store.addSource("ROW", titled("A"));
            store.addSource("ROW", titled("B"));
            try (Stream<Path> files = Files.list(master)) {
                List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
                assertEquals(List.of("ROW_sources.json", "ROW_sources.json.lock"), names);
            }
        }
    }

    @Nested
    @DisplayName("updateSource")
    class UpdateSource {

        @Test
        @DisplayName("merges patched fields and keeps the rest, including unknown fields")
        void merges() throws Exception {
            writeRaw("ROW_sources.json", """
                    {"sources": [{"id": "src_12345678", "title": "Old", "publisher": "Agency",
                                  "custom": {"nested": [1, 2]}, "notes": null}],
                     "metadata": {"version": "0.9", "region": "ROW", "last_updated": "2020-01-01T00:00:00", "total_sources": 1}}
                    """);

            StoreResult result = store.updateSource("ROW", "src_12345678",
                    SourcePatch.builder().title("New").year(2021).field("extra", "x").build());

            assertTrue(result.success(), result.message());
            JsonNode source = readDocument("ROW_sources.json").get("sources").get(0);
            assertEquals("src_12345678", source.get("id").asText());
            assertEquals("New", source.get("title").asText());
            assertEquals("Agency", source.get("publisher").asText());
            assertEquals(2021, source.get("year").asInt());
            assertEquals("x", source.get("extra").asText());
            assertEquals(2, source.get("custom").get("nested").size());
            assertTrue(source.has("notes") && source.get("notes").isNull());

            JsonNode metadata = readDocument("ROW_sources.json").get("metadata");
            assertEquals("0.9", metadata.get("version").asText(), "existing version is kept");
            assertEquals("2024-05-01T12:00:00", metadata.get("last_updated").asText());
            assertEquals(1, metadata.get("total_sources").asInt());
        }

        @Test
        @DisplayName("nonexistent id leaves the document byte-for-byte unchanged")
        void missingId() throws Exception {
            store.addSource("ROW", titled("Only"));
            Path doc = master.resolve("ROW_sources.json");
            String before = Files.readString(doc);

            var later = storeAt(Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC),
                    new SourceIdGenerator(Clock.systemUTC()));
            StoreResult result = later.updateSource("ROW", "src_nothere", SourcePatch.builder().title("X").build());

            assertEquals(StoreResult.Outcome.NOT_FOUND, result.outcome());
            assertEquals(before, Files.readString(doc));
        }

        @Test
        @DisplayName("missing document is NOT_FOUND and is not created")
        void missingDocument() {
            StoreResult result = store.updateSource("Regional", "src_00000000",
                    SourcePatch.builder().title("X").build());
            assertEquals(StoreResult.Outcome.NOT_FOUND, result.outcome());
            assertFalse(Files.exists(master.resolve("Regional_sources.json")));
        }

        @Test
        @DisplayName("unknown region is NOT_FOUND")
        void unknownRegion() {
            StoreResult result = store.updateSource("Atlantis", "src_00000000",
                    SourcePatch.builder().title("X").build());
            assertEquals(StoreResult.Outcome.NOT_FOUND, result.outcome());
        }

        @Test
        @DisplayName("empty patch is a validation failure")
        void emptyPatch() {
            StoreResult result = store.updateSource("ROW", "src_00000000", SourcePatch.builder().build());
            assertEquals(StoreResult.Outcome.VALIDATION_FAILED, result.outcome());
        }

        @Test
        @DisplayName("outcomes are counted")
        void outcomesCounted() {
            store.updateSource("Atlantis", "x", SourcePatch.builder().title("X").build());
            assertEquals(1.0, registry.find("sourcemanager.store.operations")
                    .tag("operation", "update").tag("outcome", "not_found").counter().count());
        }
    }

    @Nested
    @DisplayName("listRegions")
    class ListRegions {

        @Test
        @DisplayName("reports every region with its source count")
        void counts() {
            store.addSource("ROW", titled("A"));
            store.addSource("ROW", titled("B"));
            store.addSource("General", titled("C"));

            List<RegionSummary> regions = store.listRegions();

            assertEquals(5, regions.size());
            assertEquals("ROW", regions.get(0).regionName());
            assertEquals(2, regions.get(0).sourceCount());
            assertEquals("Right of Way", regions.get(0).displayName());
            RegionSummary general = regions.get(4);
            assertEquals(1, general.sourceCount());
            assertEquals("General_sources.json", general.sourceFile());
        }

        @Test
        @DisplayName("unparsable documents count as zero")
        void unparsableCountsZero() throws Exception {
            writeRaw("Other_sources.json", "[");
            RegionSummary other = store.listRegions().stream()
                    .filter(r -> r.regionName().equals("Other")).findFirst().orElseThrow();
            assertEquals(0, other.sourceCount());
            assertEquals(1.0, registry.find("sourcemanager.documents.parse_failures")
                    .tag("region", "Other").counter().count());
        }
    }

    @Nested
    @DisplayName("Persistence and concurrency")
    class Persistence {

        @Test
        @DisplayName("round-trip keeps order and total_sources equals the list length")
        void roundTrip() throws Exception {
            var ids = new ArrayList<String>();
            for (String title : List.of("One", "Two", "Three")) {
                ids.add(store.addSource("Regional", titled(title)).sourceId());
            }

            var read = store.listSources("Regional").sources().stream().map(SourceRecord::getId).toList();
            assertEquals(ids, read);
            assertEquals(3, readDocument("Regional_sources.json").get("metadata").get("total_sources").asInt());
        }

        @Test
        @DisplayName("concurrent adds from separate store instances lose no records")
        void concurrentAdds() throws Exception {
            var other = storeAt(Clock.systemUTC(), new SourceIdGenerator(Clock.systemUTC()));
            int threads = 6;
            int perThread = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < threads; t++) {
                RegionalSourceStore target = t % 2 == 0 ? store : other;
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        StoreResult result = target.addSource("Downtown", titled("t" + thread + "-" + i));
                        assertTrue(result.success(), result.message());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
            pool.shutdown();

            List<SourceRecord> sources = store.listSources("Downtown").sources();
            assertEquals(threads * perThread, sources.size());
            assertEquals(threads * perThread, new HashSet<>(sources.stream().map(SourceRecord::getId).toList()).size());
            assertEquals(threads * perThread,
                    readDocument("Downtown_sources.json").get("metadata").get("total_sources").asInt());
        }
    }
}
