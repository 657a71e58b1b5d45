package com.sourcemanager.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.io.JsonDocumentFiles;
import com.sourcemanager.core.region.RegionRouter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckServiceTest {

    @TempDir
    Path tempDir;

    private final RegionRouter router = new RegionRouter(new SourceManagerProperties());

    private HealthCheckService serviceAt(Path master) {
        return new HealthCheckService(master, router, new JsonDocumentFiles(new ObjectMapper(), Duration.ofSeconds(5)));
    }

    private static HealthStatus component(List<HealthStatus> statuses, String name) {
        return statuses.stream().filter(s -> s.component().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("one status for the root plus one per region")
    void coversEveryRegion() throws Exception {
        List<HealthStatus> statuses = serviceAt(Files.createDirectories(tempDir.resolve("m"))).checkAll();
        assertEquals(6, statuses.size());
        assertEquals("master-sources", statuses.get(0).component());
        assertEquals("region:ROW", statuses.get(1).component());
        assertEquals(HealthStatus.Status.UP, HealthCheckService.overall(statuses));
    }

    @Test
    @DisplayName("a missing master root is degraded, not down")
    void missingRoot() {
        List<HealthStatus> statuses = serviceAt(tempDir.resolve("absent")).checkAll();
        assertEquals(HealthStatus.Status.DEGRADED, component(statuses, "master-sources").status());
        assertEquals(HealthStatus.Status.UP, component(statuses, "region:General").status());
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.overall(statuses));
    }

    @Test
    @DisplayName("a master root that is a file is down")
    void rootIsFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("file"), "x");
        assertEquals(HealthStatus.Status.DOWN, component(serviceAt(file).checkAll(), "master-sources").status());
    }

    @Test
    @DisplayName("region documents report their source counts")
    void sourceCounts() throws Exception {
        Path master = Files.createDirectories(tempDir.resolve("m"));
        Files.writeString(master.resolve("ROW_sources.json"), "{\"sources\":[{\"id\":\"a\"},{\"id\":\"b\"}]}");

        HealthStatus row = component(serviceAt(master).checkAll(), "region:ROW");

        assertEquals(HealthStatus.Status.UP, row.status());
        assertEquals("2 sources", row.detail());
        assertEquals(master.resolve("ROW_sources.json").toString(), row.metadata().get("file"));
    }

    @Test
    @DisplayName("an unparsable region document degrades health")
    void unparsableDocument() throws Exception {
        Path master = Files.createDirectories(tempDir.resolve("m"));
        Files.writeString(master.resolve("Downtown_sources.json"), "{oops");

        List<HealthStatus> statuses = serviceAt(master).checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(statuses, "region:Downtown").status());
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.overall(statuses));
    }

    @Test
    @DisplayName("an unreadable region document is down")
    void unreadableDocument() throws Exception {
        Path master = Files.createDirectories(tempDir.resolve("m"));
        Files.createDirectories(master.resolve("Other_sources.json"));

        List<HealthStatus> statuses = serviceAt(master).checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(statuses, "region:Other").status());
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.overall(statuses));
    }

    @Test
    @DisplayName("overall status picks the worst component")
    void overall() {
        var up = new HealthStatus("a", HealthStatus.Status.UP, "", Map.of());
        var degraded = new HealthStatus("b", HealthStatus.Status.DEGRADED, "", Map.of());
        var down = new HealthStatus("c", HealthStatus.Status.DOWN, "", Map.of());
        assertEquals(HealthStatus.Status.UP, HealthCheckService.overall(List.of()));
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.overall(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.overall(List.of(down, degraded)));
    }
}
