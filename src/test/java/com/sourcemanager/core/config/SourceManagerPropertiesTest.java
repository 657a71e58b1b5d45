package com.sourcemanager.core.config;

import com.sourcemanager.core.region.RegionRouter;
import com.sourcemanager.core.region.SourceScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceManagerPropertiesTest {

    @Test
    @DisplayName("defaults reproduce the five standard regions")
    void defaultRegions() {
        var props = new SourceManagerProperties();
        var names = props.getRegions().stream().map(SourceManagerProperties.Region::getRegionName).toList();
        assertEquals(List.of("ROW", "Other", "Downtown", "Regional", "General"), names);

        var general = props.getRegions().get(4);
        assertEquals(List.of("**"), general.getDirectoryPatterns());
        assertEquals(1, general.getPriority());
        assertEquals(SourceScope.GLOBAL, general.getScope());
        assertEquals("General_sources.json", general.getSourceFile());
    }

    @Test
    @DisplayName("default region table passes router validation")
    void defaultsAreRoutable() {
        var router = new RegionRouter(new SourceManagerProperties());
        assertEquals("General", router.catchAll().regionName());
    }

    @Test
    @DisplayName("scalar defaults")
    void scalarDefaults() {
        var props = new SourceManagerProperties();
        assertEquals(Duration.ofSeconds(10), props.getIoTimeout());
        assertEquals("1.0", props.getDocumentVersion());
        assertEquals(".json", props.getMigration().getExtension());
        assertFalse(props.getMigration().isRecursive());
        assertTrue(props.getMigration().isBackupExisting());
        assertEquals(1, props.getMigration().getParallelism());
        assertNotNull(props.getMasterSourcesPath());
    }

    @Test
    @DisplayName("relaxed binding overrides root, timeout and regions")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.ofEntries(
                Map.entry("sourcemanager.master-sources-dir", "/tmp/master"),
                Map.entry("sourcemanager.io-timeout-seconds", "3"),
                Map.entry("sourcemanager.migration.parallelism", "4"),
                Map.entry("sourcemanager.regions[0].region-name", "North"),
                Map.entry("sourcemanager.regions[0].directory-patterns[0]", "**/North/**"),
                Map.entry("sourcemanager.regions[0].source-file", "North_sources.json"),
                Map.entry("sourcemanager.regions[0].priority", "5"),
                Map.entry("sourcemanager.regions[1].region-name", "Everything"),
                Map.entry("sourcemanager.regions[1].directory-patterns[0]", "**"),
                Map.entry("sourcemanager.regions[1].source-file", "Everything_sources.json"),
                Map.entry("sourcemanager.regions[1].scope", "global")));

        var props = new Binder(source).bind("sourcemanager", SourceManagerProperties.class).get();

        assertEquals(Path.of("/tmp/master"), props.getMasterSourcesPath());
        assertEquals(Duration.ofSeconds(3), props.getIoTimeout());
        assertEquals(4, props.getMigration().getParallelism());
        assertEquals(2, props.getRegions().size());
        assertEquals(SourceScope.GLOBAL, props.getRegions().get(1).getScope());
        assertEquals("Everything", new RegionRouter(props).catchAll().regionName());
    }
}
