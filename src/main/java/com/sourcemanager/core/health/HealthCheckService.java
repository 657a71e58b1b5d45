package com.sourcemanager.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.io.DocumentIoException;
import com.sourcemanager.core.io.DocumentParseException;
import com.sourcemanager.core.io.JsonDocumentFiles;
import com.sourcemanager.core.region.RegionMapping;
import com.sourcemanager.core.region.RegionRouter;
import com.sourcemanager.core.store.RegionDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final Path masterSourcesDir;
    private final RegionRouter router;
    private final JsonDocumentFiles files;

    @Autowired
    public HealthCheckService(SourceManagerProperties properties, RegionRouter router, ObjectMapper objectMapper) {
        this(properties.getMasterSourcesPath(), router, new JsonDocumentFiles(objectMapper, properties.getIoTimeout()));
    }

    public HealthCheckService(Path masterSourcesDir, RegionRouter router, JsonDocumentFiles files) {
        this.masterSourcesDir = masterSourcesDir;
        this.router = router;
        this.files = files;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkMasterSourcesDir());
        for (RegionMapping region : router.regions()) {
            results.add(checkRegionDocument(region));
        }
        return results;
    }

    /** Worst status of {@code statuses}: DOWN over DEGRADED over UP. */
    public static HealthStatus.Status overall(List<HealthStatus> statuses) {
        HealthStatus.Status worst = HealthStatus.Status.UP;
        for (HealthStatus status : statuses) {
            if (status.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            if (status.status() == HealthStatus.Status.DEGRADED) {
                worst = HealthStatus.Status.DEGRADED;
            }
        }
        return worst;
    }

    private HealthStatus checkMasterSourcesDir() {
        Map<String, String> meta = Map.of("path", masterSourcesDir.toString());
        if (!Files.exists(masterSourcesDir)) {
            return HealthStatus.degraded("master-sources",
                    "Directory does not exist yet; it is created on first write", meta);
        }
        if (!Files.isDirectory(masterSourcesDir)) {
            return HealthStatus.down("master-sources",
                    "Path is not a directory", meta);
        }
        if (!Files.isWritable(masterSourcesDir)) {
            return HealthStatus.down("master-sources",
                    "Directory is not writable", meta);
        }
        return HealthStatus.up("master-sources", "Directory writable", meta);
    }

    private HealthStatus checkRegionDocument(RegionMapping region) {
        String component = "region:" + region.regionName();
        Path document = masterSourcesDir.resolve(region.sourceFile());
        Map<String, String> meta = Map.of("file", document.toString());
        try {
            Optional<RegionDocument> loaded = files.read(document, RegionDocument.class);
            if (loaded.isEmpty()) {
                return HealthStatus.up(component, "No document yet (0 sources)", meta);
            }
            return HealthStatus.up(component,
                    loaded.get().getSources().size() + " sources", meta);
        } catch (DocumentParseException e) {
            log.warn("Region document {} failed health check: {}", document, e.getMessage());
            return HealthStatus.degraded(component,
                    "Unparsable document: " + e.getMessage(), meta);
        } catch (DocumentIoException e) {
            log.warn("Region document {} could not be read: {}", document, e.getMessage());
            return HealthStatus.down(component,
                    "Read error: " + e.getMessage(), meta);
        }
    }
}
