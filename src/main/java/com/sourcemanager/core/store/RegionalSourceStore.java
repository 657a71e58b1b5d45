package com.sourcemanager.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.io.DocumentIoException;
import com.sourcemanager.core.io.DocumentParseException;
import com.sourcemanager.core.io.JsonDocumentFiles;
import com.sourcemanager.core.logging.MdcContext;
import com.sourcemanager.core.metrics.SourceManagerMetrics;
import com.sourcemanager.core.region.RegionMapping;
import com.sourcemanager.core.region.RegionRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the region documents under the master-sources root.
 * <p>
 * Reads are lock-free: documents are only ever replaced by an atomic rename,
 * so a reader sees a complete document. Every mutation is a full
 * read-modify-write of one document performed under {@link RegionLocks}.
 * Expected failures come back as a {@link StoreResult}; a document that cannot
 * be parsed reads as empty and is logged and counted.
 */
@Service
public class RegionalSourceStore {

    private static final Logger log = LoggerFactory.getLogger(RegionalSourceStore.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Path masterSourcesDir;
    private final String documentVersion;
    private final RegionRouter router;
    private final JsonDocumentFiles files;
    private final RegionLocks locks;
    private final SourceIdGenerator idGenerator;
    private final Clock clock;
    private final SourceManagerMetrics metrics;

    @Autowired
    public RegionalSourceStore(SourceManagerProperties properties,
                               RegionRouter router,
                               ObjectMapper objectMapper,
                               Clock clock,
                               SourceManagerMetrics metrics) {
        this(properties.getMasterSourcesPath(), properties.getDocumentVersion(), router,
                new JsonDocumentFiles(objectMapper, properties.getIoTimeout()),
                new SourceIdGenerator(clock), clock, metrics);
    }

    public RegionalSourceStore(Path masterSourcesDir,
                               String documentVersion,
                               RegionRouter router,
                               JsonDocumentFiles files,
                               SourceIdGenerator idGenerator,
                               Clock clock,
                               SourceManagerMetrics metrics) {
        this.masterSourcesDir = masterSourcesDir;
        this.documentVersion = documentVersion;
        this.router = router;
        this.files = files;
        this.locks = new RegionLocks(files.timeout());
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Path masterSourcesDir() {
        return masterSourcesDir;
    }

    /**
     * Document path for {@code region}; unknown names map to the catch-all document.
     */
    public Path sourceFilePath(String region) {
        return documentPath(effectiveRegion(region));
    }

    /**
     * Sources of {@code region} (or of the catch-all region for unknown names).
     * Absent and unparsable documents both yield an empty list.
     *
     * @throws DocumentIoException if the document exists but cannot be read
     */
    public RegionSources listSources(String region) throws DocumentIoException {
        RegionMapping mapping = effectiveRegion(region);
        return new RegionSources(mapping.regionName(), readSources(mapping, "list"));
    }

    /** Routes {@code projectPath} to its region, then lists that region's sources. */
    public RegionSources sourcesForProject(String projectPath) throws DocumentIoException {
        return listSources(router.resolveRegion(projectPath));
    }

    public Optional<SourceRecord> getSource(String region, String sourceId) throws DocumentIoException {
        if (sourceId == null) {
            return Optional.empty();
        }
        return listSources(region).sources().stream()
                .filter(s -> sourceId.equals(s.getId()))
                .findFirst();
    }

    /**
     * Appends {@code record} to the region document, creating the document if needed.
     * A record without an id receives a generated {@code src_} id; a supplied id
     * must not already exist in the document. The argument is not modified.
     */
    public StoreResult addSource(String region, SourceRecord record) {
        StoreResult result = doAddSource(region, record);
        metrics.recordStoreOperation("add", result.outcome().name().toLowerCase());
        return result;
    }

    /**
     * Merges {@code patch} into the record {@code sourceId}. Nothing is written
     * when the region, the document or the record does not exist.
     */
    public StoreResult updateSource(String region, String sourceId, SourcePatch patch) {
        StoreResult result = doUpdateSource(region, sourceId, patch);
        metrics.recordStoreOperation("update", result.outcome().name().toLowerCase());
        return result;
    }

    /**
     * All configured regions in declaration order with their current source
     * counts. A document that cannot be read counts as zero.
     */
    public List<RegionSummary> listRegions() {
        var summaries = new ArrayList<RegionSummary>();
        for (RegionMapping mapping : router.regions()) {
            int count = 0;
            try {
                count = readSources(mapping, "count").size();
            } catch (DocumentIoException e) {
                log.warn("Could not count sources in {}: {}", documentPath(mapping), e.getMessage());
                metrics.recordParseFailure(mapping.regionName(), "count");
            }
            summaries.add(new RegionSummary(mapping.regionName(), mapping.displayName(),
                    mapping.description(), mapping.scope(), count, mapping.sourceFile()));
        }
        return summaries;
    }

    private StoreResult doAddSource(String region, SourceRecord record) {
        if (record == null) {
            return StoreResult.invalid("No source record supplied");
        }
        Optional<RegionMapping> mapping = router.findRegion(region);
        if (mapping.isEmpty()) {
            // Reads fall back to the catch-all document, writes never do.
            return StoreResult.notFound("Unknown region '" + region + "'");
        }
        String regionName = mapping.get().regionName();
        Path document = documentPath(mapping.get());

        MdcContext.setRegion(regionName);
        try {
            ensureRoot();
            return locks.withLock(regionName, document, () -> {
                RegionDocument current = files.read(document, RegionDocument.class)
                        .orElseGet(() -> RegionDocument.empty(documentVersion, regionName));

                SourceRecord toStore = record.copy();
                Set<String> existingIds = idsOf(current);
                if (toStore.hasId()) {
                    if (existingIds.contains(toStore.getId())) {
                        return StoreResult.invalid("Source id '" + toStore.getId()
                                + "' already exists in " + document.getFileName());
                    }
                } else {
                    SourceIdGenerator.GeneratedId generated = idGenerator.generate(existingIds);
                    if (generated.fallback()) {
                        metrics.recordIdFallback(regionName);
                    }
                    toStore.setId(generated.id());
                }

                current.append(toStore);
                current.stamp(regionName, now(), documentVersion);
                write(regionName, document, current);
                log.info("Added source {} to region {} ({} sources)",
                        toStore.getId(), regionName, current.getSources().size());
                return StoreResult.ok(toStore.getId(), "Added source " + toStore.getId() + " to region " + regionName);
            });
        } catch (DocumentParseException e) {
            log.warn("Refusing to overwrite unreadable region document {}: {}", document, e.getMessage());
            metrics.recordParseFailure(regionName, "add");
            return StoreResult.ioFailure("Region document " + document.getFileName()
                    + " is unreadable and was left untouched: " + e.getMessage());
        } catch (IOException e) {
            log.error("Failed to add source to region {}: {}", regionName, e.getMessage());
            return StoreResult.ioFailure("Failed to add source to " + document.getFileName() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private StoreResult doUpdateSource(String region, String sourceId, SourcePatch patch) {
        if (sourceId == null || sourceId.isBlank()) {
            return StoreResult.invalid("No source id supplied");
        }
        if (patch == null || patch.isEmpty()) {
            return StoreResult.invalid("Patch for source '" + sourceId + "' contains no fields");
        }
        Optional<RegionMapping> mapping = router.findRegion(region);
        if (mapping.isEmpty()) {
            return StoreResult.notFound("Unknown region '" + region + "'");
        }
        String regionName = mapping.get().regionName();
        Path document = documentPath(mapping.get());

        MdcContext.setSource(regionName, sourceId);
        try {
            if (!Files.exists(document)) {
                return StoreResult.notFound("Region " + regionName + " has no document at " + document);
            }
            return locks.withLock(regionName, document, () -> {
                Optional<RegionDocument> loaded = files.read(document, RegionDocument.class);
                if (loaded.isEmpty()) {
                    return StoreResult.notFound("Region " + regionName + " has no document at " + document);
                }
                RegionDocument current = loaded.get();
                Optional<SourceRecord> existing = current.find(sourceId);
                if (existing.isEmpty()) {
                    return StoreResult.notFound("Source '" + sourceId + "' not found in region " + regionName);
                }

                current.replace(patch.applyTo(existing.get()));
                current.stamp(regionName, now(), documentVersion);
                write(regionName, document, current);
                log.info("Updated source {} in region {}", sourceId, regionName);
                return StoreResult.ok(sourceId, "Updated source " + sourceId + " in region " + regionName);
            });
        } catch (DocumentParseException e) {
            log.warn("Cannot update source {}: region document {} is unreadable: {}",
                    sourceId, document, e.getMessage());
            metrics.recordParseFailure(regionName, "update");
            return StoreResult.ioFailure("Region document " + document.getFileName()
                    + " is unreadable: " + e.getMessage());
        } catch (IOException e) {
            log.error("Failed to update source {} in region {}: {}", sourceId, regionName, e.getMessage());
            return StoreResult.ioFailure("Failed to update " + document.getFileName() + ": " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    private List<SourceRecord> readSources(RegionMapping mapping, String operation) throws DocumentIoException {
        Path document = documentPath(mapping);
        try {
            return files.read(document, RegionDocument.class)
                    .map(RegionDocument::getSources)
                    .orElse(List.of());
        } catch (DocumentParseException e) {
            log.warn("Could not load sources from {}: {}", document, e.getMessage());
            metrics.recordParseFailure(mapping.regionName(), operation);
            return List.of();
        }
    }

    private void write(String regionName, Path document, RegionDocument content) throws DocumentIoException {
        long start = System.currentTimeMillis();
        files.write(document, content);
        metrics.recordDocumentWrite(regionName, System.currentTimeMillis() - start);
    }

    private void ensureRoot() throws DocumentIoException {
        try {
            Files.createDirectories(masterSourcesDir);
        } catch (IOException e) {
            throw new DocumentIoException(masterSourcesDir,
                    "Master sources directory " + masterSourcesDir + " cannot be created: " + e.getMessage(), e);
        }
    }

    private RegionMapping effectiveRegion(String region) {
        return router.findRegion(region).orElseGet(router::catchAll);
    }

    private Path documentPath(RegionMapping mapping) {
        return masterSourcesDir.resolve(mapping.sourceFile());
    }

    private String now() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    private static Set<String> idsOf(RegionDocument document) {
        var ids = new HashSet<String>();
        for (SourceRecord source : document.getSources()) {
            if (source.hasId()) {
                ids.add(source.getId());
            }
        }
        return ids;
    }
}
