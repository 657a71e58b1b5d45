package com.sourcemanager.core.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The persisted unit of a region: its source records plus a metadata block.
 * Instances are mutable working copies that live for one read-modify-write.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegionDocument {

    private final List<SourceRecord> sources;
    private DocumentMetadata metadata;

    @JsonCreator
    public RegionDocument(@JsonProperty("sources") List<SourceRecord> sources,
                          @JsonProperty("metadata") DocumentMetadata metadata) {
        this.sources = sources == null ? new ArrayList<>() : new ArrayList<>(sources);
        this.metadata = metadata;
    }

    public static RegionDocument empty(String version, String region) {
        return new RegionDocument(List.of(), DocumentMetadata.initial(version, region));
    }

    @JsonProperty("sources")
    public List<SourceRecord> getSources() {
        return sources;
    }

    @JsonProperty("metadata")
    public DocumentMetadata getMetadata() {
        return metadata;
    }

    public Optional<SourceRecord> find(String sourceId) {
        return sources.stream().filter(s -> sourceId.equals(s.getId())).findFirst();
    }

    public boolean containsId(String sourceId) {
        return find(sourceId).isPresent();
    }

    /** Replaces the record carrying {@code replacement}'s id in place. */
    boolean replace(SourceRecord replacement) {
        for (int i = 0; i < sources.size(); i++) {
            if (replacement.getId().equals(sources.get(i).getId())) {
                sources.set(i, replacement);
                return true;
            }
        }
        return false;
    }

    void append(SourceRecord record) {
        sources.add(record);
    }

    /** Refreshes {@code last_updated} and recomputes {@code total_sources}. */
    void stamp(String region, String timestamp, String defaultVersion) {
        DocumentMetadata current = metadata != null ? metadata : DocumentMetadata.initial(defaultVersion, region);
        if (current.version() == null) {
            current = new DocumentMetadata(defaultVersion, current.region(), current.lastUpdated(), current.totalSources());
        }
        this.metadata = current.touched(region, timestamp, sources.size());
    }
}
