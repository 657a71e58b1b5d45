package com.sourcemanager.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata block of a region document.
 *
 * @param version      document format version
 * @param region       owning region name
 * @param lastUpdated  ISO-8601 local timestamp of the last successful write
 * @param totalSources number of records in the document
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentMetadata(
    @JsonProperty("version") String version,
    @JsonProperty("region") String region,
    @JsonProperty("last_updated") String lastUpdated,
    @JsonProperty("total_sources") int totalSources
) {

    public static DocumentMetadata initial(String version, String region) {
        return new DocumentMetadata(version, region, "", 0);
    }

    public DocumentMetadata touched(String region, String timestamp, int totalSources) {
        return new DocumentMetadata(version, region, timestamp, totalSources);
    }
}
