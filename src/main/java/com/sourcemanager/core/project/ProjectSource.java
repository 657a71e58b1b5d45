package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A project's use of one regional source record.
 *
 * @param sourceId        id of the {@code SourceRecord} in the region document
 * @param usageNotes      how the project uses the source
 * @param userDescription the author's description in this project's context
 * @param dateAdded       ISO-8601 local timestamp
 * @param addedBy         who linked the source
 * @param citationFormat  per-project citation format; omitted when unset
 */
public record ProjectSource(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("usage_notes") String usageNotes,
    @JsonProperty("user_description") String userDescription,
    @JsonProperty("date_added") String dateAdded,
    @JsonProperty("added_by") String addedBy,
    @JsonProperty("citation_format") @JsonInclude(JsonInclude.Include.NON_NULL) String citationFormat
) {}
