package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A citation or slide within a project and the source ids it references.
 * Optional members and unset audit stamps are omitted from JSON;
 * {@code source_references} is never null.
 */
public record ProjectCitation(
    @JsonProperty("citation_id") String citationId,
    String title,
    @JsonInclude(JsonInclude.Include.NON_NULL) String content,
    @JsonProperty("source_references") List<String> sourceReferences,
    @JsonProperty("slide_number") @JsonInclude(JsonInclude.Include.NON_NULL) Integer slideNumber,
    @JsonProperty("date_created") @JsonInclude(JsonInclude.Include.NON_NULL) String dateCreated,
    @JsonProperty("created_by") @JsonInclude(JsonInclude.Include.NON_NULL) String createdBy,
    @JsonProperty("last_modified") @JsonInclude(JsonInclude.Include.NON_NULL) String lastModified,
    @JsonProperty("modified_by") @JsonInclude(JsonInclude.Include.NON_NULL) String modifiedBy
) {

    public ProjectCitation {
        sourceReferences = sourceReferences == null ? List.of() : List.copyOf(sourceReferences);
    }

    public boolean references(String sourceId) {
        return sourceReferences.contains(sourceId);
    }
}
