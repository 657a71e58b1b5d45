package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A project file in the canonical schema, as produced by the schema migrator.
 * <p>
 * {@code team}, {@code key_cites} and {@code slide_data} are carried as raw JSON
 * because their inner shape is owned by the legacy data, not by this model.
 */
@JsonPropertyOrder({"project_metadata", "team", "key_cites", "facility_information", "slide_data",
        "sources", "powerpoint_file", "number_header_citations"})
public record CanonicalProject(
    @JsonProperty("project_metadata") CanonicalProjectMetadata projectMetadata,
    JsonNode team,
    @JsonProperty("key_cites") JsonNode keyCites,
    @JsonProperty("facility_information") Map<String, Object> facilityInformation,
    @JsonProperty("slide_data") JsonNode slideData,
    List<ProjectSourceLink> sources,
    @JsonProperty("powerpoint_file") String powerpointFile,
    @JsonProperty("number_header_citations") int numberHeaderCitations
) {

    public static final String FACILITY_ID = "facility id";
    public static final String FACILITY_CODE = "facility code";
    public static final String FACILITY_NAME = "facility name";
    public static final String FACILITY_SURROGATE_KEY = "facility surrogate key";

    public CanonicalProject {
        team = team == null ? JsonNodeFactory.instance.objectNode() : team;
        keyCites = keyCites == null ? JsonNodeFactory.instance.arrayNode() : keyCites;
        slideData = slideData == null ? JsonNodeFactory.instance.objectNode() : slideData;
        facilityInformation = facilityInformation == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(facilityInformation));
        sources = sources == null ? List.of() : List.copyOf(sources);
        powerpointFile = powerpointFile == null ? "" : powerpointFile;
    }

    public Object facility(String key) {
        return facilityInformation.get(key);
    }
}
