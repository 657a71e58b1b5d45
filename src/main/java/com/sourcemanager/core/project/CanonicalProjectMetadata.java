package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code project_metadata} block of a canonical project file.
 */
public record CanonicalProjectMetadata(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_type") String projectType,
    String title,
    @JsonProperty("file_path") String filePath,
    String requestor,
    @JsonProperty("request_year") String requestYear,
    boolean relook
) {}
