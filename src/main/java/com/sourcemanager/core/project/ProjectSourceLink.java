package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reduced source entry of a canonical project file.
 *
 * @param uuid       id of the referenced source record
 * @param order      1-based display position
 * @param usageNotes project-local notes on the source
 */
public record ProjectSourceLink(
    String uuid,
    int order,
    @JsonProperty("usage_notes") String usageNotes
) {}
