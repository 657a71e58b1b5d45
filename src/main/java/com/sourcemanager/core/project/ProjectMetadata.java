package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a project file lives on disk.
 *
 * @param folderPath directory containing the project file
 * @param filename   project file name including extension
 */
public record ProjectMetadata(
    @JsonProperty("folder_path") String folderPath,
    String filename
) {}
