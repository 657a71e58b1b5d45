package com.sourcemanager.core.project;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcemanager.core.config.SourceManagerProperties;
import com.sourcemanager.core.io.DocumentIoException;
import com.sourcemanager.core.io.JsonDocumentFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads and saves project record files.
 */
@Service
public class ProjectRecordFiles {

    private static final Logger log = LoggerFactory.getLogger(ProjectRecordFiles.class);

    private final JsonDocumentFiles files;

    @Autowired
    public ProjectRecordFiles(ObjectMapper objectMapper, SourceManagerProperties properties) {
        this(new JsonDocumentFiles(objectMapper, properties.getIoTimeout()));
    }

    public ProjectRecordFiles(JsonDocumentFiles files) {
        this.files = files;
    }

    /**
     * Reads the project at {@code path}. Missing, unreadable and malformed files
     * all come back empty; the reason is logged.
     */
    public Optional<ProjectRecord> load(Path path) {
        try {
            Optional<ProjectRecord> record = files.read(path, ProjectRecord.class);
            if (record.isEmpty()) {
                log.warn("Project file {} does not exist", path);
            }
            return record;
        } catch (DocumentIoException e) {
            log.warn("Error loading project from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /** Atomically writes {@code record} to {@code path}. */
    public void save(ProjectRecord record, Path path) throws DocumentIoException {
        files.write(path, record);
        log.debug("Saved project {} to {}", record.getProjectId(), path);
    }
}
