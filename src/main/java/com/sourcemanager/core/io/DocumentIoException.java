package com.sourcemanager.core.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A read, write or lock on a JSON document failed or timed out.
 */
public class DocumentIoException extends IOException {

    private final Path document;

    public DocumentIoException(Path document, String message) {
        super(message);
        this.document = document;
    }

    public DocumentIoException(Path document, String message, Throwable cause) {
        super(message, cause);
        this.document = document;
    }

    public Path document() {
        return document;
    }
}
