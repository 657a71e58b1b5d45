package com.sourcemanager.core.io;

import java.nio.file.Path;

/**
 * The document exists but is not valid JSON for the expected shape.
 */
public class DocumentParseException extends DocumentIoException {

    public DocumentParseException(Path document, Throwable cause) {
        super(document, "Could not parse " + document.getFileName() + ": " + cause.getMessage(), cause);
    }
}
