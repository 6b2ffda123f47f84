package com.suhana.common;

import java.nio.file.Path;

/**
 * Target of a single-file operation is missing or could not be read/written.
 */
public class FileAccessException extends SuhanaCryptoException {
    private final transient Path path;

    public FileAccessException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public FileAccessException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
