package com.astroframe.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A header that could not be read or parsed. Callers assembling a frame
 * recover from it by using an empty header for the file.
 */
public class HeaderReadException extends IOException {

    private final Path file;

    public HeaderReadException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public HeaderReadException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
