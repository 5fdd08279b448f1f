package com.astroframe.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Failure to create, open or rewrite a container. When thrown by a write the
 * destination file is left as it was.
 */
public class ContainerIOException extends IOException {

    private final Path source;
    private final Path destination;
    private final String status;

    public ContainerIOException(Path source, Path destination, String status, Throwable cause) {
        super(buildMessage(source, destination, status, cause), cause);
        this.source = source;
        this.destination = destination;
        this.status = status;
    }

    public ContainerIOException(Path source, Path destination, String status) {
        this(source, destination, status, null);
    }

    private static String buildMessage(Path source, Path destination, String status, Throwable cause) {
        StringBuilder sb = new StringBuilder(status);
        if (source != null) sb.append(" [source: ").append(source).append(']');
        if (destination != null) sb.append(" [destination: ").append(destination).append(']');
        if (cause != null && cause.getMessage() != null) sb.append(": ").append(cause.getMessage());
        return sb.toString();
    }

    public Path getSource() { return source; }
    public Path getDestination() { return destination; }
    public String getStatus() { return status; }
}
