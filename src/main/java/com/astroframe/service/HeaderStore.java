package com.astroframe.service;

import com.astroframe.model.HeaderSet;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes the headers of raw and output files. A file is a container
 * of named components; the primary header belongs to the container itself.
 */
public interface HeaderStore {

    boolean exists(Path file);

    HeaderSet readPrimaryHeader(Path file) throws HeaderReadException;

    /** The primary header and every component header, from one read of the file. */
    ContainerHeaders readHeaders(Path file) throws HeaderReadException;

    /** Processed-image components, in file order. The shared header component is not one of them. */
    List<String> listNestedComponents(Path file) throws HeaderReadException;

    /** All named components, shared header component included. */
    List<String> listComponents(Path file) throws HeaderReadException;

    HeaderSet readNestedHeader(Path file, String component) throws HeaderReadException;

    boolean hasComponent(Path file, String component) throws HeaderReadException;

    /**
     * Replaces the primary header of an existing file.
     *
     * @return the header as stored, which may differ from {@code header} when
     *         the file format cannot hold every card
     */
    HeaderSet writeHeader(Path file, HeaderSet header) throws ContainerIOException;

    /**
     * Creates a container holding one placeholder component with the given
     * header. Fails if the file exists.
     */
    void createContainer(Path file, String component, HeaderSet header) throws ContainerIOException;

    /** Replaces the header of a component, creating a one-element placeholder component if missing. */
    void writeComponentHeader(Path file, String component, HeaderSet header) throws ContainerIOException;

    /** Removes a component. Nothing happens if it is not there. */
    void eraseComponent(Path file, String component) throws ContainerIOException;
}
