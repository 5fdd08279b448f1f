package com.astroframe.service;

import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderSet;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Carries the shared header of a raw container forward into the output files
 * made from it.
 */
public class ContainerHeaderPropagator {

    private static final Logger LOG = Logger.getLogger(ContainerHeaderPropagator.class.getName());

    private final HeaderStore store;
    private final String headerComponent;

    public ContainerHeaderPropagator(HeaderStore store, String headerComponent) {
        this.store = store;
        this.headerComponent = headerComponent;
    }

    public String getHeaderComponent() {
        return headerComponent;
    }

    /**
     * Gives {@code dest} a shared header component. It is copied verbatim from
     * {@code source} when the source has one; otherwise a one-element
     * placeholder carrying {@code current} is written. A header component
     * already present in {@code dest} is replaced as a whole.
     */
    public void propagate(Path source, Path dest, HeaderSet current) throws ContainerIOException {
        HeaderSet header = sourceHeader(source, dest);
        if (header == null) {
            LOG.fine("No " + headerComponent + " component in " + source + ", writing the frame header to " + dest);
            header = (current == null) ? HeaderSet.EMPTY : current;
        }

        // one write either way, so a failure leaves dest as it was
        if (!store.exists(dest)) {
            store.createContainer(dest, headerComponent, header);
        } else {
            store.writeComponentHeader(dest, headerComponent, header);
        }
    }

    /**
     * Makes {@code dest} ready to receive {@code component}: an existing
     * container loses any old copy of the component, a new container is
     * created with the header propagated from {@code source}.
     */
    public void prepareOutput(Path source, Path dest, String component, HeaderSet current) throws ContainerIOException {
        if (store.exists(dest)) {
            if (hasComponent(source, dest, dest, component)) {
                store.eraseComponent(dest, component);
            }
        } else {
            propagate(source, dest, current);
        }
    }

    /**
     * Rewrites the primary header of {@code dest} as the shared header cards
     * of {@code source} followed by the cards of {@code dest} that are not
     * already among them. Either the whole header is replaced or nothing is.
     * A keyword present in both with different values keeps the source value
     * when the store holds one card per keyword.
     *
     * @return the header as stored in {@code dest}
     */
    public HeaderSet mergeHeaders(Path source, Path dest) throws ContainerIOException {
        HeaderSet fitsA = sourceHeader(source, dest);
        if (fitsA == null) {
            throw new ContainerIOException(source, dest, "No " + headerComponent + " component to merge from");
        }

        HeaderSet fitsB;
        try {
            fitsB = store.readPrimaryHeader(dest);
        } catch (HeaderReadException e) {
            throw new ContainerIOException(source, dest, "Unable to read destination header", e);
        }

        // duplicates are judged on the whole card, not the keyword
        Set<HeaderCard> seen = new HashSet<>(fitsA.cards());
        HeaderSet.Builder merged = HeaderSet.builder().addAll(fitsA);
        int dropped = 0;
        for (HeaderCard c : fitsB) {
            if (seen.contains(c)) dropped++;
            else merged.add(c);
        }

        HeaderSet result = store.writeHeader(dest, merged.build());
        LOG.fine(String.format("Merged %d header cards into %s (%d duplicates dropped)", result.size(), dest, dropped));
        return result;
    }

    /** Copies the shared header cards of {@code source} onto the primary header of {@code dest}. */
    public void copyHeader(Path source, Path dest) throws ContainerIOException {
        HeaderSet header = sourceHeader(source, dest);
        if (header == null) {
            throw new ContainerIOException(source, dest, "Failed to propagate header: no " + headerComponent + " component");
        }
        store.writeHeader(dest, header);
    }

    // Null when the source or its header component does not exist
    private HeaderSet sourceHeader(Path source, Path dest) throws ContainerIOException {
        if (source == null || !store.exists(source)) return null;
        if (!hasComponent(source, dest, source, headerComponent)) return null;
        try {
            return store.readNestedHeader(source, headerComponent);
        } catch (HeaderReadException e) {
            throw new ContainerIOException(source, dest, "Unable to read " + headerComponent + " component", e);
        }
    }

    private boolean hasComponent(Path source, Path dest, Path file, String component) throws ContainerIOException {
        try {
            return store.hasComponent(file, component);
        } catch (HeaderReadException e) {
            throw new ContainerIOException(source, dest, "Unable to open " + file, e);
        }
    }
}
