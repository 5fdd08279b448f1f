package com.astroframe.service;

import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderSet;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

/**
 * Unit tests for the ContainerHeaderPropagator class.
 */
public class ContainerHeaderPropagatorTest {

    private static final Path RAW = Paths.get("raw", "a20240101_00012.sdf");
    private static final Path OUT = Paths.get("out", "a20240101_00012_reduced.sdf");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private InMemoryHeaderStore store;
    private ContainerHeaderPropagator propagator;

    @Before
    public void setUp() {
        store = new InMemoryHeaderStore();
        propagator = new ContainerHeaderPropagator(store, "HEADER");
    }

    private static HeaderCard card(String k, Object v) {
        return HeaderCard.ofObject(k, v, "");
    }

    /**
     * The destination does not exist yet and the source has no shared
     * header: the frame's header is written, and the result is a real
     * file that reads back intact.
     */
    @Test
    public void testPropagateCurrentHeaderIntoNewContainer() throws Exception {
        FitsHeaderService fits = new FitsHeaderService("HEADER");
        ContainerHeaderPropagator onDisk = new ContainerHeaderPropagator(fits, "HEADER");
        Path source = folder.getRoot().toPath().resolve("raw.fits");
        Path dest = folder.getRoot().toPath().resolve("reduced.fits");
        fits.createContainer(source, "I1", HeaderSet.of(card("EXP", 1L)));

        HeaderSet current = HeaderSet.of(card("OBJECT", "M1"), card("OBSNUM", 12L), card("FILTER", "K"));
        onDisk.propagate(source, dest, current);

        assertTrue(fits.exists(dest));
        HeaderSet back = fits.readNestedHeader(dest, "HEADER");
        assertEquals(3, back.size());
        assertEquals("M1", back.value("OBJECT"));
        assertEquals(12L, back.value("OBSNUM"));
        assertEquals("K", back.value("FILTER"));
    }

    @Test
    public void testPropagateCopiesSourceHeader() throws Exception {
        HeaderSet shared = HeaderSet.of(card("TELESCOP", "JCMT"));
        store.put(RAW, HeaderSet.EMPTY).putComponent(RAW, "HEADER", shared);

        propagator.propagate(RAW, OUT, HeaderSet.of(card("OBJECT", "M1")));
        assertEquals(shared, store.component(OUT, "HEADER"));
        assertEquals(1, store.getWrites());
    }

    @Test
    public void testPropagateReplacesExistingComponent() throws Exception {
        store.put(RAW, HeaderSet.EMPTY).putComponent(RAW, "HEADER", HeaderSet.of(card("NEW", 1L)));
        store.put(OUT, HeaderSet.EMPTY).putComponent(OUT, "HEADER", HeaderSet.of(card("OLD", 1L)));

        propagator.propagate(RAW, OUT, HeaderSet.EMPTY);
        assertEquals(HeaderSet.of(card("NEW", 1L)), store.component(OUT, "HEADER"));
    }

    @Test
    public void testFailedPropagationLeavesDestinationAlone() {
        HeaderSet old = HeaderSet.of(card("OLD", 1L));
        store.put(OUT, HeaderSet.EMPTY).putComponent(OUT, "HEADER", old);
        store.failWrites(OUT);
        try {
            propagator.propagate(RAW, OUT, HeaderSet.of(card("OBJECT", "M1")));
            fail("expected a ContainerIOException");
        } catch (ContainerIOException e) {
            assertEquals(OUT, e.getDestination());
        }
        assertEquals(old, store.component(OUT, "HEADER"));
    }

    @Test
    public void testUnreadableSourceIsReported() {
        store.put(RAW, HeaderSet.EMPTY);
        store.failReads(RAW);
        try {
            propagator.propagate(RAW, OUT, HeaderSet.EMPTY);
            fail("expected a ContainerIOException");
        } catch (ContainerIOException e) {
            assertEquals(RAW, e.getSource());
            assertTrue(e.getCause() instanceof HeaderReadException);
        }
        assertFalse(store.exists(OUT));
    }

    /**
     * Test of prepareOutput method, of class ContainerHeaderPropagator.
     */
    @Test
    public void testPrepareOutput() throws Exception {
        store.put(OUT, HeaderSet.EMPTY)
                .putComponent(OUT, "HEADER", HeaderSet.of(card("OBJECT", "M1")))
                .putComponent(OUT, "I1", HeaderSet.of(card("EXP", 1L)));

        propagator.prepareOutput(RAW, OUT, "I1", HeaderSet.EMPTY);
        assertNull(store.component(OUT, "I1"));
        assertNotNull(store.component(OUT, "HEADER"));

        Path fresh = Paths.get("out", "fresh.sdf");
        propagator.prepareOutput(RAW, fresh, "I1", HeaderSet.of(card("OBJECT", "M1")));
        assertEquals(HeaderSet.of(card("OBJECT", "M1")), store.component(fresh, "HEADER"));
    }

    /**
     * Test of mergeHeaders method, of class ContainerHeaderPropagator.
     */
    @Test
    public void testMergeHeaders() throws Exception {
        store.put(RAW, HeaderSet.EMPTY).putComponent(RAW, "HEADER",
                HeaderSet.of(card("TELESCOP", "UKIRT"), card("OBJECT", "M1")));
        store.put(OUT, HeaderSet.of(card("OBJECT", "M1"), card("OBJECT", "M2"), card("HISTORY", "reduced")));

        HeaderSet merged = propagator.mergeHeaders(RAW, OUT);
        HeaderSet expected = HeaderSet.of(card("TELESCOP", "UKIRT"), card("OBJECT", "M1"),
                card("OBJECT", "M2"), card("HISTORY", "reduced"));
        assertEquals(expected, merged);
        assertEquals(expected, store.primary(OUT));
    }

    /**
     * On a real file a keyword set by both headers keeps the source value,
     * and what is returned is what the file now holds.
     */
    @Test
    public void testMergeHeadersIntoFitsFile() throws Exception {
        FitsHeaderService fits = new FitsHeaderService("HEADER");
        ContainerHeaderPropagator onDisk = new ContainerHeaderPropagator(fits, "HEADER");
        Path source = folder.getRoot().toPath().resolve("raw.fits");
        Path dest = folder.getRoot().toPath().resolve("reduced.fits");
        fits.createContainer(source, "HEADER", HeaderSet.of(card("TELESCOP", "UKIRT"), card("OBJECT", "M1")));
        fits.createContainer(dest, "I1", HeaderSet.of(card("EXP", 1L)));
        fits.writeHeader(dest, HeaderSet.of(card("OBJECT", "M2"), card("HISTORY", "reduced")));

        HeaderSet merged = onDisk.mergeHeaders(source, dest);
        HeaderSet back = fits.readPrimaryHeader(dest);
        assertEquals(3, merged.size());
        assertEquals(merged.size(), back.size());
        assertEquals(Arrays.<Object>asList("M1"), merged.values("OBJECT"));
        assertEquals(Arrays.<Object>asList("M1"), back.values("OBJECT"));
        assertEquals("UKIRT", back.value("TELESCOP"));
        assertEquals("reduced", back.value("HISTORY"));
    }

    @Test(expected = ContainerIOException.class)
    public void testMergeHeadersNeedsSourceHeader() throws Exception {
        store.put(RAW, HeaderSet.EMPTY);
        store.put(OUT, HeaderSet.EMPTY);
        propagator.mergeHeaders(RAW, OUT);
    }

    @Test
    public void testCopyHeader() throws Exception {
        store.put(RAW, HeaderSet.EMPTY).putComponent(RAW, "HEADER", HeaderSet.of(card("OBJECT", "M1")));
        store.put(OUT, HeaderSet.of(card("OLD", 1L)));

        propagator.copyHeader(RAW, OUT);
        assertEquals(HeaderSet.of(card("OBJECT", "M1")), store.primary(OUT));
    }
}
