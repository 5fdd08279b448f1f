package com.astroframe.service;

import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderSet;
import com.astroframe.model.MergeOptions;
import com.astroframe.model.MergeResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the HeaderMerger class.
 */
public class HeaderMergerTest {

    private final HeaderMerger merger = new HeaderMerger();

    private static HeaderCard card(String k, Object v) {
        return HeaderCard.ofObject(k, v, "");
    }

    // The input, minus one copy of each common card it holds, is exactly its residual.
    private static void assertPartition(HeaderSet input, HeaderSet common, HeaderSet residual) {
        Map<HeaderCard, Integer> expected = counts(input);
        for (HeaderCard c : common) expected.computeIfPresent(c, (k, n) -> n - 1);
        expected.values().removeIf(n -> n == 0);
        assertEquals(expected, counts(residual));
    }

    private static Map<HeaderCard, Integer> counts(HeaderSet h) {
        Map<HeaderCard, Integer> out = new HashMap<>();
        for (HeaderCard c : h) out.merge(c, 1, Integer::sum);
        return out;
    }

    /**
     * Test of merge method, of class HeaderMerger: two identical headers.
     */
    @Test
    public void testIdenticalHeaders() {
        HeaderSet h = HeaderSet.of(card("OBJECT", "M1"), card("FILTER", "K"));
        MergeResult r = merger.merge(h, h);
        assertEquals(h, r.common);
        assertTrue(r.residuals.isEmpty());
        assertFalse(r.hasDifferences());
    }

    @Test
    public void testIdenticalHeadersForcedDiffs() {
        HeaderSet h = HeaderSet.of(card("OBJECT", "M1"), card("FILTER", "K"));
        MergeResult r = merger.merge(MergeOptions.forceReturnDiffs(), h, h);
        assertEquals(h, r.common);
        assertEquals(2, r.residuals.size());
        assertTrue(r.residual(0).isEmpty());
        assertTrue(r.residual(1).isEmpty());
    }

    @Test
    public void testDifferingValue() {
        HeaderSet a = HeaderSet.of(card("OBJECT", "M1"), card("EXPNUM", 1L));
        HeaderSet b = HeaderSet.of(card("OBJECT", "M1"), card("EXPNUM", 2L));
        MergeResult r = merger.merge(a, b);

        assertEquals(HeaderSet.of(card("OBJECT", "M1")), r.common);
        assertEquals(HeaderSet.of(card("EXPNUM", 1L)), r.residual(0));
        assertEquals(HeaderSet.of(card("EXPNUM", 2L)), r.residual(1));
    }

    @Test
    public void testUniqueCardIsPromoted() {
        HeaderSet primary = HeaderSet.of(card("INSTRUME", "X"));
        HeaderSet components = HeaderSet.of(card("DETECTOR", "D1"));
        MergeResult r = merger.merge(MergeOptions.mergeUnique(), primary, components);

        assertEquals(HeaderSet.of(card("INSTRUME", "X"), card("DETECTOR", "D1")), r.common);
        assertFalse(r.hasDifferences());
    }

    @Test
    public void testUniqueCardWithClashingKeywordStaysBehind() {
        HeaderSet primary = HeaderSet.of(card("INSTRUME", "X"), card("A", 2L));
        HeaderSet components = HeaderSet.of(card("INSTRUME", "X"), card("A", 1L));
        MergeResult r = merger.merge(MergeOptions.mergeUnique(), primary, components);

        assertEquals(HeaderSet.of(card("INSTRUME", "X")), r.common);
        assertEquals(HeaderSet.of(card("A", 2L)), r.residual(0));
        assertEquals(HeaderSet.of(card("A", 1L)), r.residual(1));
    }

    @Test
    public void testUniqueCommentaryIsPromotedDespiteKeyword() {
        HeaderSet a = HeaderSet.of(card("HISTORY", "flat"));
        HeaderSet b = HeaderSet.of(card("HISTORY", "dark"));
        MergeResult r = merger.merge(MergeOptions.mergeUnique(), a, b);
        assertEquals(HeaderSet.of(card("HISTORY", "flat"), card("HISTORY", "dark")), r.common);
    }

    @Test
    public void testIdempotence() {
        HeaderSet h = HeaderSet.of(card("OBJECT", "M1"), card("HISTORY", "x"), card("N", 3L), card("FLAG", true));
        MergeResult r = merger.merge(h, h, h);
        assertEquals(h, r.common);
        assertFalse(r.hasDifferences());
    }

    @Test
    public void testOrderFollowsFirstAppearance() {
        HeaderSet a = HeaderSet.of(card("B", 1L), card("X", 1L), card("A", 1L), card("C", 1L));
        HeaderSet b = HeaderSet.of(card("C", 1L), card("A", 1L), card("Y", 1L), card("B", 1L));
        MergeResult r = merger.merge(a, b);

        assertEquals(HeaderSet.of(card("B", 1L), card("A", 1L), card("C", 1L)), r.common);
        assertEquals(HeaderSet.of(card("X", 1L)), r.residual(0));
        assertEquals(HeaderSet.of(card("Y", 1L)), r.residual(1));
    }

    @Test
    public void testOnlyFirstOccurrenceIsTaken() {
        HeaderSet a = HeaderSet.of(card("HISTORY", "x"), card("HISTORY", "x"), card("OBJECT", "M1"));
        HeaderSet b = HeaderSet.of(card("OBJECT", "M1"), card("HISTORY", "x"));
        MergeResult r = merger.merge(a, b);

        assertEquals(HeaderSet.of(card("HISTORY", "x"), card("OBJECT", "M1")), r.common);
        assertEquals(HeaderSet.of(card("HISTORY", "x")), r.residual(0));
        assertTrue(r.residual(1).isEmpty());
    }

    @Test
    public void testPartitionHoldsForEveryInput() {
        List<HeaderSet> inputs = Arrays.asList(
                HeaderSet.of(card("OBJECT", "M1"), card("EXPNUM", 1L), card("HISTORY", "a"), card("AIRMASS", 1.1)),
                HeaderSet.of(card("EXPNUM", 2L), card("OBJECT", "M1"), card("HISTORY", "a"), card("HISTORY", "a")),
                HeaderSet.of(card("HISTORY", "a"), card("OBJECT", "M1"), card("FILTER", "J")));
        for (MergeOptions opts : Arrays.asList(MergeOptions.DEFAULT, MergeOptions.forceReturnDiffs(),
                new MergeOptions(true, true))) {
            MergeResult r = merger.merge(inputs, opts);
            assertEquals(3, r.residuals.size());
            for (int i = 0; i < inputs.size(); i++) {
                assertPartition(inputs.get(i), r.common, r.residual(i));
            }
        }
    }

    @Test
    public void testEmptyAndSingleInput() {
        assertSame(MergeResult.EMPTY, merger.merge(new ArrayList<HeaderSet>(), MergeOptions.DEFAULT));

        HeaderSet h = HeaderSet.of(card("OBJECT", "M1"));
        MergeResult single = merger.merge(h);
        assertEquals(h, single.common);
        assertTrue(single.residuals.isEmpty());

        MergeResult forced = merger.merge(MergeOptions.forceReturnDiffs(), h);
        assertEquals(1, forced.residuals.size());
        assertTrue(forced.residual(0).isEmpty());
    }
}
