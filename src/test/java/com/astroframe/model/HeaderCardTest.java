package com.astroframe.model;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the HeaderCard class.
 */
public class HeaderCardTest {

    @Test
    public void testKeywordIsNormalized() {
        HeaderCard card = HeaderCard.of(" object ", "M31", "");
        assertEquals("OBJECT", card.getKeyword());
    }

    /**
     * Test of parse method, of class HeaderCard.
     */
    @Test
    public void testParse() {
        assertEquals(CardType.LOGICAL, HeaderCard.parse("SIMPLE", "T", "", false).getType());
        assertEquals(Boolean.FALSE, HeaderCard.parse("FLAG", "F", "", false).getValue());

        HeaderCard i = HeaderCard.parse("OBSNUM", "42", "", false);
        assertEquals(CardType.INT, i.getType());
        assertEquals(42L, i.getValue());

        HeaderCard f = HeaderCard.parse("EXP_TIME", "1.5D+01", "", false);
        assertEquals(CardType.FLOAT, f.getType());
        assertEquals(15.0, ((Number) f.getValue()).doubleValue(), 1e-12);

        // quoted digits stay a string
        HeaderCard s = HeaderCard.parse("UTDATE", "20240101", "", true);
        assertEquals(CardType.STRING, s.getType());
        assertEquals("20240101", s.getValue());
    }

    @Test
    public void testIdentityIsTextual() {
        HeaderCard a = HeaderCard.of("AIRMASS", 1.2, "start");
        HeaderCard b = HeaderCard.parse("AIRMASS", "1.2", "start", false);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        assertNotEquals(a, HeaderCard.of("AIRMASS", 1.2, "end"));
        assertNotEquals(a, HeaderCard.of("AIRMASS", 1.3, "start"));
        // same text, different type: still the same card
        assertEquals(HeaderCard.of("N", "3", ""), HeaderCard.of("N", 3L, ""));
    }

    @Test
    public void testCommentary() {
        assertTrue(HeaderCard.of("HISTORY", "reduced", "").isCommentary());
        assertTrue(HeaderCard.of("COMMENT", "x", "").isCommentary());
        assertTrue(HeaderCard.of("", "spacer", "").isCommentary());
        assertFalse(HeaderCard.of("OBJECT", "x", "").isCommentary());
    }

    @Test
    public void testWithValue() {
        HeaderCard card = HeaderCard.of("RECIPE", "QUICK_LOOK", "Recipe name");
        HeaderCard changed = card.withValue(7L);
        assertEquals(CardType.INT, changed.getType());
        assertEquals("Recipe name", changed.getComment());
        assertEquals("RECIPE = 7 / Recipe name", changed.cardText());
    }

    @Test
    public void testCardText() {
        assertEquals("OBJECT = 'M1'", HeaderCard.of("OBJECT", "M1").cardText());
        assertEquals("SIMPLE = T / conforms", HeaderCard.of("SIMPLE", true, "conforms").cardText());
        assertEquals("HISTORY flat fielded", HeaderCard.of("HISTORY", "flat fielded", "").cardText());
    }
}
