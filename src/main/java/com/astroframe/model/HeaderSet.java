package com.astroframe.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered, immutable FITS header. Keywords are allowed to repeat and card
 * order is kept because it matters when the header is written back to a file.
 * All "modifying" methods return a new set.
 */
public final class HeaderSet implements Iterable<HeaderCard> {

    public static final HeaderSet EMPTY = new HeaderSet(Collections.<HeaderCard>emptyList());

    private final List<HeaderCard> cards;

    private HeaderSet(List<HeaderCard> cards) {
        this.cards = Collections.unmodifiableList(cards);
    }

    public static HeaderSet of(HeaderCard... cards) {
        Builder b = builder();
        for (HeaderCard c : cards) b.add(c);
        return b.build();
    }

    public static HeaderSet of(Collection<HeaderCard> cards) {
        return builder().addAll(cards).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- QUERIES ---
    public int size() { return cards.size(); }
    public boolean isEmpty() { return cards.isEmpty(); }
    public List<HeaderCard> cards() { return cards; }
    public HeaderCard get(int index) { return cards.get(index); }

    @Override
    public Iterator<HeaderCard> iterator() {
        return cards.iterator();
    }

    /** Distinct keywords in order of first appearance. */
    public Set<String> keywords() {
        Set<String> out = new LinkedHashSet<>();
        for (HeaderCard c : cards) out.add(c.getKeyword());
        return out;
    }

    public HeaderCard card(String keyword) {
        String k = HeaderCard.normalizeKeyword(keyword);
        for (HeaderCard c : cards) {
            if (c.getKeyword().equals(k)) return c;
        }
        return null;
    }

    public boolean contains(String keyword) {
        return card(keyword) != null;
    }

    /** Value of the first card carrying the keyword, or null. */
    public Object value(String keyword) {
        HeaderCard c = card(keyword);
        return (c == null) ? null : c.getValue();
    }

    public List<Object> values(String keyword) {
        String k = HeaderCard.normalizeKeyword(keyword);
        List<Object> out = new ArrayList<>();
        for (HeaderCard c : cards) {
            if (c.getKeyword().equals(k)) out.add(c.getValue());
        }
        return out;
    }

    // --- DERIVED SETS ---
    public HeaderSet append(HeaderSet other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        return builder().addAll(cards).addAll(other.cards).build();
    }

    public HeaderSet append(HeaderCard... extra) {
        return append(of(extra));
    }

    /**
     * Appends the other header, but a non-commentary card whose keyword is
     * already present replaces the first existing card in place.
     */
    public HeaderSet appendReplacing(HeaderSet other) {
        List<HeaderCard> out = new ArrayList<>(cards);
        for (HeaderCard c : other) {
            int idx = c.isCommentary() ? -1 : indexOf(out, c.getKeyword());
            if (idx >= 0) out.set(idx, c);
            else out.add(c);
        }
        return new HeaderSet(out);
    }

    /**
     * Sets a keyword: the first card with that keyword gets the new value
     * (comment kept), or a new card is appended.
     */
    public HeaderSet with(String keyword, Object value) {
        List<HeaderCard> out = new ArrayList<>(cards);
        int idx = indexOf(out, keyword);
        if (idx >= 0) out.set(idx, out.get(idx).withValue(value));
        else out.add(HeaderCard.ofObject(keyword, value, ""));
        return new HeaderSet(out);
    }

    public HeaderSet without(String keyword) {
        String k = HeaderCard.normalizeKeyword(keyword);
        List<HeaderCard> out = new ArrayList<>(cards.size());
        for (HeaderCard c : cards) {
            if (!c.getKeyword().equals(k)) out.add(c);
        }
        return (out.size() == cards.size()) ? this : new HeaderSet(out);
    }

    private static int indexOf(List<HeaderCard> list, String keyword) {
        String k = HeaderCard.normalizeKeyword(keyword);
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getKeyword().equals(k)) return i;
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeaderSet)) return false;
        return cards.equals(((HeaderSet) o).cards);
    }

    @Override
    public int hashCode() {
        return cards.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (HeaderCard c : cards) sb.append(c.cardText()).append('\n');
        return sb.toString();
    }

    public static final class Builder {
        private final List<HeaderCard> cards = new ArrayList<>();

        private Builder() { }

        public Builder add(HeaderCard card) {
            if (card == null) throw new IllegalArgumentException("Header card must not be null");
            cards.add(card);
            return this;
        }

        public Builder add(String keyword, Object value, String comment) {
            return add(HeaderCard.ofObject(keyword, value, comment));
        }

        public Builder addAll(Iterable<HeaderCard> more) {
            for (HeaderCard c : more) add(c);
            return this;
        }

        public int size() { return cards.size(); }

        public HeaderSet build() {
            return cards.isEmpty() ? EMPTY : new HeaderSet(new ArrayList<>(cards));
        }
    }
}
