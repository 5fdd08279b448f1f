package com.astroframe.model;

/**
 * A keyword that carried different values in two headers that were expected
 * to agree. The kept card is the one the pipeline continues with.
 */
public class HeaderConflict {

    public final String keyword;
    public final HeaderCard keptCard;
    public final HeaderCard discardedCard;
    public final String source;

    public HeaderConflict(String keyword, HeaderCard keptCard, HeaderCard discardedCard, String source) {
        this.keyword = keyword;
        this.keptCard = keptCard;
        this.discardedCard = discardedCard;
        this.source = source;
    }

    public String describe() {
        return String.format("%s: header conflict for %s (kept '%s', ignored '%s')",
                source, keyword,
                keptCard == null ? "" : keptCard.valueString(),
                discardedCard == null ? "" : discardedCard.valueString());
    }

    @Override
    public String toString() {
        return describe();
    }
}
