package com.astroframe.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One FITS header entry. Two cards are the same card only when keyword,
 * stringified value and comment all match textually.
 */
public final class HeaderCard {

    private static final Pattern INT_LITERAL = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_LITERAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([EeDd][+-]?\\d+)?");

    private final String keyword;
    private final Object value;
    private final String comment;
    private final CardType type;

    private HeaderCard(String keyword, Object value, String comment, CardType type) {
        this.keyword = normalizeKeyword(keyword);
        this.value = value;
        this.comment = (comment == null) ? "" : comment;
        this.type = type;
    }

    // --- FACTORIES ---
    public static HeaderCard of(String keyword, String value, String comment) {
        return new HeaderCard(keyword, value, comment, CardType.STRING);
    }

    public static HeaderCard of(String keyword, long value, String comment) {
        return new HeaderCard(keyword, value, comment, CardType.INT);
    }

    public static HeaderCard of(String keyword, double value, String comment) {
        return new HeaderCard(keyword, value, comment, CardType.FLOAT);
    }

    public static HeaderCard of(String keyword, boolean value, String comment) {
        return new HeaderCard(keyword, value, comment, CardType.LOGICAL);
    }

    public static HeaderCard of(String keyword, String value) {
        return of(keyword, value, "");
    }

    /**
     * Builds a card from an arbitrary Java value, choosing the card type from
     * the value's class. Anything that is not a number or a boolean is stored
     * as its string form.
     */
    public static HeaderCard ofObject(String keyword, Object value, String comment) {
        if (value instanceof Boolean) return of(keyword, (Boolean) value, comment);
        if (value instanceof Double || value instanceof Float) return of(keyword, ((Number) value).doubleValue(), comment);
        if (value instanceof Number) return of(keyword, ((Number) value).longValue(), comment);
        return of(keyword, value == null ? null : value.toString(), comment);
    }

    /**
     * Builds a card from the raw value text found in a file. Quoted values are
     * always strings; otherwise the literal decides the type.
     */
    public static HeaderCard parse(String keyword, String rawValue, String comment, boolean quoted) {
        if (rawValue == null || quoted) return of(keyword, rawValue, comment);
        String v = rawValue.trim();
        if (v.equals("T")) return of(keyword, true, comment);
        if (v.equals("F")) return of(keyword, false, comment);
        if (INT_LITERAL.matcher(v).matches()) {
            try {
                return of(keyword, Long.parseLong(v), comment);
            } catch (NumberFormatException e) {
                // too long for a long, keep the digits as a float
                return of(keyword, Double.parseDouble(v), comment);
            }
        }
        if (FLOAT_LITERAL.matcher(v).matches()) {
            return of(keyword, Double.parseDouble(v.replace('D', 'E').replace('d', 'e')), comment);
        }
        return of(keyword, rawValue, comment);
    }

    public static String normalizeKeyword(String keyword) {
        return (keyword == null) ? "" : keyword.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isCommentaryKeyword(String keyword) {
        String k = normalizeKeyword(keyword);
        return k.isEmpty() || k.equals("COMMENT") || k.equals("HISTORY");
    }

    // --- ACCESSORS ---
    public String getKeyword() { return keyword; }
    public Object getValue() { return value; }
    public String getComment() { return comment; }
    public CardType getType() { return type; }

    public boolean isCommentary() { return isCommentaryKeyword(keyword); }

    public String valueString() {
        if (value == null) return "";
        switch (type) {
            case LOGICAL: return ((Boolean) value) ? "T" : "F";
            case FLOAT: return Double.toString(((Number) value).doubleValue());
            default: return value.toString();
        }
    }

    /** Same comment, new value. The type follows the new value. */
    public HeaderCard withValue(Object newValue) {
        return ofObject(keyword, newValue, comment);
    }

    /** Single-line rendering of the merge identity. */
    public String cardText() {
        StringBuilder sb = new StringBuilder(keyword);
        if (!isCommentary()) sb.append(" = ");
        else sb.append(' ');
        if (type == CardType.STRING && !isCommentary()) sb.append('\'').append(valueString()).append('\'');
        else sb.append(valueString());
        if (!comment.isEmpty()) sb.append(" / ").append(comment);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeaderCard)) return false;
        HeaderCard other = (HeaderCard) o;
        return keyword.equals(other.keyword)
                && valueString().equals(other.valueString())
                && comment.equals(other.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, valueString(), comment);
    }

    @Override
    public String toString() {
        return cardText();
    }
}
