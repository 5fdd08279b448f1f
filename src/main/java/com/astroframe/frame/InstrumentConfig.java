package com.astroframe.frame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Everything that makes one instrument's frames different from another's:
 * the raw file name parts and how its FITS keywords map onto the generic
 * header names. Generic names are stored without the ORAC_ prefix.
 */
public class InstrumentConfig {

    public static final String GENERIC_PREFIX = "ORAC_";

    private final String name;
    private final String rawPrefix;
    private final String rawSuffix;
    private final Map<String, String> headerKeywordMap;
    private final Map<String, HeaderTranslation> overrides;

    private InstrumentConfig(Builder b) {
        this.name = b.name;
        this.rawPrefix = b.rawPrefix;
        this.rawSuffix = b.rawSuffix;
        this.headerKeywordMap = Collections.unmodifiableMap(new LinkedHashMap<>(b.headerKeywordMap));
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(b.overrides));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Copy of this configuration to be extended, the way one instrument derives from another. */
    public Builder derive(String newName) {
        Builder b = new Builder(newName).rawPrefix(rawPrefix).rawSuffix(rawSuffix);
        b.headerKeywordMap.putAll(headerKeywordMap);
        b.overrides.putAll(overrides);
        return b;
    }

    public static String canonical(String key) {
        String k = (key == null) ? "" : key.trim().toUpperCase(Locale.ROOT);
        return k.startsWith(GENERIC_PREFIX) ? k.substring(GENERIC_PREFIX.length()) : k;
    }

    public String getName() { return name; }
    public String getRawPrefix() { return rawPrefix; }
    public String getRawSuffix() { return rawSuffix; }
    public Map<String, String> getHeaderKeywordMap() { return headerKeywordMap; }
    public Map<String, HeaderTranslation> getOverrides() { return overrides; }

    /** Raw FITS keyword for a generic name, or null when there is no one-to-one mapping. */
    public String rawKeyword(String genericName) {
        return headerKeywordMap.get(canonical(genericName));
    }

    public HeaderTranslation override(String genericName) {
        return overrides.get(canonical(genericName));
    }

    /** Generic names this instrument can produce, table entries first. */
    public Set<String> genericNames() {
        Set<String> out = new LinkedHashSet<>(headerKeywordMap.keySet());
        out.addAll(overrides.keySet());
        return out;
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Builder {
        private final String name;
        private String rawPrefix = "";
        private String rawSuffix = "";
        private final Map<String, String> headerKeywordMap = new LinkedHashMap<>();
        private final Map<String, HeaderTranslation> overrides = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Instrument name must not be empty");
            }
            this.name = name.trim().toUpperCase(Locale.ROOT);
        }

        public Builder rawPrefix(String v) { this.rawPrefix = (v == null) ? "" : v; return this; }
        public Builder rawSuffix(String v) { this.rawSuffix = (v == null) ? "" : v; return this; }

        public Builder map(String genericName, String rawKeyword) {
            headerKeywordMap.put(canonical(genericName), rawKeyword.trim().toUpperCase(Locale.ROOT));
            return this;
        }

        public Builder override(String genericName, HeaderTranslation translation) {
            overrides.put(canonical(genericName), translation);
            return this;
        }

        public InstrumentConfig build() {
            return new InstrumentConfig(this);
        }
    }
}
