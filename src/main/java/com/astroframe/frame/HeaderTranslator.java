package com.astroframe.frame;

import com.astroframe.model.HeaderSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Looks generic header values up through an instrument's keyword table.
 * An override registered for a generic name always wins over the table.
 */
public class HeaderTranslator {

    private final InstrumentConfig config;

    public HeaderTranslator(InstrumentConfig config) {
        this.config = config;
    }

    public InstrumentConfig getConfig() {
        return config;
    }

    public Object value(HeaderSet raw, String genericName) {
        HeaderTranslation t = config.override(genericName);
        if (t != null) return t.toGeneric(raw);
        String keyword = config.rawKeyword(genericName);
        return (keyword == null) ? null : raw.value(keyword);
    }

    /** ORAC_ prefixed name to value, for every generic name the header can give. */
    public Map<String, Object> translate(HeaderSet raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String name : config.genericNames()) {
            Object v = value(raw, name);
            if (v != null) out.put(InstrumentConfig.GENERIC_PREFIX + name, v);
        }
        return out;
    }

    /**
     * Reverse lookup: the raw FITS keyword and value to write for a generic
     * value. Only one-to-one table entries can be reversed; a name with an
     * override is derived, not copied, so it has none.
     */
    public Map<String, Object> toFits(String genericName, Object value) {
        if (config.override(genericName) != null) return Collections.emptyMap();
        String keyword = config.rawKeyword(genericName);
        if (keyword == null) return Collections.emptyMap();
        return Collections.singletonMap(keyword, value);
    }
}
