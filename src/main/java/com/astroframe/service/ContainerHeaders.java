package com.astroframe.service;

import com.astroframe.model.HeaderSet;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Every header of one container, read in a single pass: the container's own
 * primary header and the header of each named component, in file order.
 */
public class ContainerHeaders {

    public final Path file;
    public final HeaderSet primary;
    private final Map<String, HeaderSet> components;

    public ContainerHeaders(Path file, HeaderSet primary, Map<String, HeaderSet> components) {
        this.file = file;
        this.primary = primary;
        Map<String, HeaderSet> copy = new LinkedHashMap<>();
        for (Map.Entry<String, HeaderSet> e : components.entrySet()) copy.put(key(e.getKey()), e.getValue());
        this.components = Collections.unmodifiableMap(copy);
    }

    public List<String> componentNames() {
        return new ArrayList<>(components.keySet());
    }

    /** Component names other than the shared header component. */
    public List<String> nestedComponentNames(String headerComponent) {
        List<String> out = new ArrayList<>();
        for (String name : components.keySet()) {
            if (!name.equals(key(headerComponent))) out.add(name);
        }
        return out;
    }

    /** Null when there is no such component. */
    public HeaderSet component(String name) {
        return components.get(key(name));
    }

    private static String key(String name) {
        return (name == null) ? "" : name.trim().toUpperCase(Locale.ROOT);
    }
}
