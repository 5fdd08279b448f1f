package com.astroframe.frame;

import com.astroframe.model.HeaderSet;

/** Computes one generic header value from an instrument's raw header. Null when it cannot. */
@FunctionalInterface
public interface HeaderTranslation {
    Object toGeneric(HeaderSet raw);
}
