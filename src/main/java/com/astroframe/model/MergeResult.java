package com.astroframe.model;

import java.util.Collections;
import java.util.List;

public class MergeResult {

    public static final MergeResult EMPTY = new MergeResult(HeaderSet.EMPTY, Collections.<HeaderSet>emptyList());

    public final HeaderSet common;
    public final List<HeaderSet> residuals; // one per input, or none at all

    public MergeResult(HeaderSet common, List<HeaderSet> residuals) {
        this.common = common;
        this.residuals = Collections.unmodifiableList(residuals);
    }

    public boolean hasDifferences() {
        for (HeaderSet r : residuals) {
            if (!r.isEmpty()) return true;
        }
        return false;
    }

    public HeaderSet residual(int index) {
        return (index < residuals.size()) ? residuals.get(index) : HeaderSet.EMPTY;
    }
}
