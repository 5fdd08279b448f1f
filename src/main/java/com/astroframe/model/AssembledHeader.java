package com.astroframe.model;

import java.util.Collections;
import java.util.List;

public class AssembledHeader {

    public final HeaderSet primary;
    public final List<SubHeader> subHeaders;
    public final List<HeaderConflict> conflicts;

    public AssembledHeader(HeaderSet primary, List<SubHeader> subHeaders, List<HeaderConflict> conflicts) {
        this.primary = primary;
        this.subHeaders = Collections.unmodifiableList(subHeaders);
        this.conflicts = Collections.unmodifiableList(conflicts);
    }

    public boolean hasSubHeaders() {
        return !subHeaders.isEmpty();
    }
}
