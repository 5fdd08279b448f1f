package com.astroframe.model;

public class MergeOptions {

    public static final MergeOptions DEFAULT = new MergeOptions(false, false);

    // Promote cards found in exactly one input into the common header
    public final boolean mergeUnique;
    // Always return one residual per input, even when they are all empty
    public final boolean forceReturnDiffs;

    public MergeOptions(boolean mergeUnique, boolean forceReturnDiffs) {
        this.mergeUnique = mergeUnique;
        this.forceReturnDiffs = forceReturnDiffs;
    }

    public static MergeOptions mergeUnique() { return new MergeOptions(true, false); }
    public static MergeOptions forceReturnDiffs() { return new MergeOptions(false, true); }

    @Override
    public String toString() {
        return "MergeOptions[mergeUnique=" + mergeUnique + ", forceReturnDiffs=" + forceReturnDiffs + "]";
    }
}
