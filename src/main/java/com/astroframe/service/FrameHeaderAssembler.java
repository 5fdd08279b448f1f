package com.astroframe.service;

import com.astroframe.model.AssembledHeader;
import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderConflict;
import com.astroframe.model.HeaderSet;
import com.astroframe.model.MergeOptions;
import com.astroframe.model.MergeResult;
import com.astroframe.model.PipelineConfig;
import com.astroframe.model.SubHeader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the header of a frame from its raw files: one primary header holding
 * what every file (and every component inside a file) agrees on, plus the
 * sub-headers with whatever differs.
 */
public class FrameHeaderAssembler {

    private static final Logger LOG = Logger.getLogger(FrameHeaderAssembler.class.getName());

    private final HeaderStore store;
    private final HeaderMerger merger;
    private final String headerComponent;

    public FrameHeaderAssembler(HeaderStore store) {
        this(store, PipelineConfig.getHeaderComponent());
    }

    public FrameHeaderAssembler(HeaderStore store, String headerComponent) {
        this(store, new HeaderMerger(), headerComponent);
    }

    public FrameHeaderAssembler(HeaderStore store, HeaderMerger merger, String headerComponent) {
        this.store = store;
        this.merger = merger;
        this.headerComponent = headerComponent;
    }

    // Per-file state between the folding steps
    private static class FileHeaders {
        final Path file;
        HeaderSet primary;
        HeaderSet componentCommon = HeaderSet.EMPTY;
        List<String> componentNames = Collections.emptyList();
        List<HeaderSet> componentDiffs = Collections.emptyList();

        FileHeaders(Path file) {
            this.file = file;
        }

        boolean hasComponents() {
            return !componentNames.isEmpty();
        }
    }

    public AssembledHeader assemble(List<Path> rawFiles) {
        if (rawFiles == null || rawFiles.isEmpty()) {
            throw new IllegalArgumentException("Asked to read headers from zero files");
        }

        List<HeaderConflict> conflicts = new ArrayList<>();
        List<FileHeaders> files = new ArrayList<>();

        // 1. Read every file and fold its components into its primary header
        for (Path f : rawFiles) {
            FileHeaders fh = read(f);
            if (fh.hasComponents()) foldComponents(fh, conflicts);
            files.add(fh);
        }

        // 2. Fold the primaries of all files together
        List<HeaderSet> primaries = new ArrayList<>(files.size());
        for (FileHeaders fh : files) primaries.add(fh.primary);
        MergeResult global = merger.merge(primaries, MergeOptions.forceReturnDiffs());

        // 3. Component cards first, then the file level residual
        List<SubHeader> subs = new ArrayList<>();
        boolean anyCards = false;
        for (int i = 0; i < files.size(); i++) {
            FileHeaders fh = files.get(i);
            HeaderSet fileResidual = global.residual(i);
            if (fh.hasComponents()) {
                for (int j = 0; j < fh.componentNames.size(); j++) {
                    HeaderSet sub = fh.componentDiffs.get(j).append(fileResidual);
                    anyCards |= !sub.isEmpty();
                    subs.add(new SubHeader(fh.componentNames.get(j), sub));
                }
            } else {
                anyCards |= !fileResidual.isEmpty();
                subs.add(new SubHeader(fileName(fh.file), fileResidual));
            }
        }

        if (!anyCards) subs.clear();
        LOG.fine(String.format("Assembled header from %d file(s): %d primary cards, %d sub-headers",
                files.size(), global.common.size(), subs.size()));
        return new AssembledHeader(global.common, subs, conflicts);
    }

    public AssembledHeader assemble(Path... rawFiles) {
        List<Path> list = new ArrayList<>();
        Collections.addAll(list, rawFiles);
        return assemble(list);
    }

    // One read per file; an unreadable file counts as an empty header
    private FileHeaders read(Path f) {
        FileHeaders fh = new FileHeaders(f);
        ContainerHeaders all = readOrNull(f);
        if (all == null) {
            fh.primary = HeaderSet.EMPTY;
            return fh;
        }
        fh.primary = all.primary;

        List<String> names = all.nestedComponentNames(headerComponent);
        if (names.isEmpty()) return fh;

        List<HeaderSet> nested = new ArrayList<>(names.size());
        for (String name : names) nested.add(all.component(name));

        MergeResult inner = merger.merge(nested, MergeOptions.forceReturnDiffs());
        fh.componentNames = names;
        fh.componentDiffs = inner.residuals;
        fh.componentCommon = inner.common;
        return fh;
    }

    private ContainerHeaders readOrNull(Path f) {
        try {
            return store.readHeaders(f);
        } catch (HeaderReadException e) {
            LOG.warning("Error reading FITS header of " + f + ", using an empty header: " + e.getMessage());
            return null;
        }
    }

    /*
     * Merges the cards shared by all components into the primary header.
     * Cards whose keyword is set differently in the two places are left over
     * by the merge: the primary's card is kept, the component's is reported.
     */
    private void foldComponents(FileHeaders fh, List<HeaderConflict> conflicts) {
        MergeResult folded = merger.merge(MergeOptions.mergeUnique(), fh.primary, fh.componentCommon);
        HeaderSet funique = folded.residual(0);
        HeaderSet cunique = folded.residual(1);

        for (HeaderCard discarded : cunique) {
            HeaderCard kept = funique.card(discarded.getKeyword());
            if (kept == null) kept = folded.common.card(discarded.getKeyword());
            if (kept != null && kept.valueString().equals(discarded.valueString())) {
                // same value, only the comment differs
                LOG.fine(fileName(fh.file) + ": keeping " + kept.cardText() + " over " + discarded.cardText());
                continue;
            }
            HeaderConflict conflict = new HeaderConflict(discarded.getKeyword(), kept, discarded, fileName(fh.file));
            conflicts.add(conflict);
            LOG.warning(conflict.describe());
        }

        // primary cards stay in place, promoted component cards go after them
        Set<HeaderCard> inPrimary = new HashSet<>(fh.primary.cards());
        HeaderSet.Builder promoted = HeaderSet.builder();
        for (HeaderCard c : folded.common) {
            if (!inPrimary.contains(c)) promoted.add(c);
        }
        fh.primary = fh.primary.append(promoted.build());
    }

    private static String fileName(Path f) {
        Path name = f.getFileName();
        return (name == null) ? f.toString() : name.toString();
    }

    /**
     * For a single container, no merging: the shared header component (or the
     * biggest component when there is none) becomes the primary header and
     * every other component becomes a sub-header of its own name.
     */
    public AssembledHeader assembleUnmerged(Path container) {
        ContainerHeaders all = readOrNull(container);
        if (all == null) {
            return new AssembledHeader(HeaderSet.EMPTY, Collections.<SubHeader>emptyList(),
                    Collections.<HeaderConflict>emptyList());
        }
        List<String> names = all.componentNames();
        if (names.isEmpty()) {
            return new AssembledHeader(all.primary, Collections.<SubHeader>emptyList(),
                    Collections.<HeaderConflict>emptyList());
        }

        List<SubHeader> comps = new ArrayList<>();
        for (String n : names) comps.add(new SubHeader(n, all.component(n)));

        SubHeader primary = null;
        for (SubHeader s : comps) {
            if (s.name.equalsIgnoreCase(headerComponent)) {
                primary = s;
                break;
            }
        }
        if (primary == null) {
            for (SubHeader s : comps) {
                if (primary == null || s.header.size() > primary.header.size()) primary = s;
            }
        }

        comps.remove(primary);
        comps.sort(Comparator.comparing((SubHeader s) -> s.name));
        return new AssembledHeader(primary.header, comps, Collections.<HeaderConflict>emptyList());
    }
}
