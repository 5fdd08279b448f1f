package com.astroframe.frame;

import com.astroframe.model.AssembledHeader;
import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderConflict;
import com.astroframe.model.HeaderSet;
import com.astroframe.model.PipelineConfig;
import com.astroframe.model.SubHeader;
import com.astroframe.service.ContainerHeaderPropagator;
import com.astroframe.service.ContainerIOException;
import com.astroframe.service.FitsHeaderService;
import com.astroframe.service.FrameHeaderAssembler;
import com.astroframe.service.HeaderReadException;
import com.astroframe.service.HeaderStore;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One observation as seen by the pipeline: the raw files it came from, the
 * files it currently points at, and its merged header. Instrument specifics
 * come entirely from the {@link InstrumentConfig}.
 */
public class Frame {

    private static final Logger LOG = Logger.getLogger(Frame.class.getName());

    public static final String KEY_ORACUT = "ORACUT";
    public static final String KEY_ORACTIME = "ORACTIME";

    private static final DateTimeFormatter PROCVERS_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)(\\.\\w+)?$");
    // Raw observation files end in _<digits>; their headers are never rewritten
    private static final Pattern RAW_NAME = Pattern.compile("_(\\d)+$");

    private final InstrumentConfig config;
    private final HeaderStore store;
    private final HeaderTranslator translator;
    private final FrameHeaderAssembler assembler;
    private final ContainerHeaderPropagator propagator;

    private List<Path> rawFiles = Collections.emptyList();
    private List<Path> files = Collections.emptyList();
    private HeaderSet header = HeaderSet.EMPTY;
    private List<SubHeader> subHeaders = Collections.emptyList();
    private List<HeaderConflict> conflicts = Collections.emptyList();
    private final Map<String, Object> uhdr = new LinkedHashMap<>();

    private String group;
    private String recipe;
    private int nsubs = 1;
    private String product;

    public Frame(InstrumentConfig config) {
        this(config, new FitsHeaderService());
    }

    public Frame(InstrumentConfig config, HeaderStore store) {
        this(config, store, PipelineConfig.getHeaderComponent());
    }

    public Frame(InstrumentConfig config, HeaderStore store, String headerComponent) {
        this.config = config;
        this.store = store;
        this.translator = new HeaderTranslator(config);
        this.assembler = new FrameHeaderAssembler(store, headerComponent);
        this.propagator = new ContainerHeaderPropagator(store, headerComponent);
    }

    // --- CONFIGURATION ---

    /** Points the frame at its raw files and derives everything else from their headers. */
    public void configure(List<Path> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("A frame needs at least one raw file");
        }
        this.rawFiles = Collections.unmodifiableList(new ArrayList<>(raw));
        this.files = new ArrayList<>(raw);
        readhdr();
        findGroup();
        findRecipe();
        findNsubs();
        LOG.fine(String.format("Configured %s frame %d from %d file(s): group=%s recipe=%s nsubs=%d",
                config.getName(), number(), raw.size(), group, recipe, nsubs));
    }

    /** Re-reads the headers of the current files. */
    public void readhdr() {
        readhdr(true);
    }

    /**
     * Re-reads the headers of the current files. Without merging, the first
     * file is read as a single container: its shared header component becomes
     * the frame header and every other component a sub-header, as stored.
     */
    public void readhdr(boolean merge) {
        if (files.isEmpty()) {
            throw new IllegalStateException("Frame has no files to read headers from");
        }
        AssembledHeader assembled = merge ? assembler.assemble(files) : assembler.assembleUnmerged(files.get(0));
        this.header = assembled.primary;
        this.subHeaders = assembled.subHeaders;
        this.conflicts = assembled.conflicts;
        uhdr.clear();
        calcOracHeaders();
    }

    /**
     * Fills the translated headers and derives the two time keys: ORACUT is
     * the UT date as YYYYMMDD, ORACTIME the UT date plus the fraction of the
     * day at the start of the observation.
     */
    public Map<String, Object> calcOracHeaders() {
        uhdr.putAll(translator.translate(header));

        double utdate = toDouble(uhdr.get("ORAC_UTDATE"));
        double utstart = toDouble(uhdr.get("ORAC_UTSTART"));
        long oracut = (long) utdate;
        double oractime = utdate + utstart / 24.0;

        header = header.with(KEY_ORACUT, oracut).with(KEY_ORACTIME, oractime);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put(KEY_ORACUT, oracut);
        out.put(KEY_ORACTIME, oractime);
        return out;
    }

    public String findGroup() {
        Object g = translateHdr("GROUP");
        if (g == null) g = header.value("GRPNUM");
        group = (g == null) ? null : g.toString();
        return group;
    }

    public String findRecipe() {
        Object r = translateHdr("DR_RECIPE");
        if (isBlank(r)) r = translateHdr("RECIPE");
        if (isBlank(r)) r = header.value("RECIPE");
        recipe = isBlank(r) ? PipelineConfig.getDefaultRecipe() : r.toString().trim();
        return recipe;
    }

    public int findNsubs() {
        Object n = header.value("N_SUBS");
        int found = (n instanceof Number) ? ((Number) n).intValue() : subHeaders.size();
        nsubs = Math.max(1, found);
        return nsubs;
    }

    // --- HEADER ACCESS ---

    public HeaderSet getHeader() {
        return header;
    }

    public Object getHeader(String keyword) {
        return header.value(keyword);
    }

    public void setHeader(String keyword, Object value) {
        header = header.with(keyword, value);
    }

    public List<SubHeader> getSubHeaders() {
        return subHeaders;
    }

    /**
     * Value from a sub-header, falling back to the primary header when the
     * sub-header does not set it or does not exist. A frame whose files all
     * carry the same header has no sub-headers at all.
     */
    public Object getSubHeader(int index, String keyword) {
        if (index >= 0 && index < subHeaders.size()) {
            Object v = subHeaders.get(index).header.value(keyword);
            if (v != null) return v;
        }
        return header.value(keyword);
    }

    public Object getSubHeader(String name, String keyword) {
        for (int i = 0; i < subHeaders.size(); i++) {
            if (subHeaders.get(i).name.equalsIgnoreCase(name)) return getSubHeader(i, keyword);
        }
        return null;
    }

    public List<HeaderConflict> getConflicts() {
        return conflicts;
    }

    public Object getUhdr(String key) {
        return uhdr.get(key);
    }

    public void setUhdr(String key, Object value) {
        uhdr.put(key, value);
    }

    public Map<String, Object> getUhdr() {
        return Collections.unmodifiableMap(uhdr);
    }

    /** Generic value for a name with or without the ORAC_ prefix. */
    public Object translateHdr(String genericName) {
        String key = InstrumentConfig.GENERIC_PREFIX + InstrumentConfig.canonical(genericName);
        if (uhdr.containsKey(key)) return uhdr.get(key);
        return translator.value(header, genericName);
    }

    // --- OUTPUT HEADERS ---

    /**
     * The cards every output written from this frame should carry, or null
     * when the file does not exist.
     */
    public HeaderSet collateHeaders(Path file) {
        if (file == null || !store.exists(file)) return null;

        HeaderSet.Builder out = HeaderSet.builder();
        out.add(HeaderCard.of("PIPEVERS", PipelineConfig.getPipelineVersion(), "Pipeline version"));
        out.add(HeaderCard.of("ENGVERS", PipelineConfig.getEngineVersion(), "Algorithm engine version"));

        LocalDateTime pipeDate = PipelineConfig.getPipelineCommitDate();
        LocalDateTime engineDate = PipelineConfig.getEngineCommitDate();
        String procvers = null;
        if (pipeDate != null && engineDate != null) {
            LocalDateTime latest = engineDate.isAfter(pipeDate) ? engineDate : pipeDate;
            procvers = latest.format(PROCVERS_FORMAT);
        } else {
            List<String> missing = new ArrayList<>();
            if (pipeDate == null) missing.add("pipeline");
            if (engineDate == null) missing.add("engine");
            LOG.warning("Problem reading " + String.join(" and ", missing) + " version information");
        }
        out.add(HeaderCard.of("PROCVERS", procvers, "Date of most recent commit"));

        if (product != null) {
            out.add(HeaderCard.of("PRODUCT", product, "Pipeline product identifier"));
        }

        Object drRecipe = uhdr.get(InstrumentConfig.GENERIC_PREFIX + "DR_RECIPE");
        if (drRecipe != null) {
            for (Map.Entry<String, Object> e : translator.toFits("DR_RECIPE", drRecipe).entrySet()) {
                HeaderCard existing = header.card(e.getKey());
                // only rewrite a card the raw header already has, keeping its comment
                if (existing != null) out.add(existing.withValue(e.getValue()));
            }
        }
        return out.build();
    }

    /**
     * Writes the collated headers into every current file that allows it.
     * Raw files, named with a trailing {@code _<number>}, are left alone.
     */
    public void syncHeaders() {
        for (int i = 0; i < files.size(); i++) syncHeaders(i);
    }

    public void syncHeaders(int index) {
        if (!PipelineConfig.isHeaderSyncAllowed()) {
            LOG.fine("Header synchronisation disabled");
            return;
        }
        Path file = files.get(index);
        if (isRawName(file)) {
            LOG.fine("Not synchronising header of raw file " + file);
            return;
        }
        HeaderSet collated = collateHeaders(file);
        if (collated == null) return;
        try {
            HeaderSet current = store.readPrimaryHeader(file);
            store.writeHeader(file, current.appendReplacing(collated));
        } catch (HeaderReadException | ContainerIOException e) {
            LOG.log(Level.SEVERE, "Unable to synchronise header of " + file, e);
        }
    }

    /**
     * Propagates the shared container header from {@code source} to
     * {@code dest}. A failure is logged and reported as false; the frame
     * itself is left untouched either way.
     */
    public boolean propagateHeader(Path source, Path dest) {
        try {
            propagator.propagate(source, dest, header);
            return true;
        } catch (ContainerIOException e) {
            LOG.log(Level.SEVERE, "Header propagation failed: " + e.getMessage(), e);
            return false;
        }
    }

    public ContainerHeaderPropagator getPropagator() {
        return propagator;
    }

    // --- FILES ---

    /** Observation number from the trailing digits of the first raw file name, -1 if there are none. */
    public int number() {
        if (rawFiles.isEmpty()) return -1;
        Path name = rawFiles.get(0).getFileName();
        if (name == null) return -1;
        Matcher m = TRAILING_NUMBER.matcher(name.toString());
        if (!m.find()) return -1;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public List<Path> getRawFiles() { return rawFiles; }
    public List<Path> getFiles() { return Collections.unmodifiableList(files); }

    public Path getFile(int index) {
        return files.get(index);
    }

    public void setFile(int index, Path file) {
        files.set(index, file);
    }

    public InstrumentConfig getConfig() { return config; }
    public String getGroup() { return group; }
    public String getRecipe() { return recipe; }
    public int getNsubs() { return nsubs; }
    public String getProduct() { return product; }
    public void setProduct(String product) { this.product = product; }

    static boolean isRawName(Path file) {
        Path name = file.getFileName();
        if (name == null) return false;
        String base = name.toString();
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        return RAW_NAME.matcher(base).find();
    }

    private static boolean isBlank(Object o) {
        return o == null || o.toString().trim().isEmpty();
    }

    private static double toDouble(Object o) {
        if (o instanceof Number) return ((Number) o).doubleValue();
        if (o == null) return 0.0;
        try {
            return Double.parseDouble(o.toString().trim());
        } catch (NumberFormatException e) {
            LOG.warning("Not a number: '" + o + "', using 0");
            return 0.0;
        }
    }
}
