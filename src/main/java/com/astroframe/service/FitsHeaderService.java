package com.astroframe.service;

import com.astroframe.model.HeaderCard;
import com.astroframe.model.HeaderSet;
import com.astroframe.model.PipelineConfig;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link HeaderStore} over multi-extension FITS files. HDU 0 holds the
 * primary header, every extension is a component named by its EXTNAME and the
 * extension named after the shared header component stands for the container
 * header. Rewrites always go through a temporary file that is moved over the
 * original, so a failed write never leaves a half-written container behind.
 * String values longer than one card are kept with the CONTINUE convention.
 * A FITS header holds one value per keyword: when a header with a repeated
 * keyword is written the first card is kept and the others are dropped with a
 * warning.
 */
public class FitsHeaderService implements HeaderStore {

    private static final Logger LOG = Logger.getLogger(FitsHeaderService.class.getName());

    // Owned by the FITS layer, never part of a HeaderSet
    private static final Set<String> STRUCTURAL = new HashSet<>(Arrays.asList(
            "SIMPLE", "XTENSION", "BITPIX", "EXTEND", "PCOUNT", "GCOUNT", "EXTNAME", "END"));

    static {
        FitsFactory.setLongStringsEnabled(true);
    }

    private final String headerComponent;

    public FitsHeaderService() {
        this(PipelineConfig.getHeaderComponent());
    }

    public FitsHeaderService(String headerComponent) {
        this.headerComponent = componentKey(headerComponent);
    }

    public String getHeaderComponent() {
        return headerComponent;
    }

    // --- READ ---
    @Override
    public boolean exists(Path file) {
        return file != null && Files.isRegularFile(file);
    }

    @Override
    public HeaderSet readPrimaryHeader(Path file) throws HeaderReadException {
        return load(file, false).get(0).header;
    }

    @Override
    public ContainerHeaders readHeaders(Path file) throws HeaderReadException {
        List<Component> comps = load(file, false);
        Map<String, HeaderSet> named = new LinkedHashMap<>();
        for (int i = 1; i < comps.size(); i++) named.put(comps.get(i).name, comps.get(i).header);
        return new ContainerHeaders(file, comps.get(0).header, named);
    }

    @Override
    public List<String> listNestedComponents(Path file) throws HeaderReadException {
        List<String> out = new ArrayList<>();
        for (String name : listComponents(file)) {
            if (!name.equals(headerComponent)) out.add(name);
        }
        return out;
    }

    @Override
    public List<String> listComponents(Path file) throws HeaderReadException {
        List<String> out = new ArrayList<>();
        List<Component> comps = load(file, false);
        for (int i = 1; i < comps.size(); i++) out.add(comps.get(i).name);
        return out;
    }

    @Override
    public HeaderSet readNestedHeader(Path file, String component) throws HeaderReadException {
        Component c = find(load(file, false), component);
        if (c == null) throw new HeaderReadException(file, "No component " + component + " in " + file);
        return c.header;
    }

    @Override
    public boolean hasComponent(Path file, String component) throws HeaderReadException {
        return find(load(file, false), component) != null;
    }

    // --- WRITE ---
    @Override
    public HeaderSet writeHeader(Path file, HeaderSet header) throws ContainerIOException {
        List<Component> comps = loadForUpdate(file);
        HeaderSet written = writable(header, file, "primary header");
        comps.get(0).header = written;
        save(file, comps);
        return written;
    }

    @Override
    public void createContainer(Path file, String component, HeaderSet header) throws ContainerIOException {
        if (exists(file)) {
            throw new ContainerIOException(null, file, "Container already exists");
        }
        List<Component> comps = new ArrayList<>();
        comps.add(new Component(null, HeaderSet.EMPTY, null));
        comps.add(new Component(componentKey(component), writable(header, file, component), null));
        save(file, comps);
    }

    @Override
    public void writeComponentHeader(Path file, String component, HeaderSet header) throws ContainerIOException {
        List<Component> comps = loadForUpdate(file);
        Component c = find(comps, component);
        HeaderSet written = writable(header, file, component);
        if (c == null) comps.add(new Component(componentKey(component), written, null));
        else c.header = written;
        save(file, comps);
    }

    @Override
    public void eraseComponent(Path file, String component) throws ContainerIOException {
        List<Component> comps = loadForUpdate(file);
        Component c = find(comps, component);
        if (c == null) return;
        comps.remove(c);
        save(file, comps);
    }

    // --- FITS PLUMBING ---
    private static class Component {
        final String name;   // null for the primary HDU
        HeaderSet header;
        final Object data;   // null for a placeholder

        Component(String name, HeaderSet header, Object data) {
            this.name = name;
            this.header = header;
            this.data = data;
        }
    }

    private static String componentKey(String name) {
        return (name == null) ? "" : name.trim().toUpperCase(Locale.ROOT);
    }

    private static Component find(List<Component> comps, String name) {
        String key = componentKey(name);
        for (int i = 1; i < comps.size(); i++) {
            if (comps.get(i).name.equals(key)) return comps.get(i);
        }
        return null;
    }

    private List<Component> loadForUpdate(Path file) throws ContainerIOException {
        try {
            return load(file, true);
        } catch (HeaderReadException e) {
            throw new ContainerIOException(null, file, "Unable to open container for update", e);
        }
    }

    // Data arrays are only needed when the file is going to be rewritten
    private List<Component> load(Path file, boolean withData) throws HeaderReadException {
        if (!exists(file)) throw new HeaderReadException(file, "No such file: " + file);

        List<Component> comps = new ArrayList<>();
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            for (int i = 0; hdus != null && i < hdus.length; i++) {
                Header h = hdus[i].getHeader();
                String name = null;
                if (i > 0) {
                    name = componentKey(h.getStringValue("EXTNAME"));
                    if (name.isEmpty()) name = "EXT" + i;
                }
                comps.add(new Component(name, toHeaderSet(h), withData ? hdus[i].getKernel() : null));
            }
        } catch (FitsException | IOException e) {
            throw new HeaderReadException(file, "Unable to read FITS header of " + file, e);
        }
        if (comps.isEmpty()) {
            throw new HeaderReadException(file, "No header data units in " + file);
        }
        return comps;
    }

    private static HeaderSet toHeaderSet(Header h) {
        HeaderSet.Builder b = HeaderSet.builder();
        Cursor<String, nom.tam.fits.HeaderCard> it = h.iterator();
        while (it.hasNext()) {
            nom.tam.fits.HeaderCard card = it.next();
            String key = HeaderCard.normalizeKeyword(card.getKey());
            if (isStructural(key)) continue;
            if (HeaderCard.isCommentaryKeyword(key)) {
                if (key.isEmpty() && card.getComment() == null) continue; // padding
                b.add(HeaderCard.of(key, card.getComment() == null ? "" : card.getComment().trim(), ""));
            } else {
                b.add(HeaderCard.parse(key, card.getValue(), card.getComment(), card.isStringValue()));
            }
        }
        return b.build();
    }

    /*
     * The header as it will be stored: structural cards left to the FITS
     * layer, blank commentary written as COMMENT, only the first card of a
     * repeated keyword.
     */
    static HeaderSet writable(HeaderSet header, Path file, String where) {
        Set<String> seen = new HashSet<>();
        HeaderSet.Builder b = HeaderSet.builder();
        for (HeaderCard c : header) {
            String key = c.getKeyword();
            if (isStructural(key)) continue;
            if (key.isEmpty()) {
                b.add(HeaderCard.of("COMMENT", c.valueString(), ""));
            } else if (c.isCommentary() || seen.add(key)) {
                b.add(c);
            } else {
                LOG.warning("Dropping repeated keyword from " + where + " of " + file + ": " + c.cardText());
            }
        }
        return b.build();
    }

    static boolean isStructural(String key) {
        return STRUCTURAL.contains(key) || key.startsWith("NAXIS");
    }

    private void save(Path file, List<Component> comps) throws ContainerIOException {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");

            Fits out = new Fits();
            for (Component c : comps) {
                BasicHDU<?> hdu = Fits.makeHDU(c.data == null ? new float[1][1] : c.data);
                Header h = hdu.getHeader();
                if (c.name != null) h.addValue("EXTNAME", c.name, "Component name");
                copyCards(c.header, h);
                out.addHDU(hdu);
            }

            BufferedFile bf = new BufferedFile(tmp.toFile(), "rw");
            try {
                out.write(bf);
            } finally {
                bf.close();
            }
            out.close();

            moveIntoPlace(tmp, file);
            tmp = null;
        } catch (FitsException | IOException e) {
            throw new ContainerIOException(null, file, "Unable to write container", e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    LOG.log(Level.WARNING, "Could not remove temporary file " + tmp, e);
                }
            }
        }
    }

    private static void moveIntoPlace(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyCards(HeaderSet cards, Header h) throws HeaderCardException {
        for (HeaderCard c : cards) {
            String key = c.getKeyword();
            if (isStructural(key)) continue;
            if (key.equals("COMMENT") || key.isEmpty()) {
                h.insertComment(c.valueString());
                continue;
            }
            if (key.equals("HISTORY")) {
                h.insertHistory(c.valueString());
                continue;
            }
            switch (c.getType()) {
                case LOGICAL: h.addValue(key, ((Boolean) c.getValue()).booleanValue(), c.getComment()); break;
                case INT: h.addValue(key, ((Number) c.getValue()).longValue(), c.getComment()); break;
                case FLOAT: h.addValue(key, ((Number) c.getValue()).doubleValue(), c.getComment()); break;
                default: h.addValue(key, c.valueString(), c.getComment()); break;
            }
        }
    }
}
