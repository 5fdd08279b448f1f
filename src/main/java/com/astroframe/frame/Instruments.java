package com.astroframe.frame;

import com.astroframe.model.HeaderSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known instrument configurations. These are data, not code: an instrument is
 * a keyword table plus a handful of named overrides.
 */
public final class Instruments {

    private static final Pattern ISO_TIME = Pattern.compile("T(\\d\\d):(\\d\\d):(\\d\\d(?:\\.\\d*)?)");
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d\\d)-(\\d\\d)");

    public static final InstrumentConfig GENERIC = InstrumentConfig.builder("GENERIC")
            .map("INSTRUMENT", "INSTRUME")
            .map("OBJECT", "OBJECT")
            .map("OBSERVATION_NUMBER", "OBSNUM")
            .map("GROUP", "GRPNUM")
            .map("RECIPE", "RECIPE")
            .map("NSUBS", "N_SUBS")
            .map("UTDATE", "UTDATE")
            .map("UTSTART", "UTSTART")
            .map("UTEND", "UTEND")
            .build();

    // UKIRT infrared imagers (UFTI family)
    public static final InstrumentConfig UKIRT_IMAGER = GENERIC.derive("UKIRT_IMAGER")
            .rawPrefix("f")
            .rawSuffix(".sdf")
            .map("AIRMASS_START", "AMSTART")
            .map("AIRMASS_END", "AMEND")
            .map("DEC_SCALE", "CDELT2")
            .map("DEC_TELESCOPE_OFFSET", "TDECOFF")
            .map("EXPOSURE_TIME", "EXP_TIME")
            .map("FILTER", "FILTER")
            .map("GAIN", "GAIN")
            .map("RA_SCALE", "CDELT1")
            .map("RA_TELESCOPE_OFFSET", "TRAOFF")
            .map("DR_RECIPE", "DRRECIPE")
            .override("UTDATE", Instruments::utDateFromDateObs)
            .build();

    // JCMT heterodyne backends, times only available as ISO strings
    public static final InstrumentConfig JCMT_HETERODYNE = GENERIC.derive("JCMT_HETERODYNE")
            .rawPrefix("a")
            .rawSuffix(".sdf")
            .map("AIRMASS_START", "AMSTART")
            .map("AIRMASS_END", "AMEND")
            .map("EXPOSURE_TIME", "INT_TIME")
            .map("EQUINOX", "EQUINOX")
            .map("NUMBER_OF_EXPOSURES", "N_EXP")
            .map("STANDARD", "STANDARD")
            .map("DR_RECIPE", "RECIPE")
            .override("UTSTART", raw -> decimalHours(raw, "DATE-OBS"))
            .override("UTEND", raw -> decimalHours(raw, "DATE-END"))
            .override("UTDATE", Instruments::utDateFromDateObs)
            .build();

    private static final Map<String, InstrumentConfig> REGISTRY;
    static {
        Map<String, InstrumentConfig> m = new LinkedHashMap<>();
        for (InstrumentConfig c : new InstrumentConfig[] { GENERIC, UKIRT_IMAGER, JCMT_HETERODYNE }) {
            m.put(c.getName(), c);
        }
        REGISTRY = Collections.unmodifiableMap(m);
    }

    private Instruments() {
    }

    public static InstrumentConfig forName(String name) {
        InstrumentConfig c = (name == null) ? null : REGISTRY.get(name.trim().toUpperCase(Locale.ROOT));
        if (c == null) throw new IllegalArgumentException("Unknown instrument: " + name);
        return c;
    }

    public static Map<String, InstrumentConfig> all() {
        return REGISTRY;
    }

    // --- SHARED OVERRIDES ---

    /** UT date as YYYYMMDD: the UTDATE keyword when present, else the date part of DATE-OBS. */
    static Object utDateFromDateObs(HeaderSet raw) {
        Object utdate = raw.value("UTDATE");
        if (utdate != null && !utdate.toString().trim().isEmpty()) {
            String digits = utdate.toString().replace("-", "").replace(":", "").trim();
            try {
                return Long.parseLong(digits);
            } catch (NumberFormatException e) {
                return utdate;
            }
        }
        Object dateObs = raw.value("DATE-OBS");
        if (dateObs == null) return null;
        Matcher m = ISO_DATE.matcher(dateObs.toString().trim());
        if (!m.find()) return null;
        return Long.parseLong(m.group(1) + m.group(2) + m.group(3));
    }

    /** Time of day of an ISO date-time keyword as decimal hours. */
    static Object decimalHours(HeaderSet raw, String keyword) {
        Object v = raw.value(keyword);
        if (v == null) return null;
        Matcher m = ISO_TIME.matcher(v.toString());
        if (!m.find()) return null;
        double hour = Integer.parseInt(m.group(1));
        double minute = Integer.parseInt(m.group(2));
        double second = Double.parseDouble(m.group(3));
        return hour + minute / 60.0 + second / 3600.0;
    }
}
