package com.astroframe.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.prefs.Preferences;

public class PipelineConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(PipelineConfig.class);

    public static final DateTimeFormatter COMMIT_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    // Version information written by collateHeaders
    private static final String KEY_PIPE_VERSION = "pipeline_version";
    private static final String KEY_PIPE_DATE = "pipeline_commit_date";
    private static final String KEY_ENGINE_VERSION = "engine_version";
    private static final String KEY_ENGINE_DATE = "engine_commit_date";

    // Frame behaviour
    private static final String KEY_HEADER_SYNC = "allow_header_sync";
    private static final String KEY_DEFAULT_RECIPE = "default_recipe";
    private static final String KEY_HEADER_COMPONENT = "header_component";

    // --- VERSIONS ---
    public static String getPipelineVersion() { return prefs.get(KEY_PIPE_VERSION, "unknown"); }
    public static void setPipelineVersion(String v) { prefs.put(KEY_PIPE_VERSION, v); }

    public static String getEngineVersion() { return prefs.get(KEY_ENGINE_VERSION, "nom.tam.fits"); }
    public static void setEngineVersion(String v) { prefs.put(KEY_ENGINE_VERSION, v); }

    /** Null when unset or unparseable. */
    public static LocalDateTime getPipelineCommitDate() { return parseDate(prefs.get(KEY_PIPE_DATE, "")); }
    public static void setPipelineCommitDate(LocalDateTime v) { prefs.put(KEY_PIPE_DATE, v == null ? "" : v.format(COMMIT_DATE_FORMAT)); }

    public static LocalDateTime getEngineCommitDate() { return parseDate(prefs.get(KEY_ENGINE_DATE, "")); }
    public static void setEngineCommitDate(LocalDateTime v) { prefs.put(KEY_ENGINE_DATE, v == null ? "" : v.format(COMMIT_DATE_FORMAT)); }

    // --- FRAME ---
    public static boolean isHeaderSyncAllowed() { return prefs.getBoolean(KEY_HEADER_SYNC, true); }
    public static void setHeaderSyncAllowed(boolean v) { prefs.putBoolean(KEY_HEADER_SYNC, v); }

    public static String getDefaultRecipe() { return prefs.get(KEY_DEFAULT_RECIPE, "QUICK_LOOK"); }
    public static void setDefaultRecipe(String v) { prefs.put(KEY_DEFAULT_RECIPE, v); }

    /** EXTNAME of the container component holding the shared header. */
    public static String getHeaderComponent() { return prefs.get(KEY_HEADER_COMPONENT, "HEADER"); }
    public static void setHeaderComponent(String v) { prefs.put(KEY_HEADER_COMPONENT, v); }

    private static LocalDateTime parseDate(String s) {
        if (s == null || s.isEmpty()) return null;
        try {
            return LocalDateTime.parse(s, COMMIT_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
