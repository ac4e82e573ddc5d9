package com.camsim.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_AE_MODE = "ae_mode";
    private static final String KEY_BRACKET = "bracket_stops";
    private static final String KEY_OUTPUT_BITS = "output_bits";
    private static final String KEY_SEED = "random_seed";

    public static String getAutoExposureMode() { return prefs.get(KEY_AE_MODE, ExposureMode.GRAYWORLD.id()); }
    public static void setAutoExposureMode(String v) { prefs.put(KEY_AE_MODE, ExposureMode.fromString(v).id()); }

    // Pasos separados por comas, p.ej. "-2,-1,0,1"
    public static double[] getBracketStops() { return parseStops(prefs.get(KEY_BRACKET, "-2,-1,0,1")); }
    public static void setBracketStops(String v) {
        parseStops(v);
        prefs.put(KEY_BRACKET, v);
    }

    public static int getOutputBits() { return prefs.getInt(KEY_OUTPUT_BITS, 8); }
    public static void setOutputBits(int v) {
        PixelType.forBits(v);
        prefs.putInt(KEY_OUTPUT_BITS, v);
    }

    // -1 = semilla por tiempo
    public static long getRandomSeed() { return prefs.getLong(KEY_SEED, -1L); }
    public static void setRandomSeed(long v) { prefs.putLong(KEY_SEED, v); }

    static double[] parseStops(String s) {
        if (s == null || s.trim().isEmpty()) throw new IllegalArgumentException("Lista de pasos vacia");
        String[] parts = s.split(",");
        double[] stops = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                stops[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Paso de exposicion invalido: '" + parts[i] + "'", e);
            }
        }
        return stops;
    }
}
