package com.camsim.model;

import java.util.Locale;

/**
 * Orientacion del mosaico Bayer 2x2. El nombre se lee fila a fila desde la esquina
 * superior izquierda: GRBG = G en (0,0), R en (0,1), B en (1,0), G en (1,1).
 */
public enum BayerPhase {
    GRBG(1, 0, 2, 1),
    BGGR(2, 1, 1, 0),
    RGGB(0, 1, 1, 2),
    GBRG(1, 2, 0, 1);

    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;

    // canal en cada posicion del mosaico: [fila par/col par, par/impar, impar/par, impar/impar]
    private final int[] tile;

    BayerPhase(int c00, int c01, int c10, int c11) {
        this.tile = new int[] { c00, c01, c10, c11 };
    }

    public int channelAt(int row, int col) {
        return tile[((row & 1) << 1) | (col & 1)];
    }

    public String id() { return name().toLowerCase(Locale.ROOT); }

    public static BayerPhase fromString(String s) {
        if (s != null) {
            for (BayerPhase p : values()) {
                if (p.id().equals(s.trim().toLowerCase(Locale.ROOT))) return p;
            }
        }
        throw new IllegalArgumentException("Fase Bayer incorrecta: '" + s + "'. Debe ser 'grbg', 'bggr', 'rggb' o 'gbrg'.");
    }
}
