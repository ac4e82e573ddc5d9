package com.camsim.model;

public enum ExposureMode {
    GRAYWORLD("grayworld"),   // media de la escena a mitad del rango lineal
    SATURATION("saturation"); // maximo de la escena justo en maxDN

    private final String id;

    ExposureMode(String id) {
        this.id = id;
    }

    public String id() { return id; }

    public static ExposureMode fromString(String s) {
        for (ExposureMode m : values()) {
            if (m.id.equals(s)) return m;
        }
        throw new IllegalArgumentException("Modo de auto-exposicion invalido: '" + s + "'");
    }
}
