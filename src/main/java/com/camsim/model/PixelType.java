package com.camsim.model;

public enum PixelType {
    UINT8(255),
    UINT16(65535),
    DOUBLE(Double.POSITIVE_INFINITY);

    private final double maxValue;

    PixelType(double maxValue) {
        this.maxValue = maxValue;
    }

    public double maxValue() { return maxValue; }

    public boolean isInteger() { return this != DOUBLE; }

    // Redondeo "half away from zero" y saturacion al rango del tipo
    public double cast(double v) {
        if (!isInteger()) return v;
        if (Double.isNaN(v) || v <= 0) return 0;
        if (v >= maxValue) return maxValue;
        return Math.floor(v + 0.5);
    }

    public static PixelType forBits(int bits) {
        switch (bits) {
            case 8: return UINT8;
            case 16: return UINT16;
            default: throw new IllegalArgumentException("Profundidad de salida no soportada: " + bits + " bits (8 o 16)");
        }
    }
}
