package com.camsim.model;

import ij.process.FloatProcessor;
import java.util.Arrays;

/**
 * Array HxWxC (C = 1 o 3) con su tipo numerico. Los datos se guardan por planos
 * de canal como double; el tipo solo indica el rango que representan.
 */
public class ImageData {

    private final int height;
    private final int width;
    private final int channels;
    private final PixelType type;
    private final double[] data;

    public ImageData(int height, int width, int channels, PixelType type) {
        this(new double[Math.max(height, 0) * Math.max(width, 0) * Math.max(channels, 0)], height, width, channels, type);
    }

    /** Copia {@code data}: el array del llamador no queda ligado a la imagen. */
    public ImageData(int height, int width, int channels, PixelType type, double[] data) {
        this(data == null ? null : data.clone(), height, width, channels, type);
    }

    // Toma posesion de data sin copiarlo
    private ImageData(double[] data, int height, int width, int channels, PixelType type) {
        if (data == null) throw new IllegalArgumentException("Datos null");
        if (height <= 0 || width <= 0) throw new IllegalArgumentException("Dimensiones invalidas: " + height + "x" + width);
        if (channels != 1 && channels != 3) throw new IllegalArgumentException("Solo se admiten 1 o 3 canales, no " + channels);
        if (data.length != height * width * channels)
            throw new IllegalArgumentException("Longitud de datos " + data.length + " no coincide con " + height + "x" + width + "x" + channels);
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.type = type;
        this.data = data;
    }

    public static ImageData uniform(int height, int width, int channels, double value) {
        ImageData img = new ImageData(height, width, channels, PixelType.DOUBLE);
        Arrays.fill(img.data, value);
        return img;
    }

    public int getHeight() { return height; }
    public int getWidth() { return width; }
    public int getChannels() { return channels; }
    public PixelType getType() { return type; }
    public int pixelCount() { return height * width; }

    public double get(int row, int col, int channel) {
        return data[(channel * height + row) * width + col];
    }

    public void set(int row, int col, int channel, double v) {
        data[(channel * height + row) * width + col] = v;
    }

    public double get(int row, int col) { return get(row, col, 0); }

    /** Copia del plano de un canal, indexado fila * ancho + columna. */
    public double[] channel(int c) {
        double[] out = new double[height * width];
        System.arraycopy(data, c * height * width, out, 0, out.length);
        return out;
    }

    public void setChannel(int c, double[] plane) {
        if (plane.length != height * width) throw new IllegalArgumentException("Plano de tamano incorrecto");
        System.arraycopy(plane, 0, data, c * height * width, plane.length);
    }

    /** Plano de un canal como FloatProcessor. La precision baja a float (unos 7 digitos). */
    public FloatProcessor toProcessor(int c) {
        FloatProcessor ip = new FloatProcessor(width, height);
        float[] px = (float[]) ip.getPixels();
        int base = c * height * width;
        for (int i = 0; i < px.length; i++) px[i] = (float) data[base + i];
        return ip;
    }

    public ImageData copy() {
        return new ImageData(data.clone(), height, width, channels, type);
    }

    public ImageData withType(PixelType newType) {
        return new ImageData(data.clone(), height, width, channels, newType);
    }

    // Conversion con redondeo y saturacion al rango del tipo destino
    public ImageData cast(PixelType target) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) out[i] = target.cast(data[i]);
        return new ImageData(out, height, width, channels, target);
    }

    public double mean() {
        double s = 0;
        for (double v : data) s += v;
        return s / data.length;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : data) if (v > m) m = v;
        return m;
    }

    public double channelMean(int c) {
        double s = 0;
        int base = c * height * width;
        for (int i = 0; i < height * width; i++) s += data[base + i];
        return s / (height * width);
    }

    // Norma L2 espacial de un canal
    public double channelNorm(int c) {
        double s = 0;
        int base = c * height * width;
        for (int i = 0; i < height * width; i++) s += data[base + i] * data[base + i];
        return Math.sqrt(s);
    }

    public boolean sameSize(int h, int w) {
        return height == h && width == w;
    }

    @Override
    public String toString() {
        return String.format("ImageData[%dx%dx%d %s]", height, width, channels, type);
    }
}
