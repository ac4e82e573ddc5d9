package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import java.util.Arrays;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sensor lineal con modelo de ruido tipo EMVA1288. El mosaico Bayer se simula
 * re-muestreando la entrada de 3 canales; la QE por canal es la sensibilidad relativa.
 *
 * <p>La salida es siempre UINT16 aunque el sensor modelado tenga menos bits: la
 * profundidad efectiva la fija maxDN.
 */
public class RadiometricSensorModel {

    public enum Variant {
        RADIOMETRIC,
        PASS_THROUGH_BAYER,  // mosaico y redondeo, sin ruido ni ganancia
        PASS_THROUGH_COLOR   // solo redondeo, sigue en 3 canales
    }

    public static final int DEFAULT_MAX_DN = 1023; // 10 bits
    private static final int MAX_REPRESENTABLE_DN = 65535;

    private static final Logger LOG = Logger.getLogger(RadiometricSensorModel.class.getName());

    private final Variant variant;
    private final int height;
    private final int width;

    private double[] prnu;          // multiplicativo, por pixel
    private double[] darkCurrent;   // e-/s, por pixel
    private double[] noiseFloor;    // e-, por pixel (un escalar se expande)

    private double[] qe = { 1, 1, 1 };  // [R, G, B], e-/foton
    private double gain = 1;            // DN/e-
    private double offset = 0;          // DN
    private double wellCapacity = Double.POSITIVE_INFINITY; // e-
    private int maxDN = DEFAULT_MAX_DN;
    private BayerPhase bayerPhase = BayerPhase.GRBG;

    public RadiometricSensorModel(int height, int width) {
        this(Variant.RADIOMETRIC, height, width);
    }

    public RadiometricSensorModel(int height, int width, double[] prnu, double[] darkCurrent) {
        this(Variant.RADIOMETRIC, height, width);
        setPrnu(prnu);
        setDarkCurrent(darkCurrent);
    }

    private RadiometricSensorModel(Variant variant, int height, int width) {
        if (height <= 0 || width <= 0)
            throw new IllegalArgumentException("Tamano de sensor invalido: " + height + "x" + width);
        this.variant = variant;
        this.height = height;
        this.width = width;
        this.prnu = new double[height * width];
        Arrays.fill(this.prnu, 1.0);
        this.darkCurrent = new double[height * width];
        this.noiseFloor = new double[height * width];
    }

    public static RadiometricSensorModel passThroughBayer(int height, int width) {
        return new RadiometricSensorModel(Variant.PASS_THROUGH_BAYER, height, width);
    }

    public static RadiometricSensorModel passThroughColor(int height, int width) {
        return new RadiometricSensorModel(Variant.PASS_THROUGH_COLOR, height, width);
    }

    public Variant getVariant() { return variant; }
    public int getHeight() { return height; }
    public int getWidth() { return width; }

    public double[] getPrnu() { return prnu.clone(); }
    public void setPrnu(double[] mask) { prnu = requireMask(mask, "prnu"); }

    public double[] getDarkCurrent() { return darkCurrent.clone(); }
    public void setDarkCurrent(double[] mask) { darkCurrent = requireMask(mask, "darkCurrent"); }

    public double[] getNoiseFloor() { return noiseFloor.clone(); }
    public void setNoiseFloor(double[] mask) { noiseFloor = requireMask(mask, "noiseFloor"); }

    public void setNoiseFloor(double electrons) {
        if (!(electrons >= 0)) throw new IllegalArgumentException("noiseFloor debe ser >= 0: " + electrons);
        Arrays.fill(noiseFloor, electrons);
    }

    public double[] getQuantumEfficiency() { return qe.clone(); }

    public void setQuantumEfficiency(double r, double g, double b) {
        if (!(r >= 0 && g >= 0 && b >= 0)) throw new IllegalArgumentException("QE negativa: [" + r + ", " + g + ", " + b + "]");
        qe = new double[] { r, g, b };
    }

    public double maxQuantumEfficiency() {
        return Math.max(qe[0], Math.max(qe[1], qe[2]));
    }

    public double getGain() { return gain; }

    public void setGain(double gain) {
        if (!(gain > 0) || Double.isInfinite(gain)) throw new IllegalArgumentException("La ganancia debe ser > 0: " + gain);
        this.gain = gain;
    }

    public double getOffset() { return offset; }

    public void setOffset(double offset) {
        if (!Double.isFinite(offset)) throw new IllegalArgumentException("offset no finito: " + offset);
        this.offset = offset;
    }

    public double getWellCapacity() { return wellCapacity; }

    public void setWellCapacity(double electrons) {
        if (!(electrons >= 0)) throw new IllegalArgumentException("wellCapacity debe ser >= 0: " + electrons);
        wellCapacity = electrons;
    }

    public int getMaxDN() { return maxDN; }

    public void setMaxDN(int maxDN) {
        if (maxDN < 1 || maxDN > MAX_REPRESENTABLE_DN)
            throw new IllegalArgumentException("maxDN debe estar en [1, " + MAX_REPRESENTABLE_DN + "]: " + maxDN);
        this.maxDN = maxDN;
    }

    public BayerPhase getBayerPhase() { return bayerPhase; }

    public void setBayerPhase(BayerPhase phase) {
        if (phase == null) throw new IllegalArgumentException("bayerPhase es null");
        bayerPhase = phase;
    }

    public ImageData exposeAt(ImageData radiance, double exposureTime) {
        return exposeAt(radiance, exposureTime, new Random());
    }

    public ImageData exposeAt(ImageData radiance, double exposureTime, Random rng) {
        switch (variant) {
            case PASS_THROUGH_BAYER:
                return BayerMosaic.mosaic(radiance, bayerPhase).cast(PixelType.UINT16);
            case PASS_THROUGH_COLOR:
                return radiance.cast(PixelType.UINT16);
            default:
                return expose(radiance, exposureTime, rng);
        }
    }

    private ImageData expose(ImageData radiance, double t, Random rng) {
        if (radiance.getChannels() != 3)
            throw new IllegalArgumentException("El sensor espera 3 canales, no " + radiance.getChannels());
        if (!radiance.sameSize(height, width))
            throw new IllegalArgumentException("Radiancia " + radiance.getHeight() + "x" + radiance.getWidth()
                    + " no coincide con el sensor " + height + "x" + width);
        if (rng == null) throw new IllegalArgumentException("rng es null");

        // --- FILTRO DE COLOR: QE por canal y mosaico ---
        ImageData filtered = radiance.withType(PixelType.DOUBLE);
        for (int c = 0; c < 3; c++) {
            double[] plane = filtered.channel(c);
            for (int i = 0; i < plane.length; i++) plane[i] *= qe[c];
            filtered.setChannel(c, plane);
        }
        double[] power = BayerMosaic.mosaic(filtered, bayerPhase).channel(0);

        // --- ELECTRONES EN EL POZO ---
        double[] dn = new double[power.length];
        int wellClipped = 0;
        for (int i = 0; i < power.length; i++) {
            double expected = (power[i] + darkCurrent[i]) * t + noiseFloor[i];
            double e = PoissonSampler.sample(expected, rng);  // ruido de disparo
            if (e > wellCapacity) {
                e = wellCapacity;
                wellClipped++;
            }

            // --- CONVERSION A DN y ADC ---
            double v = gain * e * prnu[i] + offset;
            v = PixelType.UINT16.cast(v);
            dn[i] = Math.min(v, maxDN);
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Exposicion %.4g s: %d pixeles saturados en el pozo", t, wellClipped));
        }
        return new ImageData(height, width, 1, PixelType.UINT16, dn);
    }

    private double[] requireMask(double[] mask, String name) {
        if (mask == null || mask.length != height * width)
            throw new IllegalArgumentException(name + " debe tener " + height + "x" + width + " valores");
        return mask.clone();
    }
}
