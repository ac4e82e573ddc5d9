package com.camsim.service;

import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import com.camsim.model.PolynomialCurve;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Efectos observables de la optica sobre la radiancia de la escena: distorsion radial,
 * aberracion cromatica lateral (LCA) de rojo y azul respecto al verde, descentrado del
 * centro optico y flare como velo uniforme por canal. No hay espectros ni trazado de rayos.
 *
 * <p>Los polinomios trabajan sobre el radio normalizado por la semidiagonal, de modo que el
 * pixel de la esquina tiene radio 1. La curva de distorsion lleva el radio real al
 * distorsionado; las de LCA dan el desplazamiento relativo de rojo/azul frente al verde.
 */
public class OpticalDistortionModel {

    public enum Variant { DISTORTION, PASS_THROUGH }

    private static final Logger LOG = Logger.getLogger(OpticalDistortionModel.class.getName());

    private final Variant variant;
    private PolynomialCurve distortion;
    private PolynomialCurve lcaRedGreen;
    private PolynomialCurve lcaBlueGreen;
    private double offsetX;
    private double offsetY;
    private double flareConstant;
    private Interpolator interpolator = new BicubicInterpolator();

    // Lente perfecta: sin distorsion, sin LCA, sin flare, centrada
    public OpticalDistortionModel() {
        this(PolynomialCurve.identity(), PolynomialCurve.zero(), PolynomialCurve.zero(), 0, 0, 0);
    }

    public OpticalDistortionModel(PolynomialCurve distortion, PolynomialCurve lcaRedGreen, PolynomialCurve lcaBlueGreen,
                                  double offsetX, double offsetY, double flareConstant) {
        this(Variant.DISTORTION);
        setDistortion(distortion);
        setLcaRedGreen(lcaRedGreen);
        setLcaBlueGreen(lcaBlueGreen);
        setOpticalCenterOffset(offsetX, offsetY);
        setFlareConstant(flareConstant);
    }

    private OpticalDistortionModel(Variant variant) {
        this.variant = variant;
        this.distortion = PolynomialCurve.identity();
        this.lcaRedGreen = PolynomialCurve.zero();
        this.lcaBlueGreen = PolynomialCurve.zero();
    }

    /** Lente que deja pasar los datos tal cual (solo los pasa a reales). */
    public static OpticalDistortionModel passThrough() {
        return new OpticalDistortionModel(Variant.PASS_THROUGH);
    }

    public Variant getVariant() { return variant; }

    public PolynomialCurve getDistortion() { return distortion; }
    public void setDistortion(PolynomialCurve c) { distortion = requireCurve(c, "distortion"); }

    public PolynomialCurve getLcaRedGreen() { return lcaRedGreen; }
    public void setLcaRedGreen(PolynomialCurve c) { lcaRedGreen = requireCurve(c, "lcaRedGreen"); }

    public PolynomialCurve getLcaBlueGreen() { return lcaBlueGreen; }
    public void setLcaBlueGreen(PolynomialCurve c) { lcaBlueGreen = requireCurve(c, "lcaBlueGreen"); }

    public double getOffsetX() { return offsetX; }
    public double getOffsetY() { return offsetY; }

    public void setOpticalCenterOffset(double dx, double dy) {
        if (!Double.isFinite(dx) || !Double.isFinite(dy))
            throw new IllegalArgumentException("Descentrado optico no finito: [" + dx + ", " + dy + "]");
        offsetX = dx;
        offsetY = dy;
    }

    public double getFlareConstant() { return flareConstant; }

    public void setFlareConstant(double k) {
        if (!(k >= 0 && k <= 1)) throw new IllegalArgumentException("flareConstant debe estar en [0, 1]: " + k);
        flareConstant = k;
    }

    public Interpolator getInterpolator() { return interpolator; }

    public void setInterpolator(Interpolator interpolator) {
        if (interpolator == null) throw new IllegalArgumentException("interpolator es null");
        this.interpolator = interpolator;
    }

    public ImageData apply(ImageData scene) {
        if (variant == Variant.PASS_THROUGH) return scene.withType(PixelType.DOUBLE);
        if (scene.getChannels() != 3)
            throw new IllegalArgumentException("La lente espera 3 canales, no " + scene.getChannels());

        int h = scene.getHeight();
        int w = scene.getWidth();
        int n = h * w;

        // Inversas: radio distorsionado -> radio real de la escena
        PolynomialCurve distInverse = distortion.invert(PolynomialCurve.DISTORTION_SAMPLES);
        PolynomialCurve rgInverse = lcaRedGreen.toAbsoluteRadius().invert(PolynomialCurve.LCA_SAMPLES);
        PolynomialCurve bgInverse = lcaBlueGreen.toAbsoluteRadius().invert(PolynomialCurve.LCA_SAMPLES);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Inversa distorsion " + distInverse + ", R-G " + rgInverse + ", B-G " + bgInverse);
        }

        double cx = (w - 1) / 2.0 + offsetX;
        double cy = (h - 1) / 2.0 + offsetY;
        double norm = Math.hypot((w - 1) / 2.0, (h - 1) / 2.0);
        if (norm == 0) norm = 1; // imagen de 1x1

        // Esquina fija: el radio 1 vuelve a muestrear el radio 1 con cualquier distorsion
        double pin = distortion.evaluate(1.0);

        double[] cos = new double[n];
        double[] sin = new double[n];
        double[][] rho = new double[3][n];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                double dx = x - cx;
                double dy = y - cy;
                double theta = Math.atan2(dy, dx);
                cos[i] = Math.cos(theta);
                sin[i] = Math.sin(theta);

                double rhoU = Math.hypot(dx, dy) / norm * pin;
                double green = distInverse.evaluate(rhoU);
                rho[1][i] = green;
                rho[0][i] = rgInverse.evaluate(green);
                rho[2][i] = bgInverse.evaluate(green);
            }
        }

        ImageData out = new ImageData(h, w, 3, PixelType.DOUBLE);
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int c = 0; c < 3; c++) {
            for (int i = 0; i < n; i++) {
                double r = rho[c][i] * norm;
                xs[i] = cx + r * cos[i];
                ys[i] = cy + r * sin[i];
            }
            double[] plane = interpolator.resample(scene.toProcessor(c), xs, ys);

            // Flare: cada pixel pierde flareConstant de su valor y lo perdido se reparte
            // como constante. Se estima con la norma L2 del canal, no con la media.
            double veil = flareConstant * scene.channelNorm(c) / Math.sqrt(n);
            for (int i = 0; i < n; i++) plane[i] = plane[i] * (1 - flareConstant) + veil;
            out.setChannel(c, plane);
        }
        return out;
    }

    private static PolynomialCurve requireCurve(PolynomialCurve c, String name) {
        if (c == null) throw new IllegalArgumentException(name + " es null");
        return c;
    }
}
