package com.camsim.service;

import ij.process.FloatProcessor;

public class BicubicInterpolator implements Interpolator {

    // Distancia por debajo de la cual se toma la muestra exacta del pixel
    private static final double SNAP = 1e-6;

    @Override
    public double[] resample(FloatProcessor source, double[] xs, double[] ys) {
        int w = source.getWidth();
        int h = source.getHeight();
        double[] out = new double[xs.length];

        for (int i = 0; i < xs.length; i++) {
            double x = xs[i];
            double y = ys[i];
            // fuera de la huella de la imagen (o NaN) -> 0
            if (!(x >= -0.5 && x <= w - 0.5 && y >= -0.5 && y <= h - 0.5)) continue;

            x = Math.min(Math.max(x, 0), w - 1);
            y = Math.min(Math.max(y, 0), h - 1);
            double rx = Math.rint(x), ry = Math.rint(y);
            if (Math.abs(x - rx) < SNAP && Math.abs(y - ry) < SNAP) {
                out[i] = source.getf((int) rx, (int) ry);
            } else {
                // ImageJ cae a bilineal en el borde de 1 pixel
                out[i] = source.getBicubicInterpolatedPixel(x, y, source);
            }
        }
        return out;
    }
}
