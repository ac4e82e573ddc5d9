package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import ij.process.FloatProcessor;

/**
 * Demosaico bilineal por convolucion normalizada: cada canal es la media ponderada
 * de las muestras de ese color en el vecindario 3x3. En los bordes ImageJ replica el
 * pixel de borde, tanto en la senal como en la mascara, y el cociente sigue siendo valido.
 */
public class BilinearDemosaicer implements Demosaicer {

    private static final float[] RB_KERNEL = {
            1, 2, 1,
            2, 4, 2,
            1, 2, 1 };
    private static final float[] G_KERNEL = {
            0, 1, 0,
            1, 4, 1,
            0, 1, 0 };

    @Override
    public ImageData demosaic(ImageData cfa, BayerPhase phase) {
        if (cfa.getChannels() != 1)
            throw new IllegalArgumentException("El demosaico necesita datos de 1 canal, no " + cfa.getChannels());
        int h = cfa.getHeight();
        int w = cfa.getWidth();
        ImageData rgb = new ImageData(h, w, 3, PixelType.DOUBLE);

        for (int c = 0; c < 3; c++) {
            FloatProcessor signal = new FloatProcessor(w, h);
            FloatProcessor mask = new FloatProcessor(w, h);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    if (phase.channelAt(y, x) == c) {
                        signal.setf(x, y, (float) cfa.get(y, x));
                        mask.setf(x, y, 1f);
                    }
                }
            }

            float[] kernel = (c == BayerPhase.GREEN) ? G_KERNEL : RB_KERNEL;
            signal.convolve(kernel, 3, 3);
            mask.convolve(kernel, 3, 3);

            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    double v;
                    if (phase.channelAt(y, x) == c) {
                        v = cfa.get(y, x); // muestra propia, sin pasar por float
                    } else {
                        float m = mask.getf(x, y);
                        v = (m > 0) ? (double) signal.getf(x, y) / m : 0.0;
                    }
                    rgb.set(y, x, c, v);
                }
            }
        }
        return rgb;
    }
}
