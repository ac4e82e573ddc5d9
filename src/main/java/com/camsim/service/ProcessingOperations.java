package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;

/**
 * Pasos reutilizables del pipeline. Conservan el tipo de la entrada: el calculo se hace
 * en reales y el resultado se vuelve a convertir al tipo original.
 */
public final class ProcessingOperations {

    private ProcessingOperations() {
    }

    public static ImageData demosaic(ImageData data, BayerPhase phase, Demosaicer demosaicer) {
        ImageData rgb = demosaicer.demosaic(data, phase);
        return rgb.cast(data.getType());
    }

    public static ImageData rescale(ImageData data, double inMax, double outMax) {
        ImageData out = data.withType(PixelType.DOUBLE);
        for (int c = 0; c < out.getChannels(); c++) {
            double[] plane = out.channel(c);
            for (int i = 0; i < plane.length; i++) plane[i] = plane[i] / inMax * outMax;
            out.setChannel(c, plane);
        }
        return out.cast(data.getType());
    }

    public static ImageData gammaEncode(ImageData data, double gamma, double maxVal) {
        ImageData out = data.withType(PixelType.DOUBLE);
        for (int c = 0; c < out.getChannels(); c++) {
            double[] plane = out.channel(c);
            for (int i = 0; i < plane.length; i++) plane[i] = Math.pow(plane[i] / maxVal, gamma) * maxVal;
            out.setChannel(c, plane);
        }
        return out.cast(data.getType());
    }
}
