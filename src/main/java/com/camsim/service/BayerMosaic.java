package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;

public final class BayerMosaic {

    private BayerMosaic() {
    }

    // Seleccion espacial fija: en cada posicion sobrevive un solo canal, sin interpolar
    public static ImageData mosaic(ImageData rgb, BayerPhase phase) {
        if (rgb.getChannels() != 3)
            throw new IllegalArgumentException("El mosaico necesita 3 canales, no " + rgb.getChannels());
        int h = rgb.getHeight();
        int w = rgb.getWidth();
        ImageData cfa = new ImageData(h, w, 1, rgb.getType());
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                cfa.set(y, x, 0, rgb.get(y, x, phase.channelAt(y, x)));
            }
        }
        return cfa;
    }
}
