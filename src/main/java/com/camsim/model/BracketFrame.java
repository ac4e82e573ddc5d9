package com.camsim.model;

public class BracketFrame {
    public final double stop;          // pasos relativos a la exposicion optima
    public final double exposureTime;  // segundos
    public final ImageData image;

    public BracketFrame(double stop, double exposureTime, ImageData image) {
        this.stop = stop;
        this.exposureTime = exposureTime;
        this.image = image;
    }
}
