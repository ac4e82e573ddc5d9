package com.camsim.model;

public class FrameMetadata {
    public double exposureTime = 0;
    public double gain = 0;
    public double offset = 0;

    public FrameMetadata() {
    }

    public FrameMetadata(double exposureTime, double gain, double offset) {
        this.exposureTime = exposureTime;
        this.gain = gain;
        this.offset = offset;
    }
}
