package com.camsim.service;

import com.camsim.model.BracketFrame;
import com.camsim.model.ExposureMode;
import com.camsim.model.ImageData;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Camara virtual: lente, sensor y pipeline, cada uno reemplazable entre exposiciones.
 *
 * <p>Camara por defecto: lente perfecta, sensor Bayer GRBG de 10 bits sin ruido de lectura
 * y ganancia 1 DN/e-, pipeline que demosaica, pasa a 8 bits y aplica gamma 1/2.2.
 */
public class Camera {

    private static final Logger LOG = Logger.getLogger(Camera.class.getName());

    private final int height;
    private final int width;

    private OpticalDistortionModel lens;
    private RadiometricSensorModel sensor;
    private ProcessingPipeline pipeline;
    private Random random;

    public Camera(int height, int width) {
        this(height, width, new Random());
    }

    public Camera(int height, int width, long seed) {
        this(height, width, new Random(seed));
    }

    private Camera(int height, int width, Random random) {
        this.height = height;
        this.width = width;
        this.lens = new OpticalDistortionModel();
        this.sensor = new RadiometricSensorModel(height, width);
        this.pipeline = new ProcessingPipeline();
        this.random = random;
    }

    public int getHeight() { return height; }
    public int getWidth() { return width; }

    public OpticalDistortionModel getLens() { return lens; }

    public void setLens(OpticalDistortionModel lens) {
        if (lens == null) throw new IllegalArgumentException("lens es null");
        this.lens = lens;
    }

    public RadiometricSensorModel getSensor() { return sensor; }

    public void setSensor(RadiometricSensorModel sensor) {
        if (sensor == null) throw new IllegalArgumentException("sensor es null");
        if (sensor.getHeight() != height || sensor.getWidth() != width)
            throw new IllegalArgumentException("Sensor " + sensor.getHeight() + "x" + sensor.getWidth()
                    + " no coincide con la camara " + height + "x" + width);
        this.sensor = sensor;
    }

    public ProcessingPipeline getPipeline() { return pipeline; }

    public void setPipeline(ProcessingPipeline pipeline) {
        if (pipeline == null) throw new IllegalArgumentException("pipeline es null");
        this.pipeline = pipeline;
    }

    public Random getRandom() { return random; }

    public void setRandom(Random random) {
        if (random == null) throw new IllegalArgumentException("random es null");
        this.random = random;
    }

    public ImageData simulate(ImageData scene, double exposureTime) {
        if (!(exposureTime >= 0) || Double.isInfinite(exposureTime))
            throw new IllegalArgumentException("Tiempo de exposicion invalido: " + exposureTime);

        // --- OPTICA -> SENSOR -> PROCESADO ---
        ImageData sensorPlane = lens.apply(scene);
        ImageData raw = sensor.exposeAt(sensorPlane, exposureTime, random);
        return pipeline.run(raw);
    }

    public double autoExposureTime(ImageData scene) {
        return autoExposureTime(scene, ExposureMode.GRAYWORLD);
    }

    public double autoExposureTime(ImageData scene, String mode) {
        return autoExposureTime(scene, ExposureMode.fromString(mode));
    }

    public double autoExposureTime(ImageData scene, ExposureMode mode) {
        if (mode == null) throw new IllegalArgumentException("Modo de auto-exposicion null");
        double response = sensor.maxQuantumEfficiency() * sensor.getGain();
        double t;
        switch (mode) {
            case SATURATION:
                t = sensor.getMaxDN() / (scene.max() * response);
                break;
            case GRAYWORLD:
            default:
                t = sensor.getMaxDN() / (2 * scene.mean() * response);
                break;
        }
        if (Double.isInfinite(t) || Double.isNaN(t)) {
            LOG.warning(String.format("Auto-exposicion '%s' sin senal en la escena: t = %s", mode.id(), t));
        }
        return t;
    }

    /** Horquillado: una exposicion por paso, en t = tOptimo * 2^paso. */
    public List<BracketFrame> simulateBracket(ImageData scene, double[] stops, String mode) {
        double tOpt = autoExposureTime(scene, mode);
        List<BracketFrame> frames = new ArrayList<>();
        for (double stop : stops) {
            double t = tOpt * Math.pow(2, stop);
            frames.add(new BracketFrame(stop, t, simulate(scene, t)));
            LOG.info(String.format("Paso %+.1f EV: t = %.4g s", stop, t));
        }
        return frames;
    }
}
