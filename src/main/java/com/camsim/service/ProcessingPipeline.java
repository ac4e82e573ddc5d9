package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Secuencia ordenada de pasos aplicada a la salida del sensor, seguida de la conversion
 * al tipo de salida declarado (8 o 16 bits sin signo). Sin pasos es el pipeline nulo:
 * solo convierte, util para inspeccionar datos crudos.
 */
public class ProcessingPipeline {

    private static final Logger LOG = Logger.getLogger(ProcessingPipeline.class.getName());

    private final List<ProcessingStep> steps;
    private PixelType outputType;
    private Demosaicer demosaicer = new BilinearDemosaicer();

    // demosaico GRBG -> 10 a 8 bits -> gamma 1/2.2 -> uint8
    public ProcessingPipeline() {
        this(defaultSteps(BayerPhase.GRBG, RadiometricSensorModel.DEFAULT_MAX_DN, PixelType.UINT8), PixelType.UINT8);
    }

    public ProcessingPipeline(List<ProcessingStep> steps) {
        this(steps, PixelType.UINT8);
    }

    public ProcessingPipeline(List<ProcessingStep> steps, PixelType outputType) {
        if (steps == null) throw new IllegalArgumentException("La lista de pasos es null");
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) == null) throw new IllegalArgumentException("Paso " + i + " mal formado (null)");
        }
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        setOutputType(outputType);
    }

    public static ProcessingPipeline standard(BayerPhase phase, int inMax, PixelType outputType) {
        return new ProcessingPipeline(defaultSteps(phase, inMax, outputType), outputType);
    }

    public static ProcessingPipeline passThrough(PixelType outputType) {
        return new ProcessingPipeline(Collections.<ProcessingStep>emptyList(), outputType);
    }

    private static List<ProcessingStep> defaultSteps(BayerPhase phase, int inMax, PixelType outputType) {
        double outMax = outputType.maxValue();
        List<ProcessingStep> s = new ArrayList<>();
        s.add(ProcessingStep.demosaic(phase));
        s.add(ProcessingStep.rescale(inMax, outMax));
        s.add(ProcessingStep.gammaEncode(1 / 2.2, outMax));
        return s;
    }

    public List<ProcessingStep> getSteps() { return steps; }

    public PixelType getOutputType() { return outputType; }

    public void setOutputType(PixelType type) {
        if (type == null || !type.isInteger())
            throw new IllegalArgumentException("El tipo de salida debe ser UINT8 o UINT16, no " + type);
        outputType = type;
    }

    public Demosaicer getDemosaicer() { return demosaicer; }

    public void setDemosaicer(Demosaicer demosaicer) {
        if (demosaicer == null) throw new IllegalArgumentException("demosaicer es null");
        this.demosaicer = demosaicer;
    }

    public ImageData run(ImageData sensorData) {
        ImageData data = sensorData;
        for (ProcessingStep step : steps) {
            data = execute(step, data);
            if (LOG.isLoggable(Level.FINE)) LOG.fine("Paso " + step + " -> " + data);
        }
        return data.cast(outputType);
    }

    private ImageData execute(ProcessingStep step, ImageData data) {
        double[] p = step.getParams();
        switch (step.getOperation()) {
            case DEMOSAIC:
                return ProcessingOperations.demosaic(data, step.getPhase(), demosaicer);
            case RESCALE:
                return ProcessingOperations.rescale(data, p[0], p[1]);
            case GAMMA_ENCODE:
                return ProcessingOperations.gammaEncode(data, p[0], p[1]);
            case CUSTOM:
                return step.getFunction().apply(data, p);
            default:
                throw new IllegalStateException("Operacion desconocida: " + step.getOperation());
        }
    }
}
