package com.camsim.service;

import com.camsim.model.BayerPhase;
import java.util.Arrays;
import java.util.Locale;

/**
 * Un paso del pipeline: operacion + parametros. Las operaciones incluidas se validan al
 * construir; CUSTOM delega en una StepFunction opaca.
 */
public final class ProcessingStep {

    public enum Operation {
        DEMOSAIC(1),      // (bayerPhase)
        RESCALE(2),       // (inMax, outMax)
        GAMMA_ENCODE(2),  // (gamma, maxVal)
        CUSTOM(-1);

        final int paramCount;

        Operation(int paramCount) {
            this.paramCount = paramCount;
        }
    }

    private final Operation operation;
    private final String name;
    private final BayerPhase phase;
    private final double[] params;
    private final StepFunction function;

    private ProcessingStep(Operation operation, String name, BayerPhase phase, double[] params, StepFunction function) {
        this.operation = operation;
        this.name = name;
        this.phase = phase;
        this.params = params;
        this.function = function;
    }

    public static ProcessingStep demosaic(BayerPhase phase) {
        return of(Operation.DEMOSAIC, phase);
    }

    public static ProcessingStep rescale(double inMax, double outMax) {
        return of(Operation.RESCALE, inMax, outMax);
    }

    // gamma es el reciproco del valor habitual: 1/2.2 para una curva tipo sRGB
    public static ProcessingStep gammaEncode(double gamma, double maxVal) {
        return of(Operation.GAMMA_ENCODE, gamma, maxVal);
    }

    public static ProcessingStep custom(String name, StepFunction function, double... params) {
        if (function == null) throw new IllegalArgumentException("Paso '" + name + "' sin funcion");
        return new ProcessingStep(Operation.CUSTOM, name == null ? "custom" : name, null,
                params == null ? new double[0] : params.clone(), function);
    }

    /**
     * Construccion generica (operacion, parametros...). Rechaza pares mal formados:
     * numero o tipo de parametros incorrecto.
     */
    public static ProcessingStep of(Operation operation, Object... args) {
        if (operation == null) throw new IllegalArgumentException("Paso sin operacion");
        if (operation == Operation.CUSTOM)
            throw new IllegalArgumentException("Los pasos CUSTOM se crean con ProcessingStep.custom()");
        if (args == null || args.length != operation.paramCount)
            throw new IllegalArgumentException(operation + " espera " + operation.paramCount + " parametro(s), recibio "
                    + (args == null ? 0 : args.length));

        String name = operation.name().toLowerCase(Locale.ROOT);
        if (operation == Operation.DEMOSAIC) {
            Object p = args[0];
            BayerPhase phase;
            if (p instanceof BayerPhase) phase = (BayerPhase) p;
            else if (p instanceof String) phase = BayerPhase.fromString((String) p);
            else throw new IllegalArgumentException("DEMOSAIC espera una fase Bayer, no " + p);
            return new ProcessingStep(operation, name, phase, new double[0], null);
        }

        double[] values = new double[args.length];
        for (int i = 0; i < args.length; i++) {
            if (!(args[i] instanceof Number))
                throw new IllegalArgumentException(operation + " espera parametros numericos, no " + args[i]);
            values[i] = ((Number) args[i]).doubleValue();
            if (!Double.isFinite(values[i]))
                throw new IllegalArgumentException(operation + ": parametro no finito " + values[i]);
        }
        if (operation == Operation.RESCALE && values[0] == 0)
            throw new IllegalArgumentException("RESCALE con inMax = 0");
        if (operation == Operation.GAMMA_ENCODE && !(values[1] > 0))
            throw new IllegalArgumentException("GAMMA_ENCODE necesita maxVal > 0");
        return new ProcessingStep(operation, name, null, values, null);
    }

    public Operation getOperation() { return operation; }
    public String getName() { return name; }
    public BayerPhase getPhase() { return phase; }
    public double[] getParams() { return params.clone(); }
    StepFunction getFunction() { return function; }

    @Override
    public String toString() {
        return name + (phase != null ? "(" + phase.id() + ")" : Arrays.toString(params));
    }
}
