package com.camsim.service;

import com.camsim.model.ImageData;

/**
 * Paso de pipeline definido por el usuario. La forma y el tipo de los datos intermedios
 * no estan garantizados: dependen de los pasos anteriores.
 */
@FunctionalInterface
public interface StepFunction {

    ImageData apply(ImageData data, double[] params);
}
