package com.camsim.service;

import ij.process.FloatProcessor;

/**
 * Remuestreo sub-pixel de un canal. Coordenadas en pixeles (centro del pixel en enteros,
 * x = columna, y = fila). Fuera de la imagen devuelve 0. La fuente es float, asi que
 * por encima de ~1e7 se pierde la parte fraccionaria.
 */
public interface Interpolator {

    double[] resample(FloatProcessor source, double[] xs, double[] ys);
}
