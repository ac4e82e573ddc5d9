package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;

/** Reconstruccion de color a partir de datos CFA de un canal. */
public interface Demosaicer {

    ImageData demosaic(ImageData cfa, BayerPhase phase);
}
