package com.camsim.service;

import com.camsim.model.BayerPhase;
import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingPipelineTest {

    private static ImageData raw(double... values) {
        return new ImageData(1, values.length, 1, PixelType.UINT16, values.clone());
    }

    @Test
    void emptyPipelineOnlyCasts() {
        ImageData in = raw(0, 17, 300, 1023);
        ImageData same = ProcessingPipeline.passThrough(PixelType.UINT16).run(in);
        assertEquals(PixelType.UINT16, same.getType());
        assertArrayEquals(in.channel(0), same.channel(0));

        ImageData u8 = ProcessingPipeline.passThrough(PixelType.UINT8).run(in);
        assertArrayEquals(new double[] { 0, 17, 255, 255 }, u8.channel(0));
    }

    @Test
    void defaultPipelineTurnsFullScaleMosaicIntoWhite() {
        ImageData cfa = new ImageData(4, 4, 1, PixelType.UINT16);
        for (int y = 0; y < 4; y++) for (int x = 0; x < 4; x++) cfa.set(y, x, 0, 1023);
        ImageData out = new ProcessingPipeline().run(cfa);
        assertEquals(PixelType.UINT8, out.getType());
        assertEquals(3, out.getChannels());
        assertEquals(255.0, out.max());
        assertEquals(255.0, out.mean(), 1e-12);
    }

    @Test
    void defaultStepsAreDemosaicRescaleGamma() {
        List<ProcessingStep> steps = new ProcessingPipeline().getSteps();
        assertEquals(3, steps.size());
        assertEquals(ProcessingStep.Operation.DEMOSAIC, steps.get(0).getOperation());
        assertEquals(BayerPhase.GRBG, steps.get(0).getPhase());
        assertArrayEquals(new double[] { 1023, 255 }, steps.get(1).getParams());
        assertArrayEquals(new double[] { 1 / 2.2, 255 }, steps.get(2).getParams(), 1e-12);
    }

    @Test
    void rescaleAndGammaPreserveType() {
        ImageData scaled = ProcessingOperations.rescale(raw(1023, 512), 1023, 255);
        assertEquals(PixelType.UINT16, scaled.getType());
        assertArrayEquals(new double[] { 255, 128 }, scaled.channel(0));

        ImageData real = new ImageData(1, 2, 1, PixelType.DOUBLE, new double[] { 25, 100 });
        ImageData encoded = ProcessingOperations.gammaEncode(real, 0.5, 100);
        assertEquals(PixelType.DOUBLE, encoded.getType());
        assertArrayEquals(new double[] { 50, 100 }, encoded.channel(0), 1e-9);
    }

    @Test
    void demosaicRecoversFlatColorPerPhase() {
        for (BayerPhase phase : BayerPhase.values()) {
            ImageData cfa = new ImageData(6, 6, 1, PixelType.UINT16);
            double[] level = { 100, 50, 10 };
            for (int y = 0; y < 6; y++) for (int x = 0; x < 6; x++) cfa.set(y, x, 0, level[phase.channelAt(y, x)]);

            ImageData rgb = ProcessingOperations.demosaic(cfa, phase, new BilinearDemosaicer());
            assertEquals(PixelType.UINT16, rgb.getType());
            for (int c = 0; c < 3; c++) {
                for (int y = 0; y < 6; y++)
                    for (int x = 0; x < 6; x++)
                        assertEquals(level[c], rgb.get(y, x, c), 1e-9, phase.id() + " canal " + c);
            }
        }
    }

    @Test
    void customStepReceivesItsParameters() {
        StepFunction addConstant = (data, p) -> {
            ImageData out = data.withType(PixelType.DOUBLE);
            double[] plane = out.channel(0);
            for (int i = 0; i < plane.length; i++) plane[i] += p[0];
            out.setChannel(0, plane);
            return out;
        };
        ProcessingPipeline pipeline = new ProcessingPipeline(
                Arrays.asList(ProcessingStep.custom("offset", addConstant, 7), ProcessingStep.rescale(2, 1)),
                PixelType.UINT16);
        assertArrayEquals(new double[] { 5, 10 }, pipeline.run(raw(3, 13)).channel(0));
    }

    @Test
    void stepsRunInOrder() {
        List<String> trace = new ArrayList<>();
        StepFunction a = (d, p) -> { trace.add("a"); return d; };
        StepFunction b = (d, p) -> { trace.add("b"); return d; };
        new ProcessingPipeline(Arrays.asList(ProcessingStep.custom("a", a), ProcessingStep.custom("b", b))).run(raw(1));
        assertEquals(Arrays.asList("a", "b"), trace);
    }

    @Test
    void rejectsMalformedSteps() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessingPipeline(null));
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessingPipeline(Collections.singletonList((ProcessingStep) null)));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.of(ProcessingStep.Operation.RESCALE, 1023));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.of(ProcessingStep.Operation.RESCALE, "a", 2));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.of(ProcessingStep.Operation.DEMOSAIC, 3));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.of(ProcessingStep.Operation.DEMOSAIC, "xyzw"));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.of(ProcessingStep.Operation.CUSTOM));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.of(null, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.custom("nada", null));
        assertThrows(IllegalArgumentException.class, () -> ProcessingStep.rescale(0, 255));
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessingPipeline(Collections.<ProcessingStep>emptyList(), PixelType.DOUBLE));
    }

    @Test
    void genericFactoryAcceptsPhaseNames() {
        ProcessingStep s = ProcessingStep.of(ProcessingStep.Operation.DEMOSAIC, "bggr");
        assertEquals(BayerPhase.BGGR, s.getPhase());
        assertEquals("demosaic(bggr)", s.toString());
    }
}
