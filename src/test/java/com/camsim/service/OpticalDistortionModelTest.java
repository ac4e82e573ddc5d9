package com.camsim.service;

import com.camsim.model.ImageData;
import com.camsim.model.PixelType;
import com.camsim.model.PolynomialCurve;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.*;

class OpticalDistortionModelTest {

    // Rampa suave distinta por canal
    private static ImageData ramp(int h, int w) {
        ImageData img = new ImageData(h, w, 3, PixelType.DOUBLE);
        for (int c = 0; c < 3; c++)
            for (int y = 0; y < h; y++)
                for (int x = 0; x < w; x++) img.set(y, x, c, 10 + (c + 1) * x + 3 * y);
        return img;
    }

    private static void assertClose(ImageData expected, ImageData actual, double tol) {
        assertEquals(expected.getHeight(), actual.getHeight());
        assertEquals(expected.getWidth(), actual.getWidth());
        assertEquals(expected.getChannels(), actual.getChannels());
        for (int c = 0; c < expected.getChannels(); c++)
            for (int y = 0; y < expected.getHeight(); y++)
                for (int x = 0; x < expected.getWidth(); x++)
                    assertEquals(expected.get(y, x, c), actual.get(y, x, c), tol, "(" + y + "," + x + "," + c + ")");
    }

    @Test
    void neutralLensIsIdentity() {
        ImageData scene = ramp(17, 24);
        ImageData out = new OpticalDistortionModel().apply(scene);
        assertEquals(PixelType.DOUBLE, out.getType());
        assertClose(scene, out, 1e-2);
    }

    @Test
    void identityCurvesStayIdentityWithOffsetCenter() {
        ImageData scene = ramp(15, 20);
        OpticalDistortionModel lens = new OpticalDistortionModel(PolynomialCurve.identity(),
                PolynomialCurve.zero(), PolynomialCurve.zero(), 3.5, -2.0, 0);
        assertClose(scene, lens.apply(scene), 1e-2);
    }

    static Stream<double[]> distortionCurves() {
        return Stream.of(
                new double[] { 0.2, 0, 1.0, 0 },           // cojin
                new double[] { -0.15, 0, 1.0, 0 },         // barril
                new double[] { 0.05, 0, -0.1, 0, 1.0, 0 }  // grado 5
        );
    }

    @ParameterizedTest
    @MethodSource("distortionCurves")
    void cornersStayPinnedUnderDistortion(double[] coefficients) {
        ImageData scene = ramp(21, 31);
        OpticalDistortionModel lens = new OpticalDistortionModel();
        lens.setDistortion(new PolynomialCurve(coefficients));
        ImageData out = lens.apply(scene);

        int[][] corners = { { 0, 0 }, { 0, 30 }, { 20, 0 }, { 20, 30 } };
        for (int[] p : corners) {
            for (int c = 0; c < 3; c++) {
                assertEquals(scene.get(p[0], p[1], c), out.get(p[0], p[1], c), 0.1,
                        "esquina (" + p[0] + "," + p[1] + ") canal " + c);
            }
        }
    }

    @Test
    void distortionKeepsCenterAndMovesIntermediatePoints() {
        ImageData scene = ramp(21, 31);
        OpticalDistortionModel lens = new OpticalDistortionModel();
        lens.setDistortion(new PolynomialCurve(0.2, 0, 1.0, 0));
        ImageData out = lens.apply(scene);

        assertEquals(scene.get(10, 15, 1), out.get(10, 15, 1), 2e-2);
        assertNotEquals(scene.get(5, 5, 1), out.get(5, 5, 1), 0.05);
    }

    @Test
    void opticalCenterOffsetMovesFixedPoint() {
        ImageData scene = ramp(21, 31);
        double dx = 6, dy = 4;
        OpticalDistortionModel lens = new OpticalDistortionModel(new PolynomialCurve(0.3, 0, 1.0, 0),
                PolynomialCurve.zero(), PolynomialCurve.zero(), dx, dy, 0);
        ImageData out = lens.apply(scene);

        // el punto fijo pasa a (fila (H-1)/2 + dy, columna (W-1)/2 + dx)
        int row = 10 + (int) dy;
        int col = 15 + (int) dx;
        for (int c = 0; c < 3; c++)
            assertEquals(scene.get(row, col, c), out.get(row, col, c), 2e-2, "canal " + c);

        // y el centro geometrico ya no es fijo
        assertNotEquals(scene.get(10, 15, 1), out.get(10, 15, 1), 1.0);
    }

    @Test
    void lateralChromaticAberrationMovesRedAndBlueOnly() {
        ImageData scene = ramp(21, 31);
        OpticalDistortionModel lens = new OpticalDistortionModel();
        lens.setLcaRedGreen(new PolynomialCurve(0.03, 0, -0.005, 0));
        lens.setLcaBlueGreen(new PolynomialCurve(-0.01, 0, 0.02, 0));
        ImageData out = lens.apply(scene);

        assertEquals(scene.get(3, 4, 1), out.get(3, 4, 1), 1e-2);
        assertNotEquals(scene.get(3, 4, 0), out.get(3, 4, 0), 1e-2);
        assertNotEquals(scene.get(3, 4, 2), out.get(3, 4, 2), 1e-2);
    }

    @Test
    void flareUsesChannelNormAsVeil() {
        ImageData scene = ramp(8, 8);
        double k = 0.1;
        OpticalDistortionModel lens = new OpticalDistortionModel();
        lens.setFlareConstant(k);
        ImageData out = lens.apply(scene);

        for (int c = 0; c < 3; c++) {
            double veil = k * scene.channelNorm(c) / 8.0;
            assertEquals(scene.get(2, 5, c) * (1 - k) + veil, out.get(2, 5, c), 1e-2);
        }
    }

    @Test
    void flareOnUniformSceneKeepsLevel() {
        ImageData scene = ImageData.uniform(6, 9, 3, 40.0);
        OpticalDistortionModel lens = new OpticalDistortionModel();
        lens.setFlareConstant(0.5);
        assertClose(scene, lens.apply(scene), 1e-3);
    }

    @Test
    void passThroughReturnsRealCopy() {
        ImageData scene = ramp(4, 5).cast(PixelType.UINT16);
        ImageData out = OpticalDistortionModel.passThrough().apply(scene);
        assertEquals(PixelType.DOUBLE, out.getType());
        assertEquals(OpticalDistortionModel.Variant.PASS_THROUGH, OpticalDistortionModel.passThrough().getVariant());
        assertClose(scene, out, 0);
    }

    @Test
    void rejectsInvalidConfiguration() {
        OpticalDistortionModel lens = new OpticalDistortionModel();
        assertThrows(IllegalArgumentException.class, () -> lens.setFlareConstant(1.5));
        assertThrows(IllegalArgumentException.class, () -> lens.setFlareConstant(-0.1));
        assertThrows(IllegalArgumentException.class, () -> lens.setDistortion(null));
        assertThrows(IllegalArgumentException.class, () -> lens.setOpticalCenterOffset(Double.NaN, 0));
        assertThrows(IllegalArgumentException.class, () -> lens.apply(new ImageData(4, 4, 1, PixelType.DOUBLE)));
    }
}
