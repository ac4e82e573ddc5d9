package com.camsim.model;

import ij.measure.CurveFitter;
import java.util.Arrays;

/**
 * Polinomio radial de grado 3 o 5 sobre el radio normalizado [0, 1]
 * (1 = distancia del centro a la esquina mas lejana). Coeficientes de mayor a menor grado.
 */
public final class PolynomialCurve {

    public static final int INVERSE_DEGREE = 5;
    public static final int DISTORTION_SAMPLES = 10; // grado <= 5, 10 puntos sobran
    public static final int LCA_SAMPLES = 50;

    private final double[] coefficients;

    public PolynomialCurve(double... coefficients) {
        if (coefficients == null || (coefficients.length != 4 && coefficients.length != 6)) {
            throw new IllegalArgumentException("Se esperan 4 o 6 coeficientes (grado 3 o 5), no "
                    + (coefficients == null ? "null" : coefficients.length));
        }
        this.coefficients = coefficients.clone();
    }

    public static PolynomialCurve identity() { return new PolynomialCurve(0, 0, 1, 0); }

    public static PolynomialCurve zero() { return new PolynomialCurve(0, 0, 0, 0); }

    public int degree() { return coefficients.length - 1; }

    public double[] coefficients() { return coefficients.clone(); }

    // Horner
    public double evaluate(double x) {
        double y = 0;
        for (double c : coefficients) y = y * x + c;
        return y;
    }

    /**
     * Pasa una curva de desplazamiento relativo (LCA) a radio absoluto: desplazamiento 0
     * deja el radio igual, asi que basta sumar 1 al termino lineal.
     */
    public PolynomialCurve toAbsoluteRadius() {
        double[] c = coefficients.clone();
        c[c.length - 2] += 1.0;
        return new PolynomialCurve(c);
    }

    public PolynomialCurve invert() {
        return invert(DISTORTION_SAMPLES);
    }

    /**
     * Inversa aproximada de grado 5: muestrea la curva en [0,1] y ajusta por minimos
     * cuadrados los pares (salida, entrada). Solo tiene sentido para curvas monotonas;
     * no se valida.
     */
    public PolynomialCurve invert(int samples) {
        if (samples < INVERSE_DEGREE + 1)
            throw new IllegalArgumentException("Se necesitan al menos " + (INVERSE_DEGREE + 1) + " muestras");
        double[] r = new double[samples];
        double[] fr = new double[samples];
        for (int i = 0; i < samples; i++) {
            r[i] = (double) i / (samples - 1);
            fr[i] = evaluate(r[i]);
        }

        CurveFitter fitter = new CurveFitter(fr, r);
        fitter.doFit(CurveFitter.POLY5);

        // CurveFitter devuelve a + b*x + c*x^2 ... (menor grado primero)
        double[] p = fitter.getParams();
        double[] c = new double[INVERSE_DEGREE + 1];
        for (int i = 0; i <= INVERSE_DEGREE; i++) c[INVERSE_DEGREE - i] = p[i];
        return new PolynomialCurve(c);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolynomialCurve)) return false;
        return Arrays.equals(coefficients, ((PolynomialCurve) o).coefficients);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(coefficients); }

    @Override
    public String toString() { return "PolynomialCurve" + Arrays.toString(coefficients); }
}
