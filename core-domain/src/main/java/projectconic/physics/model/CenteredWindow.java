package projectconic.physics.model;

import java.util.Objects;

/**
 * Agregación sobre una ventana centrada de longitud impar.
 * <p>
 * Para cada registro {@code i} se agrega {@code [i - W/2, i + W/2]}. Los
 * {@code W/2} registros de cada extremo, donde la ventana completa no existe,
 * reciben NaN en lugar de una media parcial.
 * <p>
 * Stateless y Thread-Safe. Sólo lee vecinos: la salida de cada registro es
 * independiente del orden de cálculo.
 */
public final class CenteredWindow {

    private CenteredWindow() {}

    /**
     * @param values       Serie de entrada (no se modifica).
     * @param windowLength Longitud de la ventana, impar y mayor que cero.
     * @param function     Agregación a aplicar.
     * @return Serie nueva de la misma longitud.
     * @throws IllegalArgumentException si la ventana no es impar y positiva.
     */
    public static double[] apply(double[] values, int windowLength, WindowFunction function) {
        Objects.requireNonNull(values, "La serie no puede ser nula.");
        Objects.requireNonNull(function, "La función de agregación no puede ser nula.");
        if (windowLength < 1 || windowLength % 2 == 0) {
            throw new IllegalArgumentException("La ventana debe ser impar y positiva: " + windowLength);
        }
        if (windowLength == 1) {
            return values.clone();
        }

        final int n = values.length;
        final int half = windowLength / 2;
        final double[] result = new double[n];
        final double[] window = new double[windowLength];

        for (int i = 0; i < n; i++) {
            if (i < half || i >= n - half) {
                result[i] = Double.NaN;
                continue;
            }
            System.arraycopy(values, i - half, window, 0, windowLength);
            result[i] = function.apply(window);
        }
        return result;
    }

    public static double[] mean(double[] values, int windowLength) {
        return apply(values, windowLength, WindowFunction.MEAN);
    }
}
