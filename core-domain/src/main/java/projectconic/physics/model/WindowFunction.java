package projectconic.physics.model;

import java.util.Arrays;

/**
 * Agregación aplicada sobre el contenido de una ventana completa.
 * <p>
 * Los NaN se propagan: una ventana con un valor ausente produce NaN.
 */
@FunctionalInterface
public interface WindowFunction {

    double apply(double[] window);

    WindowFunction MEAN = window -> {
        double sum = 0.0;
        for (double v : window) {
            sum += v;
        }
        return sum / window.length;
    };

    WindowFunction MEDIAN = window -> {
        for (double v : window) {
            if (Double.isNaN(v)) return Double.NaN;
        }
        double[] sorted = window.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return (sorted.length % 2 == 1) ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    };

    WindowFunction MIN = window -> {
        double min = Double.POSITIVE_INFINITY;
        for (double v : window) {
            if (Double.isNaN(v)) return Double.NaN;
            min = Math.min(min, v);
        }
        return min;
    };

    WindowFunction MAX = window -> {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : window) {
            if (Double.isNaN(v)) return Double.NaN;
            max = Math.max(max, v);
        }
        return max;
    };
}
