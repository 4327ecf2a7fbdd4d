package projectconic.processing;

import lombok.extern.slf4j.Slf4j;
import projectconic.domain.exception.InvalidDataException;
import projectconic.domain.sounding.SoundingColumns;
import projectconic.domain.sounding.SoundingTable;

/**
 * Regenera la profundidad como progresión aritmética regular:
 * {@code depth[i] = start + i * spacing}.
 * <p>
 * Por defecto {@code start} es la primera profundidad y {@code spacing} la media
 * de las diferencias sucesivas finitas. El espaciado se redondea siempre a 3
 * decimales. El resto de columnas no se toca.
 */
@Slf4j
public class DepthAdjuster {

    /**
     * @param table       Tabla de entrada.
     * @param startDepth  Profundidad inicial, o {@code null} para usar la primera existente.
     * @param spacing     Espaciado, o {@code null} para inferirlo.
     * @return Tabla nueva con la profundidad regularizada.
     * @throws InvalidDataException si la tabla está vacía, si tiene una sola fila
     *                              sin espaciado o si no hay diferencias finitas que promediar.
     */
    public SoundingTable adjustDepth(SoundingTable table, Double startDepth, Double spacing) {
        final int n = table.getRowCount();

        if (n == 0) {
            throw new InvalidDataException("No se puede ajustar la profundidad: la tabla está vacía.");
        }
        if (n == 1 && spacing == null) {
            throw new InvalidDataException("No se puede ajustar la profundidad: con un único registro "
                    + "el espaciado no puede inferirse.");
        }

        final double[] depth = table.getColumn(SoundingColumns.DEPTH);

        double start;
        if (startDepth != null) {
            start = startDepth;
        } else {
            start = depth[0];
            if (Double.isNaN(start)) {
                throw new InvalidDataException("No se puede ajustar la profundidad: el primer registro no tiene profundidad.");
            }
        }

        double step = roundToMillis(spacing != null ? spacing : inferSpacing(depth));

        double[] regular = new double[n];
        for (int i = 0; i < n; i++) {
            regular[i] = start + i * step;
        }

        log.info("Profundidad regularizada: inicio={} m, espaciado={} m, {} registros", start, step, n);
        return table.withColumn(SoundingColumns.DEPTH, regular);
    }

    /**
     * Media de las diferencias sucesivas, ignorando las que no son finitas.
     */
    static double inferSpacing(double[] depth) {
        double sum = 0.0;
        int count = 0;
        for (int i = 1; i < depth.length; i++) {
            double diff = depth[i] - depth[i - 1];
            if (Double.isFinite(diff)) {
                sum += diff;
                count++;
            }
        }
        if (count == 0) {
            throw new InvalidDataException("No se puede ajustar la profundidad: ninguna diferencia "
                    + "sucesiva es numérica para inferir el espaciado.");
        }
        return sum / count;
    }

    // Redondeo a 3 decimales, mitades lejos de cero
    static double roundToMillis(double value) {
        double scaled = value * 1000.0;
        return Math.signum(scaled) * Math.floor(Math.abs(scaled) + 0.5) / 1000.0;
    }
}
