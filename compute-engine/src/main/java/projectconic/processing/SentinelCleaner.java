package projectconic.processing;

import lombok.extern.slf4j.Slf4j;
import projectconic.domain.sounding.SoundingColumns;
import projectconic.domain.sounding.SoundingTable;

import java.util.Arrays;
import java.util.List;

/**
 * Limpieza de registros marcados con códigos centinela (lecturas inválidas del sensor).
 * <p>
 * La coincidencia es horizontal (cualquier columna numérica de la fila) y por
 * igualdad exacta de coma flotante, sin tolerancia. Ninguna operación modifica
 * la tabla de entrada.
 */
@Slf4j
public class SentinelCleaner {

    /**
     * Elimina toda fila en la que algún valor coincide con algún indicador.
     * Las filas conservadas mantienen su orden relativo.
     */
    public SoundingTable removeRows(SoundingTable table, double[] indicators) {
        int[] kept = keptRows(table, indicators, false);
        logRemoval(table, kept.length);
        return table.selectRows(kept);
    }

    /**
     * En las filas con algún indicador, sustituye todos los valores salvo la
     * profundidad por {@code replacement}. La profundidad se mantiene como ancla
     * de trazabilidad; las filas sin coincidencia quedan intactas.
     */
    public SoundingTable replaceRows(SoundingTable table, double[] indicators, double replacement) {
        final int n = table.getRowCount();
        final List<String> names = table.getNumericColumnNames();
        final boolean[] flagged = new boolean[n];
        int flaggedCount = 0;
        for (int r = 0; r < n; r++) {
            flagged[r] = containsAny(table.getRow(r), indicators);
            if (flagged[r]) flaggedCount++;
        }
        if (flaggedCount == 0) {
            return table;
        }

        SoundingTable out = table;
        for (String name : names) {
            if (SoundingColumns.DEPTH.equals(name)) continue;
            double[] values = table.getColumn(name);
            for (int r = 0; r < n; r++) {
                if (flagged[r]) values[r] = replacement;
            }
            out = out.withColumn(name, values);
        }
        log.info("Sustituidos los valores de {} de {} registros por {}", flaggedCount, n, replacement);
        return out;
    }

    /**
     * Elimina toda fila con algún indicador o con algún valor ausente (NaN).
     */
    public SoundingTable removeIncompleteRows(SoundingTable table, double[] indicators) {
        int[] kept = keptRows(table, indicators, true);
        logRemoval(table, kept.length);
        return table.selectRows(kept);
    }

    // --- Helpers ---

    private static int[] keptRows(SoundingTable table, double[] indicators, boolean dropNaN) {
        final int n = table.getRowCount();
        int[] kept = new int[n];
        int count = 0;
        for (int r = 0; r < n; r++) {
            double[] row = table.getRow(r);
            if (containsAny(row, indicators) || (dropNaN && containsNaN(row))) continue;
            kept[count++] = r;
        }
        return Arrays.copyOf(kept, count);
    }

    static boolean containsAny(double[] row, double[] indicators) {
        for (double value : row) {
            for (double indicator : indicators) {
                if (value == indicator) return true;
            }
        }
        return false;
    }

    private static boolean containsNaN(double[] row) {
        for (double value : row) {
            if (Double.isNaN(value)) return true;
        }
        return false;
    }

    private static void logRemoval(SoundingTable table, int keptCount) {
        int removed = table.getRowCount() - keptCount;
        if (removed > 0) {
            log.warn("Eliminados {} de {} registros marcados como inválidos", removed, table.getRowCount());
        } else {
            log.debug("Ningún registro marcado como inválido ({} registros)", table.getRowCount());
        }
    }
}
