package projectconic.domain.sounding;

import lombok.Getter;
import projectconic.domain.exception.SchemaException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Instantánea inmutable de un sondeo CPTu en formato columnar.
 * <p>
 * Cada columna es un array de {@code double} con la misma longitud; el índice
 * del array es la posición del registro y se conserva en todas las etapas salvo
 * en las que eliminan filas explícitamente. Opcionalmente lleva la columna de
 * estado de convergencia, que no es numérica.
 * <p>
 * Ninguna operación modifica la instancia: todas devuelven una tabla nueva.
 * Los arrays se clonan a la entrada y a la salida, así que una tabla puede
 * compartirse entre hilos sin sincronización.
 */
public final class SoundingTable {

    @Getter
    private final int rowCount;
    private final Map<String, double[]> columns;
    private final ConvergenceStatus[] convergence;

    private SoundingTable(int rowCount, Map<String, double[]> columns, ConvergenceStatus[] convergence) {
        this.rowCount = rowCount;
        this.columns = columns;
        this.convergence = convergence;
    }

    /**
     * Construye una tabla a partir de columnas con nombre. El orden de iteración
     * del mapa define el orden de las columnas.
     *
     * @param columns Columnas de entrada (se copian).
     * @return Tabla nueva.
     * @throws IllegalArgumentException si las columnas no tienen la misma longitud.
     */
    public static SoundingTable of(Map<String, double[]> columns) {
        Objects.requireNonNull(columns, "Las columnas no pueden ser nulas.");
        int rows = -1;
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            double[] values = Objects.requireNonNull(entry.getValue(), "La columna " + entry.getKey() + " es nula.");
            if (rows >= 0 && values.length != rows) {
                throw new IllegalArgumentException(String.format(
                        "La columna '%s' tiene %d filas, se esperaban %d.", entry.getKey(), values.length, rows));
            }
            rows = values.length;
            copy.put(entry.getKey(), values.clone());
        }
        return new SoundingTable(Math.max(rows, 0), copy, null);
    }

    public static SoundingTable empty() {
        return new SoundingTable(0, new LinkedHashMap<>(), null);
    }

    // --- CONSULTA ---

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.keySet());
        if (convergence != null) {
            names.add(SoundingColumns.CONVERGENCE_FLAG);
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Nombres de las columnas numéricas, en orden de creación.
     */
    public List<String> getNumericColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        if (SoundingColumns.CONVERGENCE_FLAG.equals(name)) {
            return convergence != null;
        }
        return columns.containsKey(name);
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * @return Copia de la columna solicitada.
     * @throws SchemaException si la columna no existe.
     */
    public double[] getColumn(String name) {
        return requireColumn(name).clone();
    }

    public double getValue(String name, int row) {
        validateRowIndex(row);
        return requireColumn(name)[row];
    }

    /**
     * Valores numéricos de una fila, en el orden de {@link #getNumericColumnNames()}.
     */
    public double[] getRow(int row) {
        validateRowIndex(row);
        double[] values = new double[columns.size()];
        int c = 0;
        for (double[] column : columns.values()) {
            values[c++] = column[row];
        }
        return values;
    }

    public ConvergenceStatus[] getConvergence() {
        if (convergence == null) {
            throw SchemaException.missingColumn(SoundingColumns.CONVERGENCE_FLAG);
        }
        return convergence.clone();
    }

    public ConvergenceStatus getConvergenceAt(int row) {
        validateRowIndex(row);
        if (convergence == null) {
            throw SchemaException.missingColumn(SoundingColumns.CONVERGENCE_FLAG);
        }
        return convergence[row];
    }

    // --- TRANSFORMACIONES (devuelven tabla nueva) ---

    /**
     * Añade una columna al final o reemplaza la existente manteniendo su posición.
     */
    public SoundingTable withColumn(String name, double[] values) {
        Objects.requireNonNull(name, "El nombre de la columna no puede ser nulo.");
        Objects.requireNonNull(values, "Los valores de la columna no pueden ser nulos.");
        if (SoundingColumns.CONVERGENCE_FLAG.equals(name)) {
            throw new IllegalArgumentException("La columna de convergencia no es numérica, use withConvergence().");
        }
        if (!columns.isEmpty() && values.length != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "La columna '%s' tiene %d filas, la tabla tiene %d.", name, values.length, rowCount));
        }
        Map<String, double[]> next = new LinkedHashMap<>(columns);
        next.put(name, values.clone());
        return new SoundingTable(values.length, next, convergence);
    }

    public SoundingTable withConvergence(ConvergenceStatus[] status) {
        Objects.requireNonNull(status, "El estado de convergencia no puede ser nulo.");
        if (status.length != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "El estado de convergencia tiene %d filas, la tabla tiene %d.", status.length, rowCount));
        }
        return new SoundingTable(rowCount, columns, status.clone());
    }

    /**
     * Subconjunto ordenado de filas. Los índices deben ser válidos; se respetan
     * en el orden dado.
     */
    public SoundingTable selectRows(int[] rowIndices) {
        Map<String, double[]> next = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            double[] source = entry.getValue();
            double[] target = new double[rowIndices.length];
            for (int i = 0; i < rowIndices.length; i++) {
                target[i] = source[rowIndices[i]];
            }
            next.put(entry.getKey(), target);
        }
        ConvergenceStatus[] nextStatus = null;
        if (convergence != null) {
            nextStatus = new ConvergenceStatus[rowIndices.length];
            for (int i = 0; i < rowIndices.length; i++) {
                nextStatus[i] = convergence[rowIndices[i]];
            }
        }
        return new SoundingTable(rowIndices.length, next, nextStatus);
    }

    /**
     * Primeras {@code n} filas (o todas si hay menos).
     */
    public SoundingTable head(int n) {
        int limit = Math.max(0, Math.min(n, rowCount));
        int[] indices = new int[limit];
        for (int i = 0; i < limit; i++) {
            indices[i] = i;
        }
        return selectRows(indices);
    }

    // --- Helpers ---

    private double[] requireColumn(String name) {
        double[] column = columns.get(name);
        if (column == null) {
            throw SchemaException.missingColumn(name);
        }
        return column;
    }

    private void validateRowIndex(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Índice de fila fuera de rango: " + row + " (filas: " + rowCount + ")");
        }
    }

    /**
     * Igualdad por valor. Los NaN se consideran iguales entre sí (semántica de
     * {@link Arrays#equals(double[], double[])}).
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SoundingTable)) return false;
        SoundingTable other = (SoundingTable) o;
        if (rowCount != other.rowCount
                || !new ArrayList<>(columns.keySet()).equals(new ArrayList<>(other.columns.keySet()))) {
            return false;
        }
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.columns.get(entry.getKey()))) {
                return false;
            }
        }
        return Arrays.equals(convergence, other.convergence);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(rowCount, columns.keySet());
        for (double[] column : columns.values()) {
            result = 31 * result + Arrays.hashCode(column);
        }
        return 31 * result + Arrays.hashCode(convergence);
    }

    /**
     * Vista previa de hasta 8 filas, pensada para logs.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SoundingTable[").append(rowCount).append(" filas x ")
                .append(getColumnNames().size()).append(" columnas]\n");
        sb.append(String.join(" | ", getColumnNames())).append('\n');
        int preview = Math.min(rowCount, 8);
        for (int r = 0; r < preview; r++) {
            List<String> cells = new ArrayList<>();
            for (double[] column : columns.values()) {
                cells.add(String.format("%.4f", column[r]));
            }
            if (convergence != null) {
                cells.add(String.valueOf(convergence[r]));
            }
            sb.append(String.join(" | ", cells)).append('\n');
        }
        if (rowCount > preview) {
            sb.append("... (").append(rowCount - preview).append(" filas más)\n");
        }
        return sb.toString();
    }
}
