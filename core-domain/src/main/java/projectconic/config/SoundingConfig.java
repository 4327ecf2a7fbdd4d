package projectconic.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import projectconic.domain.exception.InvalidConfigurationException;

import java.util.List;
import java.util.Set;

/**
 * Contenedor inmutable de todos los parámetros del procesado de un sondeo.
 * <p>
 * Se construye una sola vez (por código o desde JSON), se valida con
 * {@link #validate()} antes de procesar ninguna fila y después se comparte
 * entre todas las etapas y todos los hilos sin necesidad de sincronización.
 */
@Value
@Builder
@With
@Jacksonized
public class SoundingConfig {

    /** Ventanas de suavizado admitidas. */
    public static final Set<Integer> ALLOWED_ROLLING_WINDOWS = Set.of(1, 3, 5);

    /**
     * Relación de áreas del cono (a). Corrige la resistencia por presión intersticial.
     */
    @Builder.Default
    double areaRatio = 0.8;

    /**
     * Peso específico del terreno (kN/m³) para la tensión vertical total.
     */
    @Builder.Default
    double gammaSoil = 18.0;

    /**
     * Peso específico del agua (kN/m³). Sólo se usa si el fichero no trae u0.
     */
    @Builder.Default
    Double gammaW = 9.81;

    /**
     * Profundidad del nivel freático (m). Sólo se usa si el fichero no trae u0.
     */
    Double waterLevel;

    /**
     * Presión de referencia del solver (kPa). Típicamente la atmosférica.
     */
    @Builder.Default
    double referencePressure = 100.0;

    /**
     * Longitud de la ventana centrada de suavizado de fs y qt.
     */
    @Builder.Default
    int rollingWindow = 1;

    /**
     * Tope de iteraciones del exponente de tensiones.
     */
    @Builder.Default
    int maxIter = 999;

    /**
     * Umbral de convergencia del exponente de tensiones.
     */
    @Builder.Default
    double tolerance = 1e-3;

    /**
     * Calcula además los índices secundarios Cd e Ib.
     */
    @Builder.Default
    boolean computeSecondaryIndices = true;

    /**
     * Reparte el cálculo por filas en varios hilos (tablas grandes).
     */
    @Builder.Default
    boolean parallelExecution = false;

    @Builder.Default
    ColumnMapping columns = ColumnMapping.builder().build();

    @Builder.Default
    CleaningConfig cleaning = CleaningConfig.builder().build();

    @Builder.Default
    DepthAdjustmentConfig depthAdjustment = DepthAdjustmentConfig.builder().build();

    /**
     * Comprueba las restricciones de todos los parámetros.
     *
     * @return La propia configuración, para encadenar.
     * @throws InvalidConfigurationException con el primer parámetro inválido encontrado.
     */
    public SoundingConfig validate() {
        if (!Double.isFinite(areaRatio)) {
            throw new InvalidConfigurationException("area_ratio debe ser un número finito: " + areaRatio);
        }
        if (!(gammaSoil > 0)) {
            throw new InvalidConfigurationException("gamma_soil debe ser positivo: " + gammaSoil);
        }
        if (!(referencePressure > 0)) {
            throw new InvalidConfigurationException("P_ref debe ser positivo: " + referencePressure);
        }
        if (!ALLOWED_ROLLING_WINDOWS.contains(rollingWindow)) {
            throw new InvalidConfigurationException(
                    "rolling_window debe ser uno de " + ALLOWED_ROLLING_WINDOWS + ": " + rollingWindow);
        }
        if (maxIter < 1) {
            throw new InvalidConfigurationException("max_iter debe ser un entero positivo: " + maxIter);
        }
        if (!(tolerance > 0)) {
            throw new InvalidConfigurationException("tolerance debe ser positiva: " + tolerance);
        }
        if (columns == null || cleaning == null || depthAdjustment == null) {
            throw new InvalidConfigurationException("Las secciones columns, cleaning y depthAdjustment son obligatorias.");
        }
        columns.validate();
        cleaning.validate();
        depthAdjustment.validate();
        return this;
    }

    /**
     * Indica si están configurados los parámetros del cálculo hidrostático de u0.
     */
    public boolean hasHydrostaticParameters() {
        return gammaW != null && waterLevel != null;
    }

    /**
     * Configuración de referencia para pruebas: freático a 2 m, sin suavizado.
     */
    public static SoundingConfig getTestingSounding() {
        return SoundingConfig.builder()
                .areaRatio(0.8)
                .gammaSoil(18.0)
                .gammaW(9.81)
                .waterLevel(2.0)
                .referencePressure(100.0)
                .rollingWindow(1)
                .maxIter(999)
                .tolerance(1e-3)
                .build();
    }

    /**
     * Traducción de las cabeceras del fichero de campo a las columnas canónicas.
     */
    @Value
    @Builder
    @With
    @Jacksonized
    public static class ColumnMapping {
        @Builder.Default
        String depth = "Depth (m)";
        @Builder.Default
        String qc = "qc (MPa)";
        @Builder.Default
        String fs = "fs (kPa)";
        @Builder.Default
        String u2 = "u2 (kPa)";
        @Builder.Default
        String u0 = "u0 (kPa)";
        /** Separador de campos del texto delimitado. */
        @Builder.Default
        char separator = ',';

        void validate() {
            for (String header : List.of(nullToEmpty(depth), nullToEmpty(qc), nullToEmpty(fs), nullToEmpty(u2), nullToEmpty(u0))) {
                if (header.isBlank()) {
                    throw new InvalidConfigurationException("Los nombres de columna no pueden estar vacíos.");
                }
            }
        }

        private static String nullToEmpty(String s) {
            return s == null ? "" : s;
        }
    }

    /**
     * Estrategias de limpieza de filas marcadas con códigos centinela.
     */
    public enum CleaningMode {
        /** Elimina la fila completa. */
        REMOVE,
        /** Sustituye todos los valores salvo la profundidad. */
        REPLACE,
        /** Elimina filas con centinela o con cualquier valor NaN. */
        REMOVE_INCOMPLETE,
        /** No limpia. */
        NONE
    }

    @Value
    @Builder
    @With
    @Jacksonized
    public static class CleaningConfig {
        @Builder.Default
        CleaningMode mode = CleaningMode.REMOVE;

        /** Códigos centinela de lectura inválida. */
        @Builder.Default
        List<Double> indicators = List.of(-9999.0, -8888.0, -7777.0);

        /** Valor de sustitución para {@link CleaningMode#REPLACE}. */
        @Builder.Default
        double replacement = Double.NaN;

        public double[] indicatorValues() {
            return indicators.stream().mapToDouble(Double::doubleValue).toArray();
        }

        void validate() {
            if (mode == null) {
                throw new InvalidConfigurationException("cleaning.mode es obligatorio.");
            }
            if (mode != CleaningMode.NONE && (indicators == null || indicators.isEmpty())) {
                throw new InvalidConfigurationException("La limpieza requiere al menos un código centinela.");
            }
            if (indicators != null && indicators.stream().anyMatch(v -> v == null)) {
                throw new InvalidConfigurationException("Los códigos centinela no pueden ser nulos.");
            }
        }
    }

    /**
     * Regeneración opcional de la profundidad como progresión aritmética.
     * Si {@code startDepth} o {@code spacing} son nulos se infieren de los datos.
     */
    @Value
    @Builder
    @With
    @Jacksonized
    public static class DepthAdjustmentConfig {
        @Builder.Default
        boolean enabled = false;
        Double startDepth;
        Double spacing;

        void validate() {
            if (startDepth != null && !Double.isFinite(startDepth)) {
                throw new InvalidConfigurationException("depthAdjustment.startDepth debe ser finito: " + startDepth);
            }
            if (spacing != null && !Double.isFinite(spacing)) {
                throw new InvalidConfigurationException("depthAdjustment.spacing debe ser finito: " + spacing);
            }
        }
    }
}
