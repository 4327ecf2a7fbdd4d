package projectconic.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projectconic.config.SoundingConfig;
import projectconic.domain.sounding.SoundingTable;
import projectconic.physics.model.CenteredWindow;
import projectconic.physics.model.WindowFunction;
import projectconic.physics.solver.StressSolver;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

import static projectconic.domain.sounding.SoundingColumns.*;

/**
 * Tensiones verticales, resistencia corregida por presión intersticial y
 * ratios normalizados de fricción y presión intersticial.
 * <p>
 * <pre>
 * σv     = γ · z
 * σ'v    = σv - u0
 * qt     = qc + (1 - a) · u2 / 1000          (MPa)
 * Fr (%) = fs~ / (qt~ · 1000 - σv) · 100
 * Bq     = (u2 - u0) / (qt~ · 1000 - σv)
 * </pre>
 * donde {@code ~} indica la media móvil centrada de longitud {@code rollingWindow}
 * (identidad si es 1). Los denominadores nulos o negativos no se tratan: el
 * resultado sigue la aritmética IEEE 754.
 */
@Slf4j
public class CorrectedStressSolver implements StressSolver {

    /** Por debajo de este tamaño el reparto en hilos no compensa. */
    private static final int PARALLEL_THRESHOLD = 10_000;

    private final WindowFunction smoothingFunction;

    public CorrectedStressSolver() {
        this(WindowFunction.MEAN);
    }

    public CorrectedStressSolver(WindowFunction smoothingFunction) {
        this.smoothingFunction = smoothingFunction;
    }

    @Override
    public String getName() {
        return "CorrectedStress_CenteredSmoothing";
    }

    @Override
    public SoundingTable computeStresses(SoundingTable table, SoundingConfig config) {
        final int n = table.getRowCount();
        final double[] depth = table.getColumn(DEPTH);
        final double[] qc = table.getColumn(QC);
        final double[] fs = table.getColumn(FS);
        final double[] u2 = table.getColumn(U2);
        final double[] u0 = table.getColumn(U0);

        final double gamma = config.getGammaSoil();
        final double netAreaFactor = 1.0 - config.getAreaRatio();

        final double[] sigmaVTot = new double[n];
        final double[] sigmaVEff = new double[n];
        final double[] qt = new double[n];

        runRows(n, config, i -> {
            sigmaVTot[i] = gamma * depth[i];
            sigmaVEff[i] = sigmaVTot[i] - u0[i];
            qt[i] = qc[i] + netAreaFactor * u2[i] / 1000.0;
        });

        // Suavizado: única dependencia entre filas (vecindario de sólo lectura)
        final int window = config.getRollingWindow();
        final double[] fsSmoothed = CenteredWindow.apply(fs, window, smoothingFunction);
        final double[] qtSmoothed = CenteredWindow.apply(qt, window, smoothingFunction);

        final double[] fr = new double[n];
        final double[] bq = new double[n];

        runRows(n, config, i -> {
            double netResistance = qtSmoothed[i] * 1000.0 - sigmaVTot[i];
            fr[i] = fsSmoothed[i] / netResistance * 100.0;
            bq[i] = (u2[i] - u0[i]) / netResistance;
        });

        SoundingTable out = table
                .withColumn(SIGMA_V_TOT, sigmaVTot)
                .withColumn(SIGMA_V_EFF, sigmaVEff)
                .withColumn(QT, qt);
        if (window > 1) {
            out = out.withColumn(FS_SMOOTHED, fsSmoothed)
                    .withColumn(QT_SMOOTHED, qtSmoothed);
        }
        out = out.withColumn(FR, fr).withColumn(BQ, bq);

        log.debug("[{}] {} registros procesados (ventana={}, a={}, γ={})",
                getName(), n, window, config.getAreaRatio(), gamma);
        return out;
    }

    // Cada tarea escribe sólo en su propio índice: el orden de salida no depende del reparto
    private static void runRows(int n, SoundingConfig config, IntConsumer rowTask) {
        if (config.isParallelExecution() && n > PARALLEL_THRESHOLD) {
            IntStream.range(0, n).parallel().forEach(rowTask);
        } else {
            for (int i = 0; i < n; i++) {
                rowTask.accept(i);
            }
        }
    }
}
