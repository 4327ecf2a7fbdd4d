package projectconic.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import projectconic.config.SoundingConfig;
import projectconic.domain.sounding.ConvergenceStatus;
import projectconic.domain.sounding.SoundingTable;
import projectconic.physics.solver.BehaviorSolver;

import java.util.stream.IntStream;

import static projectconic.domain.sounding.SoundingColumns.*;

/**
 * Índice de comportamiento del suelo con exponente de tensiones iterativo.
 * <p>
 * Cada registro se resuelve de forma independiente con
 * {@link BehaviorIndexEquations#solve}; qt se convierte de MPa a kPa antes de
 * iterar. La no convergencia se registra en {@code convergence_flag}, no es un error.
 */
@Slf4j
public class RobertsonBehaviorSolver implements BehaviorSolver {

    private static final int PARALLEL_THRESHOLD = 10_000;
    private static final double MPA_TO_KPA = 1000.0;

    @Override
    public String getName() {
        return "Robertson_IterativeExponent";
    }

    @Override
    public SoundingTable solveBehavior(SoundingTable table, SoundingConfig config) {
        final int n = table.getRowCount();
        final double[] sigmaVTot = table.getColumn(SIGMA_V_TOT);
        final double[] sigmaVEff = table.getColumn(SIGMA_V_EFF);
        final double[] qt = table.getColumn(QT);
        final double[] fr = table.getColumn(FR);

        final double pRef = config.getReferencePressure();
        final int maxIter = config.getMaxIter();
        final double tolerance = config.getTolerance();

        final double[] nExponent = new double[n];
        final double[] qtn = new double[n];
        final double[] ic = new double[n];
        final ConvergenceStatus[] status = new ConvergenceStatus[n];

        if (config.isParallelExecution() && n > PARALLEL_THRESHOLD) {
            IntStream.range(0, n).parallel().forEach(i ->
                    solveRow(i, qt, sigmaVTot, sigmaVEff, fr, pRef, maxIter, tolerance, nExponent, qtn, ic, status));
        } else {
            for (int i = 0; i < n; i++) {
                solveRow(i, qt, sigmaVTot, sigmaVEff, fr, pRef, maxIter, tolerance, nExponent, qtn, ic, status);
            }
        }

        SoundingTable out = table
                .withColumn(N_EXPONENT, nExponent)
                .withColumn(QTN, qtn)
                .withColumn(IC, ic)
                .withConvergence(status);

        if (config.isComputeSecondaryIndices()) {
            double[] cd = new double[n];
            double[] ib = new double[n];
            for (int i = 0; i < n; i++) {
                cd[i] = BehaviorIndexEquations.calculateCd(qtn[i], fr[i]);
                ib[i] = BehaviorIndexEquations.calculateIb(qtn[i], fr[i]);
            }
            out = out.withColumn(CD, cd).withColumn(IB, ib);
        }

        logSummary(status);
        return out;
    }

    private static void solveRow(int i, double[] qt, double[] sigmaVTot, double[] sigmaVEff, double[] fr,
                                 double pRef, int maxIter, double tolerance,
                                 double[] nOut, double[] qtnOut, double[] icOut, ConvergenceStatus[] statusOut) {
        BehaviorIndexEquations.RowSolution solution = BehaviorIndexEquations.solve(
                qt[i] * MPA_TO_KPA, sigmaVTot[i], sigmaVEff[i], fr[i], pRef, maxIter, tolerance);
        nOut[i] = solution.n();
        qtnOut[i] = solution.qtn();
        icOut[i] = solution.ic();
        statusOut[i] = solution.status();
    }

    private void logSummary(ConvergenceStatus[] status) {
        int converged = 0;
        int notConverged = 0;
        int notApplicable = 0;
        for (ConvergenceStatus s : status) {
            switch (s) {
                case CONVERGED -> converged++;
                case NOT_CONVERGED -> notConverged++;
                case NOT_APPLICABLE -> notApplicable++;
            }
        }
        log.info("[{}] Convergidos: {}, sin convergencia: {}, no aplicables: {}",
                getName(), converged, notConverged, notApplicable);
        if (notConverged > 0) {
            log.warn("[{}] {} registros agotaron el presupuesto de iteraciones.", getName(), notConverged);
        }
    }
}
