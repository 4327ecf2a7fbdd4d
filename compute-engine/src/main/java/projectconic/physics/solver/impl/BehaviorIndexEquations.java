package projectconic.physics.solver.impl;

import projectconic.domain.sounding.ConvergenceStatus;

/**
 * Biblioteca estática de ecuaciones de clasificación por comportamiento del suelo
 * (Robertson, exponente de tensiones variable).
 * <p>
 * Todas las magnitudes de presión en kPa. Los casos degenerados (logaritmo de un
 * valor no positivo, divisiones por cero) se propagan como NaN o infinito, nunca
 * se acotan.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class BehaviorIndexEquations {

    private static final double N_UPPER_BOUND = 1.0;
    private static final double N_INITIAL = 1.0;

    private BehaviorIndexEquations() {}

    /**
     * Resultado de la iteración para un registro.
     */
    public record RowSolution(double n, double qtn, double ic, ConvergenceStatus status) {

        static RowSolution notApplicable() {
            return new RowSolution(Double.NaN, Double.NaN, Double.NaN, ConvergenceStatus.NOT_APPLICABLE);
        }
    }

    /**
     * Resuelve el exponente n por punto fijo.
     * <p>
     * Parte de {@code n = 1} y realiza como mucho {@code maxIter - 1} pasos. El
     * criterio de parada compara el candidato siguiente con el actual
     * ({@code |n_k+1 - n_k| <= tolerance}); el candidato se acepta siempre. Qtn e
     * Ic finales se recalculan con el último n aceptado.
     *
     * @param qt        Resistencia corregida (kPa).
     * @param sigmaVTot Tensión vertical total (kPa).
     * @param sigmaVEff Tensión vertical efectiva (kPa).
     * @param fr        Ratio de fricción normalizado (%).
     * @param pRef      Presión de referencia (kPa).
     * @param maxIter   Tope de iteraciones (>= 1).
     * @param tolerance Umbral de convergencia.
     */
    public static RowSolution solve(double qt, double sigmaVTot, double sigmaVEff, double fr,
                                    double pRef, int maxIter, double tolerance) {
        // Fr negativo o ausente: no clasificable
        if (fr < 0.0 || Double.isNaN(fr)) {
            return RowSolution.notApplicable();
        }

        boolean converged = false;
        double nCurrent = N_INITIAL;

        for (int k = 0; k < maxIter - 1; k++) {
            double qtn = calculateQtn(nCurrent, qt, sigmaVTot, sigmaVEff, pRef);
            double ic = calculateIc(qtn, fr);
            double nNext = calculateN(ic, sigmaVEff, pRef);

            converged = Math.abs(nNext - nCurrent) <= tolerance;
            nCurrent = nNext;

            if (converged) break;
        }

        double qtn = calculateQtn(nCurrent, qt, sigmaVTot, sigmaVEff, pRef);
        double ic = calculateIc(qtn, fr);
        return new RowSolution(nCurrent, qtn, ic,
                converged ? ConvergenceStatus.CONVERGED : ConvergenceStatus.NOT_CONVERGED);
    }

    /**
     * Qtn = ((qt - σv) / Pa) · (Pa / σ'v)^n
     */
    public static double calculateQtn(double n, double qt, double sigmaVTot, double sigmaVEff, double pRef) {
        double cn = Math.pow(pRef / sigmaVEff, n);
        double qtTerm = (qt - sigmaVTot) / pRef;
        return qtTerm * cn;
    }

    /**
     * Ic = sqrt((3.47 - log Qtn)² + (log Fr + 1.22)²)
     */
    public static double calculateIc(double qtn, double fr) {
        double qtnTerm = 3.47 - Math.log10(qtn);
        double frTerm = Math.log10(fr) + 1.22;
        return Math.sqrt(qtnTerm * qtnTerm + frTerm * frTerm);
    }

    /**
     * n = min(1, 0.381·Ic + 0.05·(σ'v / Pa) - 0.15)
     * <p>
     * El mínimo ignora NaN (minNum de IEEE 754): si Ic no está definido, n = 1.
     */
    public static double calculateN(double ic, double sigmaVEff, double pRef) {
        double icTerm = 0.381 * ic;
        double stressTerm = 0.05 * (sigmaVEff / pRef);
        return minIgnoringNaN(N_UPPER_BOUND, icTerm + stressTerm - 0.15);
    }

    private static double minIgnoringNaN(double bound, double value) {
        return Double.isNaN(value) ? bound : Math.min(bound, value);
    }

    /**
     * Frontera contractivo-dilatante: Cd = (Qtn - 11) · (1 + 0.06·Fr)^17
     */
    public static double calculateCd(double qtn, double fr) {
        return (qtn - 11.0) * Math.pow(1.0 + 0.06 * fr, 17);
    }

    /**
     * Índice de comportamiento modificado: Ib = 100 · (Qtn + 10) / (70 + Qtn·Fr)
     */
    public static double calculateIb(double qtn, double fr) {
        return 100.0 * (qtn + 10.0) / (70.0 + qtn * fr);
    }
}
